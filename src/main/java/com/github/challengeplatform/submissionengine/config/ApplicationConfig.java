package com.github.challengeplatform.submissionengine.config;

import com.github.challengeplatform.submissionengine.mapper.SubmissionViewMapper;
import com.github.challengeplatform.submissionengine.mapper.SubmissionViewMapperImpl;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestClient;

import java.time.Clock;

/**
 * @author timo.buechert
 */
@Configuration
@EnableScheduling
public class ApplicationConfig {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    RestClient restClient(final RestClient.Builder restClientBuilder) {
        return restClientBuilder.build();
    }

    @Bean
    SubmissionViewMapper submissionViewMapper() {
        return new SubmissionViewMapperImpl();
    }

    @Bean(name = "submissionWorkerExecutor")
    ThreadPoolTaskExecutor submissionWorkerExecutor(@Value("${submission.worker.count:2}") final int numberOfWorkers) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(numberOfWorkers);
        executor.setMaxPoolSize(numberOfWorkers);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("SubmissionWorker-");
        executor.initialize();
        return executor;
    }

}
