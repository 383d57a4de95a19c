package com.github.challengeplatform.submissionengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.transaction.annotation.EnableTransactionManagement;

@SpringBootApplication
@EnableTransactionManagement
public class SubmissionEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(SubmissionEngineApplication.class, args);
    }

}
