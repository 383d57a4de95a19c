package com.github.challengeplatform.submissionengine.api;

import com.github.challengeplatform.submissionengine.domain.CacheStats;
import com.github.challengeplatform.submissionengine.domain.ProgressEntry;
import com.github.challengeplatform.submissionengine.domain.QueueStats;
import com.github.challengeplatform.submissionengine.service.SubmissionService;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * @author timo.buechert
 */
@RestController
@RequestMapping("/api/monitoring")
public class MonitoringController {

    private final SubmissionService submissionService;

    public MonitoringController(final SubmissionService submissionService) {
        this.submissionService = submissionService;
    }

    @RequestMapping(value = "/cache", method = RequestMethod.GET)
    public CacheStats getCacheStats() {
        return submissionService.getCacheStats();
    }

    @RequestMapping(value = "/queue", method = RequestMethod.GET)
    public QueueStats getQueueStats() {
        return submissionService.getQueueStats();
    }

    @RequestMapping(value = "/active", method = RequestMethod.GET)
    public Map<String, ProgressEntry> getActiveSubmissions() {
        return submissionService.getActiveSubmissions();
    }

}
