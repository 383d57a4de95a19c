package com.github.challengeplatform.submissionengine.api;

import com.github.challengeplatform.submissionengine.domain.MetricScore;
import com.github.challengeplatform.submissionengine.domain.NewSubmission;
import com.github.challengeplatform.submissionengine.domain.SubmissionReceipt;
import com.github.challengeplatform.submissionengine.domain.SubmissionStatusView;
import com.github.challengeplatform.submissionengine.service.ChallengeNotFoundException;
import com.github.challengeplatform.submissionengine.service.SubmissionNotFoundException;
import com.github.challengeplatform.submissionengine.service.SubmissionRejectedException;
import com.github.challengeplatform.submissionengine.service.SubmissionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;

/**
 * @author timo.buechert
 */
@RestController
@RequestMapping("/api/submissions")
@Slf4j
public class SubmissionController {

    private final SubmissionService submissionService;

    public SubmissionController(final SubmissionService submissionService) {
        this.submissionService = submissionService;
    }

    @RequestMapping(method = RequestMethod.POST)
    @ResponseStatus(HttpStatus.ACCEPTED)
    public SubmissionReceipt createSubmission(@RequestParam("file") MultipartFile file,
                                              @RequestParam("userId") String userId,
                                              @RequestParam("modelId") String modelId,
                                              @RequestParam("challengeId") String challengeId,
                                              @RequestParam(value = "description", required = false) String description,
                                              @RequestParam(value = "priority", defaultValue = "0") int priority)
            throws IOException, ChallengeNotFoundException, SubmissionRejectedException {
        final NewSubmission newSubmission = NewSubmission.builder()
                .userId(userId)
                .modelId(modelId)
                .challengeId(challengeId)
                .description(description)
                .filename(file.getOriginalFilename())
                .content(file.getBytes())
                .priority(priority)
                .build();

        return submissionService.createSubmission(newSubmission);
    }

    @RequestMapping(value = "/{submissionId}/status", method = RequestMethod.GET)
    public SubmissionStatusView getStatus(@PathVariable("submissionId") String submissionId)
            throws SubmissionNotFoundException {
        return submissionService.getStatus(submissionId);
    }

    @RequestMapping(value = "/{submissionId}/progress", method = RequestMethod.GET)
    public SubmissionStatusView getProgress(@PathVariable("submissionId") String submissionId)
            throws SubmissionNotFoundException {
        return submissionService.getProgress(submissionId);
    }

    @RequestMapping(value = "/{submissionId}/results", method = RequestMethod.GET)
    public List<MetricScore> getResults(@PathVariable("submissionId") String submissionId)
            throws SubmissionNotFoundException {
        return submissionService.getResults(submissionId);
    }

}
