package com.github.challengeplatform.submissionengine.service;

/**
 * @author timo.buechert
 */
public class SubmissionNotFoundException extends SubmissionServiceException {
    public SubmissionNotFoundException(String submissionId) {
        super("Submission " + submissionId + " not found");
    }
}
