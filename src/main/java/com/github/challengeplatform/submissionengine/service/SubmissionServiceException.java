package com.github.challengeplatform.submissionengine.service;

/**
 * @author timo.buechert
 */
public class SubmissionServiceException extends Exception {

    public SubmissionServiceException(String message) {
        super(message);
    }

    public SubmissionServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
