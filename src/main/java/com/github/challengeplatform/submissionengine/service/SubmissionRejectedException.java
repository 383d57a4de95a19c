package com.github.challengeplatform.submissionengine.service;

/**
 * The submission was recorded but the processing queue did not accept it.
 *
 * @author timo.buechert
 */
public class SubmissionRejectedException extends SubmissionServiceException {
    public SubmissionRejectedException(String message) {
        super(message);
    }
}
