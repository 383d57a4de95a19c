package com.github.challengeplatform.submissionengine.storage;

/**
 * A submission file was rejected. The message is shown to the submitting user.
 *
 * @author timo.buechert
 */
public class SubmissionValidationException extends Exception {

    public SubmissionValidationException(final String message) {
        super(message);
    }

}
