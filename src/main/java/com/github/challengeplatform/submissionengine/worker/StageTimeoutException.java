package com.github.challengeplatform.submissionengine.worker;

/**
 * @author timo.buechert
 */
public class StageTimeoutException extends Exception {

    public StageTimeoutException(final String message) {
        super(message);
    }

}
