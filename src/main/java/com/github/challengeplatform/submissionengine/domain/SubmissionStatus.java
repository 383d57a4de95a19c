package com.github.challengeplatform.submissionengine.domain;

/**
 * Coarse status of a submission as persisted and reported to clients.
 *
 * @author timo.buechert
 */
public enum SubmissionStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED;

    public boolean isFinal() {
        return this == COMPLETED || this == FAILED;
    }

    public String value() {
        return name().toLowerCase();
    }

}
