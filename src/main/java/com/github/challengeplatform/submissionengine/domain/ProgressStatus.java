package com.github.challengeplatform.submissionengine.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Fine-grained processing status held in the progress cache. Intermediate states collapse to
 * {@link SubmissionStatus#PROCESSING} in the durable record.
 *
 * @author timo.buechert
 */
public enum ProgressStatus {
    PENDING,
    PROCESSING,
    UPLOADING,
    VALIDATING,
    EVALUATING,
    COMPLETED,
    FAILED;

    public boolean isFinal() {
        return this == COMPLETED || this == FAILED;
    }

    public SubmissionStatus toSubmissionStatus() {
        return switch (this) {
            case PENDING -> SubmissionStatus.PENDING;
            case PROCESSING, UPLOADING, VALIDATING, EVALUATING -> SubmissionStatus.PROCESSING;
            case COMPLETED -> SubmissionStatus.COMPLETED;
            case FAILED -> SubmissionStatus.FAILED;
        };
    }

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

}
