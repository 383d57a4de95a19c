package com.github.challengeplatform.submissionengine.domain;

import lombok.Builder;

import java.time.Instant;

/**
 * Status of a submission as returned to polling clients. {@code status} is always one of the coarse values
 * {@code pending}, {@code processing}, {@code completed} or {@code failed}; the progress fields are only filled when
 * the answer came from the progress cache.
 *
 * @author timo.buechert
 */
@Builder
public record SubmissionStatusView(String submissionId, String status, String statusMessage,
                                   Integer progressPercentage, String currentStep, String errorDetails,
                                   String source, Instant updatedAt) {

    public static final String SOURCE_CACHE = "cache";

    public static final String SOURCE_DATABASE = "database";

}
