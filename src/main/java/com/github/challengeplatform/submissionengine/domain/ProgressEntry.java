package com.github.challengeplatform.submissionengine.domain;

import java.time.Instant;

/**
 * Snapshot of the cached progress of one submission. Instances are never modified; the cache swaps in a new
 * snapshot on every update.
 *
 * @author timo.buechert
 */
public record ProgressEntry(String submissionId, ProgressStatus status, String message, int progressPercentage,
                            String step, String errorDetails, Instant startedAt, Instant updatedAt) {

    public static final int MIN_PROGRESS = 0;

    public static final int MAX_PROGRESS = 100;

    public ProgressEntry {
        progressPercentage = clampProgress(progressPercentage);
    }

    public static ProgressEntry create(final String submissionId, final ProgressStatus status, final String message,
                                       final int progress, final String step, final String error,
                                       final Instant now) {
        return new ProgressEntry(submissionId, status, message, progress, step, error, now, now);
    }

    public ProgressEntry update(final ProgressStatus status, final String message, final int progress,
                                final String step, final String error, final Instant now) {
        return new ProgressEntry(this.submissionId, status, message, progress, step, error, this.startedAt, now);
    }

    public boolean isFinal() {
        return status.isFinal();
    }

    public static int clampProgress(final int progress) {
        return Math.max(MIN_PROGRESS, Math.min(MAX_PROGRESS, progress));
    }

}
