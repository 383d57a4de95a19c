package com.github.challengeplatform.submissionengine.domain;

import java.util.List;

/**
 * Outcome of validating and storing a submission file.
 *
 * @author timo.buechert
 */
public record UploadResult(boolean ok, String message, String referenceUrl, List<DatasetRecord> records) {

    public static UploadResult success(final String message, final String referenceUrl,
                                       final List<DatasetRecord> records) {
        return new UploadResult(true, message, referenceUrl, List.copyOf(records));
    }

    public static UploadResult failure(final String message) {
        return new UploadResult(false, message, "", List.of());
    }

}
