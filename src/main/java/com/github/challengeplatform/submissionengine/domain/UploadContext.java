package com.github.challengeplatform.submissionengine.domain;

/**
 * @author timo.buechert
 */
public record UploadContext(String submissionId, String userId, String modelId, String challengeName,
                            String groundTruthUrl) {

    public static UploadContext of(final SubmissionTask task) {
        return new UploadContext(task.submissionId(), task.userId(), task.modelId(), task.challengeName(),
                task.groundTruthUrl());
    }

}
