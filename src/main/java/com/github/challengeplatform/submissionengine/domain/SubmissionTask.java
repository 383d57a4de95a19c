package com.github.challengeplatform.submissionengine.domain;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable unit of work carried from the API layer to a worker.
 *
 * @author timo.buechert
 */
public final class SubmissionTask {

    public static final int DEFAULT_PRIORITY = 0;

    /**
     * Sentinel pushed once per worker on shutdown. Sorts ahead of every queued task.
     */
    public static final SubmissionTask SHUTDOWN = new SubmissionTask("", new byte[0], "", "", "", "", "",
            Integer.MIN_VALUE);

    private final String submissionId;

    private final byte[] fileContent;

    private final String filename;

    private final String userId;

    private final String modelId;

    private final String challengeName;

    private final String groundTruthUrl;

    private final int priority;

    public SubmissionTask(final String submissionId, final byte[] fileContent, final String filename,
                          final String userId, final String modelId, final String challengeName,
                          final String groundTruthUrl, final int priority) {
        this.submissionId = Objects.requireNonNull(submissionId, "submissionId");
        this.fileContent = Objects.requireNonNull(fileContent, "fileContent").clone();
        this.filename = filename;
        this.userId = userId;
        this.modelId = modelId;
        this.challengeName = challengeName;
        this.groundTruthUrl = groundTruthUrl;
        this.priority = priority;
    }

    public SubmissionTask(final String submissionId, final byte[] fileContent, final String filename,
                          final String userId, final String modelId, final String challengeName,
                          final String groundTruthUrl) {
        this(submissionId, fileContent, filename, userId, modelId, challengeName, groundTruthUrl, DEFAULT_PRIORITY);
    }

    public String submissionId() {
        return submissionId;
    }

    public byte[] fileContent() {
        return fileContent.clone();
    }

    public String filename() {
        return filename;
    }

    public String userId() {
        return userId;
    }

    public String modelId() {
        return modelId;
    }

    public String challengeName() {
        return challengeName;
    }

    public String groundTruthUrl() {
        return groundTruthUrl;
    }

    public int priority() {
        return priority;
    }

    public boolean isShutdownSignal() {
        return this == SHUTDOWN;
    }

    @Override
    public String toString() {
        return "SubmissionTask{submissionId='" + submissionId + "', filename='" + filename + "', size="
                + fileContent.length + ", priority=" + priority + "}";
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SubmissionTask that)) {
            return false;
        }
        return priority == that.priority
                && submissionId.equals(that.submissionId)
                && Arrays.equals(fileContent, that.fileContent)
                && Objects.equals(filename, that.filename)
                && Objects.equals(userId, that.userId)
                && Objects.equals(modelId, that.modelId)
                && Objects.equals(challengeName, that.challengeName)
                && Objects.equals(groundTruthUrl, that.groundTruthUrl);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(submissionId, filename, userId, modelId, challengeName, groundTruthUrl, priority);
        result = 31 * result + Arrays.hashCode(fileContent);
        return result;
    }

}
