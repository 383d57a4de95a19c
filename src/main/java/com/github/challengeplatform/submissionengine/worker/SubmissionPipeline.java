package com.github.challengeplatform.submissionengine.worker;

import com.github.challengeplatform.submissionengine.cache.ProgressCache;
import com.github.challengeplatform.submissionengine.domain.DatasetRecord;
import com.github.challengeplatform.submissionengine.domain.EvaluationResult;
import com.github.challengeplatform.submissionengine.domain.ProgressStatus;
import com.github.challengeplatform.submissionengine.domain.SubmissionTask;
import com.github.challengeplatform.submissionengine.domain.UploadContext;
import com.github.challengeplatform.submissionengine.domain.UploadResult;
import com.github.challengeplatform.submissionengine.evaluation.SubmissionEvaluator;
import com.github.challengeplatform.submissionengine.service.SubmissionRecordService;
import com.github.challengeplatform.submissionengine.storage.GroundTruthFetcher;
import com.github.challengeplatform.submissionengine.storage.SubmissionUploader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

/**
 * Drives one submission through upload, validation and evaluation. Stages only move forward; a failed stage ends
 * the task and is never retried. Each transition is written to the progress cache first and then to the
 * submission record.
 *
 * @author timo.buechert
 */
@Service
@Slf4j
public class SubmissionPipeline {

    static final String STEP_WORKER_STARTED = "Worker Started";

    static final String STEP_UPLOAD = "File Upload & Validation";

    static final String STEP_STARTING_EVALUATION = "Starting Evaluation";

    static final String STEP_EVALUATING = "Evaluation in Progress";

    static final String STEP_COMPLETED = "Completed";

    static final String STEP_FAILED = "Failed";

    static final String STEP_ERROR = "Error";

    static final int PROGRESS_STARTED = 10;

    static final int PROGRESS_UPLOADING = 30;

    static final int PROGRESS_UPLOADED = 60;

    static final int PROGRESS_EVALUATING = 80;

    static final int PROGRESS_COMPLETED = 100;

    static final int PROGRESS_FAILED = 0;

    private final ProgressCache progressCache;

    private final SubmissionRecordService recordService;

    private final SubmissionUploader uploader;

    private final GroundTruthFetcher groundTruthFetcher;

    private final SubmissionEvaluator evaluator;

    private final Duration stageTimeout;

    public SubmissionPipeline(final ProgressCache progressCache,
                              final SubmissionRecordService recordService,
                              final SubmissionUploader uploader,
                              final GroundTruthFetcher groundTruthFetcher,
                              final SubmissionEvaluator evaluator,
                              @Value("${submission.worker.stage-timeout:PT10M}") final Duration stageTimeout) {
        this.progressCache = progressCache;
        this.recordService = recordService;
        this.uploader = uploader;
        this.groundTruthFetcher = groundTruthFetcher;
        this.evaluator = evaluator;
        this.stageTimeout = stageTimeout;
    }

    /**
     * Processes a task to a terminal state. Does not throw; every failure ends as a failed submission.
     */
    public void process(final SubmissionTask task, final int workerId) {
        final String submissionId = task.submissionId();

        try (TaskScope scope = new TaskScope(submissionId, stageTimeout)) {
            log.info("Worker {} processing submission {}", workerId, submissionId);
            progressCache.set(submissionId, ProgressStatus.PROCESSING,
                    "Worker " + workerId + " started processing...", PROGRESS_STARTED, STEP_WORKER_STARTED);

            if (recordService.findSubmission(submissionId).isEmpty()) {
                final String error = "Submission " + submissionId + " not found";
                log.error("Worker {}: {}", workerId, error);
                progressCache.set(submissionId, ProgressStatus.FAILED, "Submission not found in database",
                        PROGRESS_FAILED, STEP_ERROR, error);
                return;
            }
            recordService.markProcessing(submissionId, "Processing by worker " + workerId + "...");

            final UploadResult upload = upload(task, scope, workerId);
            if (upload == null) {
                return;
            }

            progressCache.set(submissionId, ProgressStatus.PROCESSING,
                    "File uploaded successfully. Starting evaluation...", PROGRESS_UPLOADED, STEP_STARTING_EVALUATION);
            recordService.assignDatasetUrl(submissionId, upload.referenceUrl(),
                    "File uploaded successfully. Running evaluation...");

            evaluate(task, upload.records(), scope, workerId);
        } catch (final Exception e) {
            final String error = "Worker " + workerId + " processing error: " + describe(e);
            log.error(error, e);
            progressCache.set(submissionId, ProgressStatus.FAILED, "Unexpected processing error",
                    PROGRESS_FAILED, STEP_FAILED, error);
            markFailedQuietly(submissionId, error, workerId);
        }
    }

    /**
     * @return the upload result, or null if the submission was failed
     */
    private UploadResult upload(final SubmissionTask task, final TaskScope scope, final int workerId) {
        final String submissionId = task.submissionId();
        progressCache.set(submissionId, ProgressStatus.UPLOADING, "Uploading and validating file...",
                PROGRESS_UPLOADING, STEP_UPLOAD);

        String failure;
        try {
            final UploadResult upload = scope.run("File upload",
                    () -> uploader.uploadAndValidate(task.fileContent(), task.filename(), UploadContext.of(task)));
            if (upload.ok()) {
                return upload;
            }
            failure = upload.message();
        } catch (final Exception e) {
            log.error("Worker {}: upload of submission {} failed", workerId, submissionId, e);
            failure = describe(e);
        }

        final String error = "File processing failed: " + failure;
        log.error("Worker {}: {}", workerId, error);
        progressCache.set(submissionId, ProgressStatus.FAILED, "File upload or validation failed",
                PROGRESS_FAILED, STEP_FAILED, error);
        recordService.markFailed(submissionId, error);
        return null;
    }

    private void evaluate(final SubmissionTask task, final List<DatasetRecord> predictions, final TaskScope scope,
                          final int workerId) {
        final String submissionId = task.submissionId();
        progressCache.set(submissionId, ProgressStatus.EVALUATING, "Running automatic evaluation...",
                PROGRESS_EVALUATING, STEP_EVALUATING);

        try {
            final List<DatasetRecord> groundTruth = scope.run("Ground truth download",
                    () -> groundTruthFetcher.fetch(task.groundTruthUrl()));
            final EvaluationResult result = evaluator.evaluate(groundTruth, predictions);
            recordService.saveResults(submissionId, task.userId(), result);
        } catch (final Exception e) {
            final String error = "Evaluation error: " + describe(e);
            log.error("Worker {}: {}", workerId, error, e);
            progressCache.set(submissionId, ProgressStatus.FAILED, "Evaluation error occurred",
                    PROGRESS_FAILED, STEP_FAILED, error);
            recordService.markFailed(submissionId, error);
            return;
        }

        progressCache.set(submissionId, ProgressStatus.COMPLETED,
                "Evaluation completed successfully by worker " + workerId, PROGRESS_COMPLETED, STEP_COMPLETED);
        recordService.markCompleted(submissionId, "Evaluation completed successfully");
        log.info("Worker {}: Completed submission {}", workerId, submissionId);
    }

    private static String describe(final Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private void markFailedQuietly(final String submissionId, final String error, final int workerId) {
        try {
            recordService.markFailed(submissionId, error);
        } catch (final RuntimeException dbError) {
            log.error("Worker {}: Failed to update submission status of {}: {}", workerId, submissionId,
                    dbError.getMessage());
        }
    }

}
