package com.github.challengeplatform.submissionengine.worker;

import com.github.challengeplatform.submissionengine.cache.ProgressCache;
import com.github.challengeplatform.submissionengine.domain.DatasetRecord;
import com.github.challengeplatform.submissionengine.domain.EvaluationResult;
import com.github.challengeplatform.submissionengine.domain.MetricType;
import com.github.challengeplatform.submissionengine.domain.ProgressEntry;
import com.github.challengeplatform.submissionengine.domain.ProgressStatus;
import com.github.challengeplatform.submissionengine.domain.SubmissionTask;
import com.github.challengeplatform.submissionengine.domain.UploadResult;
import com.github.challengeplatform.submissionengine.evaluation.CharacterErrorRate;
import com.github.challengeplatform.submissionengine.evaluation.SubmissionEvaluator;
import com.github.challengeplatform.submissionengine.evaluation.UnicodeTextNormalizer;
import com.github.challengeplatform.submissionengine.evaluation.WordErrorRate;
import com.github.challengeplatform.submissionengine.persistence.SubmissionEntity;
import com.github.challengeplatform.submissionengine.service.SubmissionRecordService;
import com.github.challengeplatform.submissionengine.storage.GroundTruthFetcher;
import com.github.challengeplatform.submissionengine.storage.StorageException;
import com.github.challengeplatform.submissionengine.storage.SubmissionUploader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * @author timo.buechert
 */
@ExtendWith(MockitoExtension.class)
class SubmissionPipelineTest {

    private static final String SUBMISSION_ID = "sub-1";

    private static final String GROUND_TRUTH_URL = "http://storage.local/truth.json";

    private static final String DATASET_URL = "http://localhost:9000/submissions/ocr/sub-1.json";

    private static final List<DatasetRecord> PREDICTIONS = List.of(new DatasetRecord("a.png", "hello"),
            new DatasetRecord("b.png", "word"));

    private static final List<DatasetRecord> GROUND_TRUTH = List.of(new DatasetRecord("a.png", "hello"),
            new DatasetRecord("b.png", "world"));

    @Mock
    SubmissionRecordService recordService;

    @Mock
    SubmissionUploader uploader;

    @Mock
    GroundTruthFetcher groundTruthFetcher;

    ProgressCache progressCache;

    SubmissionPipeline pipeline;

    @BeforeEach
    void setUp() {
        progressCache = new ProgressCache(Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC),
                Duration.ofHours(1));
        pipeline = createPipeline(Duration.ofSeconds(5));
    }

    private SubmissionPipeline createPipeline(final Duration stageTimeout) {
        final SubmissionEvaluator evaluator = new SubmissionEvaluator(
                List.of(new CharacterErrorRate(), new WordErrorRate()), new UnicodeTextNormalizer());
        return new SubmissionPipeline(progressCache, recordService, uploader, groundTruthFetcher, evaluator,
                stageTimeout);
    }

    private static SubmissionTask task() {
        return new SubmissionTask(SUBMISSION_ID, "[]".getBytes(StandardCharsets.UTF_8), "predictions.json",
                "user-1", "model-1", "OCR", GROUND_TRUTH_URL);
    }

    private void submissionExists() {
        when(recordService.findSubmission(SUBMISSION_ID)).thenReturn(Optional.of(new SubmissionEntity()));
    }

    @Test
    void process_validSubmission_completed() {
        // given
        submissionExists();
        when(uploader.uploadAndValidate(any(), eq("predictions.json"), any()))
                .thenReturn(UploadResult.success("File uploaded successfully", DATASET_URL, PREDICTIONS));
        when(groundTruthFetcher.fetch(GROUND_TRUTH_URL)).thenReturn(GROUND_TRUTH);

        // when
        pipeline.process(task(), 1);

        // then
        final ProgressEntry entry = progressCache.get(SUBMISSION_ID).orElseThrow();
        assertThat(entry.status()).isEqualTo(ProgressStatus.COMPLETED);
        assertThat(entry.progressPercentage()).isEqualTo(100);
        assertThat(entry.message()).isEqualTo("Evaluation completed successfully by worker 1");
        assertThat(entry.step()).isEqualTo("Completed");

        verify(recordService).markProcessing(SUBMISSION_ID, "Processing by worker 1...");
        verify(recordService).assignDatasetUrl(SUBMISSION_ID, DATASET_URL,
                "File uploaded successfully. Running evaluation...");
        verify(recordService).markCompleted(SUBMISSION_ID, "Evaluation completed successfully");
        verify(recordService, never()).markFailed(anyString(), anyString());

        final ArgumentCaptor<EvaluationResult> result = ArgumentCaptor.forClass(EvaluationResult.class);
        verify(recordService).saveResults(eq(SUBMISSION_ID), eq("user-1"), result.capture());
        assertThat(result.getValue().score(MetricType.CER)).isEqualTo(0.1);
        assertThat(result.getValue().score(MetricType.WER)).isEqualTo(0.5);
    }

    @Test
    void process_invalidFile_failedWithValidationMessage() {
        // given
        submissionExists();
        when(uploader.uploadAndValidate(any(), anyString(), any()))
                .thenReturn(UploadResult.failure("Only JSON files are allowed"));

        // when
        pipeline.process(task(), 2);

        // then
        final ProgressEntry entry = progressCache.get(SUBMISSION_ID).orElseThrow();
        assertThat(entry.status()).isEqualTo(ProgressStatus.FAILED);
        assertThat(entry.progressPercentage()).isZero();
        assertThat(entry.message()).isEqualTo("File upload or validation failed");
        assertThat(entry.errorDetails()).isEqualTo("File processing failed: Only JSON files are allowed");

        verify(recordService).markFailed(SUBMISSION_ID, "File processing failed: Only JSON files are allowed");
        verify(recordService, never()).saveResults(anyString(), anyString(), any());
        verify(groundTruthFetcher, never()).fetch(anyString());
    }

    @Test
    void process_uploadThrowsWithoutMessage_failedWithExceptionName() {
        // given
        submissionExists();
        when(uploader.uploadAndValidate(any(), anyString(), any())).thenThrow(new IllegalStateException());

        // when
        pipeline.process(task(), 1);

        // then
        final ProgressEntry entry = progressCache.get(SUBMISSION_ID).orElseThrow();
        assertThat(entry.status()).isEqualTo(ProgressStatus.FAILED);
        assertThat(entry.errorDetails()).isEqualTo("File processing failed: IllegalStateException");
        verify(recordService).markFailed(SUBMISSION_ID, "File processing failed: IllegalStateException");
    }

    @Test
    void process_missingRecord_failedInCacheOnly() {
        // given
        when(recordService.findSubmission(SUBMISSION_ID)).thenReturn(Optional.empty());

        // when
        pipeline.process(task(), 1);

        // then
        final ProgressEntry entry = progressCache.get(SUBMISSION_ID).orElseThrow();
        assertThat(entry.status()).isEqualTo(ProgressStatus.FAILED);
        assertThat(entry.message()).isEqualTo("Submission not found in database");
        assertThat(entry.step()).isEqualTo("Error");
        assertThat(entry.errorDetails()).isEqualTo("Submission sub-1 not found");

        verify(recordService, never()).markFailed(anyString(), anyString());
        verify(uploader, never()).uploadAndValidate(any(), any(), any());
    }

    @Test
    void process_uploadStalls_failedAfterStageTimeout() {
        // given
        pipeline = createPipeline(Duration.ofMillis(200));
        submissionExists();
        when(uploader.uploadAndValidate(any(), anyString(), any())).thenAnswer(invocation -> {
            Thread.sleep(10_000);
            return UploadResult.success("File uploaded successfully", DATASET_URL, PREDICTIONS);
        });

        // when
        final long start = System.nanoTime();
        pipeline.process(task(), 1);
        final Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

        // then
        assertThat(elapsed).isLessThan(Duration.ofSeconds(5));
        final ProgressEntry entry = progressCache.get(SUBMISSION_ID).orElseThrow();
        assertThat(entry.status()).isEqualTo(ProgressStatus.FAILED);
        assertThat(entry.errorDetails()).isEqualTo("File processing failed: File upload timed out after PT0.2S");
        verify(recordService).markFailed(SUBMISSION_ID, "File processing failed: File upload timed out after PT0.2S");
    }

    @Test
    void process_groundTruthUnavailable_failedWithEvaluationError() {
        // given
        submissionExists();
        when(uploader.uploadAndValidate(any(), anyString(), any()))
                .thenReturn(UploadResult.success("File uploaded successfully", DATASET_URL, PREDICTIONS));
        when(groundTruthFetcher.fetch(GROUND_TRUTH_URL)).thenThrow(new StorageException("404 Not Found"));

        // when
        pipeline.process(task(), 1);

        // then
        final ProgressEntry entry = progressCache.get(SUBMISSION_ID).orElseThrow();
        assertThat(entry.status()).isEqualTo(ProgressStatus.FAILED);
        assertThat(entry.message()).isEqualTo("Evaluation error occurred");
        assertThat(entry.errorDetails()).isEqualTo("Evaluation error: 404 Not Found");

        verify(recordService).markFailed(SUBMISSION_ID, "Evaluation error: 404 Not Found");
        verify(recordService, never()).saveResults(anyString(), anyString(), any());
        verify(recordService, never()).markCompleted(anyString(), anyString());
    }

    @Test
    void process_databaseFailure_failedAsUnexpectedError() {
        // given
        submissionExists();
        doThrow(new IllegalStateException("connection lost")).when(recordService)
                .markProcessing(eq(SUBMISSION_ID), anyString());

        // when
        pipeline.process(task(), 3);

        // then
        final ProgressEntry entry = progressCache.get(SUBMISSION_ID).orElseThrow();
        assertThat(entry.status()).isEqualTo(ProgressStatus.FAILED);
        assertThat(entry.message()).isEqualTo("Unexpected processing error");
        assertThat(entry.errorDetails()).isEqualTo("Worker 3 processing error: connection lost");
        verify(recordService).markFailed(SUBMISSION_ID, "Worker 3 processing error: connection lost");
    }

}
