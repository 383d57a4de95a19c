package com.github.challengeplatform.submissionengine.service;

import com.github.challengeplatform.submissionengine.domain.EvaluationResult;
import com.github.challengeplatform.submissionengine.domain.SubmissionStatus;
import com.github.challengeplatform.submissionengine.persistence.ResultEntity;
import com.github.challengeplatform.submissionengine.persistence.ResultRepository;
import com.github.challengeplatform.submissionengine.persistence.SubmissionEntity;
import com.github.challengeplatform.submissionengine.persistence.SubmissionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Durable side of a submission. Every method runs in its own short transaction so that a worker never holds a
 * database connection across the slow stages of a task.
 *
 * @author timo.buechert
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SubmissionRecordService {

    static final String SYSTEM_USER = "system";

    private final SubmissionRepository submissionRepository;

    private final ResultRepository resultRepository;

    private final Clock clock;

    @Transactional(readOnly = true)
    public Optional<SubmissionEntity> findSubmission(final String submissionId) {
        return submissionRepository.findById(submissionId);
    }

    @Transactional
    public SubmissionEntity createPending(final String submissionId, final String userId, final String modelId,
                                          final String challengeId, final String description) {
        final ZonedDateTime now = now();
        final SubmissionEntity submission = new SubmissionEntity();
        submission.setId(submissionId);
        submission.setUserId(userId);
        submission.setModelId(modelId);
        submission.setChallengeId(challengeId);
        submission.setDescription(description);
        submission.setStatus(SubmissionStatus.PENDING);
        submission.setStatusMessage("Submission queued for processing");
        submission.setCreatedAt(now);
        submission.setUpdatedAt(now);
        return submissionRepository.save(submission);
    }

    @Transactional
    public void markProcessing(final String submissionId, final String message) {
        updateStatus(submissionId, SubmissionStatus.PROCESSING, message);
    }

    @Transactional
    public void assignDatasetUrl(final String submissionId, final String datasetUrl, final String message) {
        final SubmissionEntity submission = getSubmission(submissionId);
        submission.setDatasetUrl(datasetUrl);
        submission.setStatusMessage(message);
        submission.setUpdatedAt(now());
        submissionRepository.save(submission);
    }

    @Transactional
    public void markCompleted(final String submissionId, final String message) {
        updateStatus(submissionId, SubmissionStatus.COMPLETED, message);
    }

    @Transactional
    public void markFailed(final String submissionId, final String message) {
        updateStatus(submissionId, SubmissionStatus.FAILED, message);
    }

    /**
     * Stores one result row per metric.
     */
    @Transactional
    public List<ResultEntity> saveResults(final String submissionId, final String userId,
                                          final EvaluationResult evaluationResult) {
        final ZonedDateTime now = now();
        final List<ResultEntity> results = evaluationResult.scores().entrySet().stream()
                .map(score -> new ResultEntity(null, score.getKey().name(), userId, submissionId, score.getValue(),
                        SYSTEM_USER, now))
                .toList();

        final List<ResultEntity> saved = resultRepository.saveAll(results);
        log.info("Saved evaluation results for submission {}: {}", submissionId, evaluationResult.scores());
        return saved;
    }

    @Transactional(readOnly = true)
    public List<ResultEntity> findResults(final String submissionId) {
        return resultRepository.findBySubmissionId(submissionId);
    }

    /**
     * Fails submissions a previous run accepted but never finished. Their queued tasks only lived in memory.
     *
     * @return the number of submissions marked as failed
     */
    @Transactional
    public int failUnfinishedSubmissions(final String message) {
        final List<SubmissionEntity> unfinished = submissionRepository.findByStatusIn(
                List.of(SubmissionStatus.PENDING, SubmissionStatus.PROCESSING));
        final ZonedDateTime now = now();
        unfinished.forEach(submission -> {
            submission.setStatus(SubmissionStatus.FAILED);
            submission.setStatusMessage(message);
            submission.setUpdatedAt(now);
        });
        submissionRepository.saveAll(unfinished);
        return unfinished.size();
    }

    private void updateStatus(final String submissionId, final SubmissionStatus status, final String message) {
        final SubmissionEntity submission = getSubmission(submissionId);
        submission.setStatus(status);
        submission.setStatusMessage(message);
        submission.setUpdatedAt(now());
        submissionRepository.save(submission);
    }

    private SubmissionEntity getSubmission(final String submissionId) {
        return submissionRepository.findById(submissionId)
                .orElseThrow(() -> new NoSuchElementException("Submission " + submissionId + " not found"));
    }

    private ZonedDateTime now() {
        return ZonedDateTime.now(clock);
    }

}
