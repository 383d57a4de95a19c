package com.github.challengeplatform.submissionengine.service;

import com.github.challengeplatform.submissionengine.cache.ProgressCache;
import com.github.challengeplatform.submissionengine.domain.CacheStats;
import com.github.challengeplatform.submissionengine.domain.MetricScore;
import com.github.challengeplatform.submissionengine.domain.NewSubmission;
import com.github.challengeplatform.submissionengine.domain.ProgressEntry;
import com.github.challengeplatform.submissionengine.domain.ProgressStatus;
import com.github.challengeplatform.submissionengine.domain.QueueStats;
import com.github.challengeplatform.submissionengine.domain.SubmissionReceipt;
import com.github.challengeplatform.submissionengine.domain.SubmissionStatus;
import com.github.challengeplatform.submissionengine.domain.SubmissionStatusView;
import com.github.challengeplatform.submissionengine.domain.SubmissionTask;
import com.github.challengeplatform.submissionengine.mapper.SubmissionViewMapper;
import com.github.challengeplatform.submissionengine.persistence.ChallengeEntity;
import com.github.challengeplatform.submissionengine.persistence.ChallengeRepository;
import com.github.challengeplatform.submissionengine.queue.SubmissionTaskQueue;
import com.github.challengeplatform.submissionengine.worker.SubmissionWorkerPool;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for everything outside the worker threads: accepting submissions and answering status polls.
 *
 * @author timo.buechert
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SubmissionService {

    static final String QUEUED_MESSAGE = "Submission queued for processing";

    static final String STEP_QUEUED = "Queued";

    static final String REJECTED_MESSAGE = "Submission could not be queued for processing";

    private final ChallengeRepository challengeRepository;

    private final SubmissionRecordService recordService;

    private final SubmissionTaskQueue queue;

    private final ProgressCache progressCache;

    private final SubmissionWorkerPool workerPool;

    private final SubmissionViewMapper submissionViewMapper;

    /**
     * Records a new submission as pending and hands it to the workers. Returns before any processing happens.
     *
     * @throws ChallengeNotFoundException  if the challenge does not exist
     * @throws SubmissionRejectedException if the queue did not accept the task; the submission is then failed
     */
    public SubmissionReceipt createSubmission(final NewSubmission newSubmission)
            throws ChallengeNotFoundException, SubmissionRejectedException {
        final ChallengeEntity challenge = challengeRepository.findById(newSubmission.challengeId())
                .orElseThrow(() -> new ChallengeNotFoundException(newSubmission.challengeId()));

        final String submissionId = UUID.randomUUID().toString();
        recordService.createPending(submissionId, newSubmission.userId(), newSubmission.modelId(),
                challenge.getId(), newSubmission.description());
        progressCache.set(submissionId, ProgressStatus.PENDING, QUEUED_MESSAGE, 0, STEP_QUEUED);

        final SubmissionTask task = new SubmissionTask(submissionId, newSubmission.content(),
                newSubmission.filename(), newSubmission.userId(), newSubmission.modelId(), challenge.getTitle(),
                challenge.getGroundTruthUrl(), newSubmission.priority());

        if (!enqueueSubmission(task)) {
            progressCache.set(submissionId, ProgressStatus.FAILED, REJECTED_MESSAGE, 0, "Failed",
                    REJECTED_MESSAGE);
            recordService.markFailed(submissionId, REJECTED_MESSAGE);
            throw new SubmissionRejectedException(REJECTED_MESSAGE);
        }

        log.info("Accepted submission {} for challenge {}", submissionId, challenge.getId());
        return new SubmissionReceipt(submissionId, SubmissionStatus.PENDING.value(), QUEUED_MESSAGE);
    }

    /**
     * @return false if the queue is full, shutting down or already holds the submission
     */
    public boolean enqueueSubmission(final SubmissionTask task) {
        return queue.enqueue(task);
    }

    public Optional<ProgressEntry> getCachedProgress(final String submissionId) {
        return progressCache.get(submissionId);
    }

    /**
     * Answers from the progress cache only. The status is the coarse client status; the fine-grained stage is
     * reported as the current step.
     *
     * @throws SubmissionNotFoundException if the submission has no cache entry, e.g. after eviction
     */
    public SubmissionStatusView getProgress(final String submissionId) throws SubmissionNotFoundException {
        return getCachedProgress(submissionId)
                .map(submissionViewMapper::fromProgressEntry)
                .orElseThrow(() -> new SubmissionNotFoundException(submissionId));
    }

    /**
     * Answers from the progress cache when possible and falls back to the submission record, e.g. once a finished
     * entry was evicted.
     */
    public SubmissionStatusView getStatus(final String submissionId) throws SubmissionNotFoundException {
        final Optional<ProgressEntry> cached = progressCache.get(submissionId);
        if (cached.isPresent()) {
            return submissionViewMapper.fromProgressEntry(cached.get());
        }

        return recordService.findSubmission(submissionId)
                .map(submissionViewMapper::fromSubmissionEntity)
                .orElseThrow(() -> new SubmissionNotFoundException(submissionId));
    }

    public List<MetricScore> getResults(final String submissionId) throws SubmissionNotFoundException {
        if (recordService.findSubmission(submissionId).isEmpty()) {
            throw new SubmissionNotFoundException(submissionId);
        }
        return recordService.findResults(submissionId).stream()
                .map(submissionViewMapper::toMetricScore)
                .toList();
    }

    public CacheStats getCacheStats() {
        return progressCache.stats();
    }

    public QueueStats getQueueStats() {
        return queue.stats(workerPool.activeWorkers());
    }

    public Map<String, ProgressEntry> getActiveSubmissions() {
        return progressCache.allActive();
    }

}
