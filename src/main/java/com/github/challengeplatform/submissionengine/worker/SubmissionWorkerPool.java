package com.github.challengeplatform.submissionengine.worker;

import com.github.challengeplatform.submissionengine.cache.ProgressCache;
import com.github.challengeplatform.submissionengine.domain.ProgressStatus;
import com.github.challengeplatform.submissionengine.domain.SubmissionTask;
import com.github.challengeplatform.submissionengine.queue.SubmissionTaskQueue;
import com.github.challengeplatform.submissionengine.service.SubmissionRecordService;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed set of workers consuming the submission queue. Each task is handled by exactly one worker.
 *
 * @author timo.buechert
 */
@Service
@Slf4j
public class SubmissionWorkerPool implements SmartInitializingSingleton {

    static final String RESTART_MESSAGE = "Processing was interrupted by a restart";

    static final String SHUTDOWN_MESSAGE = "Processing was cancelled because the service shut down";

    private final SubmissionTaskQueue queue;

    private final SubmissionPipeline pipeline;

    private final SubmissionRecordService recordService;

    private final ProgressCache progressCache;

    private final ThreadPoolTaskExecutor taskExecutor;

    private final int numberOfWorkers;

    private final Duration pollTimeout;

    private final Duration shutdownTimeout;

    private final List<Future<?>> activeWorkerThreads = new ArrayList<>();

    private final AtomicInteger liveWorkers = new AtomicInteger();

    private volatile boolean started = false;

    public SubmissionWorkerPool(final SubmissionTaskQueue queue,
                                final SubmissionPipeline pipeline,
                                final SubmissionRecordService recordService,
                                final ProgressCache progressCache,
                                @Qualifier("submissionWorkerExecutor") final ThreadPoolTaskExecutor taskExecutor,
                                @Value("${submission.worker.count:2}") final int numberOfWorkers,
                                @Value("${submission.worker.poll-timeout:PT5S}") final Duration pollTimeout,
                                @Value("${submission.worker.shutdown-timeout:PT10S}") final Duration shutdownTimeout) {
        if (numberOfWorkers < 1) {
            throw new IllegalArgumentException("Number of workers must be positive but was " + numberOfWorkers);
        }
        this.queue = queue;
        this.pipeline = pipeline;
        this.recordService = recordService;
        this.progressCache = progressCache;
        this.taskExecutor = taskExecutor;
        this.numberOfWorkers = numberOfWorkers;
        this.pollTimeout = pollTimeout;
        this.shutdownTimeout = shutdownTimeout;
    }

    /**
     * Fails submissions left unfinished by a previous run. Runs before the web server accepts requests, so no
     * submission of this run can be caught by it.
     */
    @Override
    public void afterSingletonsInstantiated() {
        final int failed = recordService.failUnfinishedSubmissions(RESTART_MESSAGE);
        if (failed > 0) {
            log.warn("Marked {} unfinished submissions of a previous run as failed", failed);
        }
    }

    @EventListener(ApplicationReadyEvent.class)
    public synchronized void start() {
        if (started) {
            return;
        }
        started = true;

        for (int workerId = 1; workerId <= numberOfWorkers; workerId++) {
            activeWorkerThreads.add(taskExecutor.submit(new SubmissionWorker(workerId)));
        }
        log.info("Started {} submission workers", numberOfWorkers);
    }

    /**
     * Lets every worker finish its current task, then fails whatever is still queued.
     */
    @PreDestroy
    public synchronized void stop() {
        if (!started) {
            return;
        }
        log.info("Stopping {} submission workers", numberOfWorkers);
        queue.signalShutdown(numberOfWorkers);

        final long deadline = System.nanoTime() + shutdownTimeout.toNanos();
        for (final Future<?> workerThread : activeWorkerThreads) {
            try {
                workerThread.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
            } catch (final TimeoutException e) {
                log.warn("Submission worker did not stop within {}, cancelling it", shutdownTimeout);
                workerThread.cancel(true);
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                workerThread.cancel(true);
            } catch (final ExecutionException | CancellationException e) {
                log.error("Submission worker terminated abnormally", e);
            }
        }
        activeWorkerThreads.clear();

        for (final SubmissionTask task : queue.drainUnprocessed()) {
            failUnprocessed(task);
        }
        started = false;
        log.info("Submission workers stopped");
    }

    /**
     * @return number of worker threads that are currently running, busy or idle
     */
    public int activeWorkers() {
        return liveWorkers.get();
    }

    private void failUnprocessed(final SubmissionTask task) {
        log.warn("Submission {} was never processed", task.submissionId());
        progressCache.set(task.submissionId(), ProgressStatus.FAILED, SHUTDOWN_MESSAGE, 0, SubmissionPipeline.STEP_FAILED,
                SHUTDOWN_MESSAGE);
        try {
            recordService.markFailed(task.submissionId(), SHUTDOWN_MESSAGE);
        } catch (final RuntimeException e) {
            log.error("Could not mark submission {} as failed: {}", task.submissionId(), e.getMessage());
        }
    }

    class SubmissionWorker implements Runnable {

        private final int workerId;

        private volatile boolean running = true;

        SubmissionWorker(final int workerId) {
            this.workerId = workerId;
        }

        @Override
        public void run() {
            liveWorkers.incrementAndGet();
            log.info("Submission worker {} started on thread {}", workerId, Thread.currentThread().getName());
            try {
                while (running && !Thread.currentThread().isInterrupted()) {
                    final Optional<SubmissionTask> nextTask = queue.dequeue(pollTimeout);
                    if (nextTask.isEmpty()) {
                        continue;
                    }

                    final SubmissionTask task = nextTask.get();
                    if (task.isShutdownSignal()) {
                        running = false;
                        break;
                    }

                    try {
                        pipeline.process(task, workerId);
                    } catch (final RuntimeException e) {
                        log.error("Worker {}: Unhandled error while processing {}", workerId, task.submissionId(), e);
                    } finally {
                        queue.acknowledge(task);
                    }
                }
            } catch (final InterruptedException e) {
                log.info("Submission worker {} interrupted", workerId);
                Thread.currentThread().interrupt();
            } finally {
                liveWorkers.decrementAndGet();
            }
            log.info("Submission worker {} stopped", workerId);
        }

    }

}
