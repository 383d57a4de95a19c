package com.github.challengeplatform.submissionengine.queue;

import com.github.challengeplatform.submissionengine.domain.QueueStats;
import com.github.challengeplatform.submissionengine.domain.SubmissionTask;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Channel between the request threads that accept submissions and the worker threads that process them.
 * Tasks are served by ascending priority, FIFO among equal priorities. A submission id is accepted only once
 * while a task for it is queued or being processed.
 *
 * @author timo.buechert
 */
@Component
@Slf4j
public class SubmissionTaskQueue {

    private static final Comparator<QueuedTask> ORDER = Comparator
            .comparingInt((QueuedTask queuedTask) -> queuedTask.task().priority())
            .thenComparingLong(QueuedTask::sequence);

    private final PriorityBlockingQueue<QueuedTask> queue = new PriorityBlockingQueue<>(11, ORDER);

    private final Set<String> submissionsInFlight = ConcurrentHashMap.newKeySet();

    private final AtomicLong sequence = new AtomicLong();

    private final AtomicLong totalQueued = new AtomicLong();

    private final AtomicLong totalProcessed = new AtomicLong();

    private final int capacity;

    private volatile boolean shuttingDown = false;

    public SubmissionTaskQueue(@Value("${submission.queue.capacity:500}") final int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Queue capacity must be positive but was " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Adds a task without waiting for it to be processed.
     *
     * @return false if the queue is shutting down, full, or already holds a task for the same submission
     */
    public synchronized boolean enqueue(final SubmissionTask task) {
        if (task.isShutdownSignal()) {
            throw new IllegalArgumentException("The shutdown signal cannot be enqueued as a task");
        }
        if (shuttingDown) {
            log.warn("Rejected task {}: queue is shutting down", task.submissionId());
            return false;
        }
        if (pendingTasks() >= capacity) {
            log.warn("Rejected task {}: queue is full ({} tasks)", task.submissionId(), capacity);
            return false;
        }
        if (!submissionsInFlight.add(task.submissionId())) {
            log.warn("Rejected task {}: submission is already queued or being processed", task.submissionId());
            return false;
        }

        queue.offer(new QueuedTask(task, sequence.getAndIncrement()));
        totalQueued.incrementAndGet();
        log.info("Task queued: {} (queue size: {})", task.submissionId(), queue.size());
        return true;
    }

    /**
     * Waits up to {@code timeout} for the next task. Only called by workers.
     */
    public Optional<SubmissionTask> dequeue(final Duration timeout) throws InterruptedException {
        final QueuedTask queuedTask = queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        return Optional.ofNullable(queuedTask).map(QueuedTask::task);
    }

    /**
     * Marks a dequeued task as processed and releases its submission id.
     */
    public void acknowledge(final SubmissionTask task) {
        if (task.isShutdownSignal()) {
            return;
        }
        submissionsInFlight.remove(task.submissionId());
        totalProcessed.incrementAndGet();
    }

    /**
     * Stops accepting tasks and wakes up every worker with one shutdown signal each.
     */
    public synchronized void signalShutdown(final int numberOfWorkers) {
        shuttingDown = true;
        for (int i = 0; i < numberOfWorkers; i++) {
            queue.offer(new QueuedTask(SubmissionTask.SHUTDOWN, sequence.getAndIncrement()));
        }
    }

    /**
     * Removes every task that was never picked up by a worker.
     */
    public synchronized List<SubmissionTask> drainUnprocessed() {
        final List<QueuedTask> drained = new ArrayList<>();
        queue.drainTo(drained);

        final List<SubmissionTask> unprocessed = drained.stream()
                .map(QueuedTask::task)
                .filter(task -> !task.isShutdownSignal())
                .toList();
        unprocessed.forEach(task -> submissionsInFlight.remove(task.submissionId()));
        return unprocessed;
    }

    public boolean isShuttingDown() {
        return shuttingDown;
    }

    public int size() {
        return pendingTasks();
    }

    public QueueStats stats(final int activeWorkers) {
        return new QueueStats(totalQueued.get(), totalProcessed.get(), pendingTasks(), activeWorkers);
    }

    private int pendingTasks() {
        return (int) queue.stream().filter(queuedTask -> !queuedTask.task().isShutdownSignal()).count();
    }

    private record QueuedTask(SubmissionTask task, long sequence) {
    }

}
