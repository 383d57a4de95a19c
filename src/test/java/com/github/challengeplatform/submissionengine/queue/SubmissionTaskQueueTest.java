package com.github.challengeplatform.submissionengine.queue;

import com.github.challengeplatform.submissionengine.domain.QueueStats;
import com.github.challengeplatform.submissionengine.domain.SubmissionTask;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * @author timo.buechert
 */
class SubmissionTaskQueueTest {

    private static final Duration POLL_TIMEOUT = Duration.ofMillis(50);

    private static SubmissionTask task(final String submissionId, final int priority) {
        return new SubmissionTask(submissionId, "[]".getBytes(StandardCharsets.UTF_8), "predictions.json", "user",
                "model", "Challenge", "http://localhost/truth.json", priority);
    }

    @Test
    void dequeue_lowerPriorityValueFirst_fifoWithinPriority() throws InterruptedException {
        // given
        final SubmissionTaskQueue queue = new SubmissionTaskQueue(10);
        queue.enqueue(task("a", 5));
        queue.enqueue(task("b", 0));
        queue.enqueue(task("c", 5));
        queue.enqueue(task("d", 0));

        // when
        final List<String> order = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            order.add(queue.dequeue(POLL_TIMEOUT).orElseThrow().submissionId());
        }

        // then
        assertThat(order).containsExactly("b", "d", "a", "c");
    }

    @Test
    void dequeue_emptyQueue_returnsEmptyAfterTimeout() throws InterruptedException {
        // given
        final SubmissionTaskQueue queue = new SubmissionTaskQueue(10);

        // when
        final Optional<SubmissionTask> task = queue.dequeue(POLL_TIMEOUT);

        // then
        assertThat(task).isEmpty();
    }

    @Test
    void enqueue_duplicateSubmission_rejectedUntilAcknowledged() throws InterruptedException {
        // given
        final SubmissionTaskQueue queue = new SubmissionTaskQueue(10);
        assertThat(queue.enqueue(task("a", 0))).isTrue();

        // when
        final boolean whileQueued = queue.enqueue(task("a", 0));
        final SubmissionTask dequeued = queue.dequeue(POLL_TIMEOUT).orElseThrow();
        final boolean whileProcessing = queue.enqueue(task("a", 0));
        queue.acknowledge(dequeued);
        final boolean afterAcknowledge = queue.enqueue(task("a", 0));

        // then
        assertThat(whileQueued).isFalse();
        assertThat(whileProcessing).isFalse();
        assertThat(afterAcknowledge).isTrue();
    }

    @Test
    void enqueue_full_rejected() {
        // given
        final SubmissionTaskQueue queue = new SubmissionTaskQueue(2);
        queue.enqueue(task("a", 0));
        queue.enqueue(task("b", 0));

        // when
        final boolean accepted = queue.enqueue(task("c", 0));

        // then
        assertThat(accepted).isFalse();
        assertThat(queue.size()).isEqualTo(2);
    }

    @Test
    void enqueue_afterShutdown_rejected() {
        // given
        final SubmissionTaskQueue queue = new SubmissionTaskQueue(10);
        queue.signalShutdown(1);

        // when
        final boolean accepted = queue.enqueue(task("a", 0));

        // then
        assertThat(accepted).isFalse();
        assertThat(queue.isShuttingDown()).isTrue();
    }

    @Test
    void enqueue_shutdownSignal_throws() {
        final SubmissionTaskQueue queue = new SubmissionTaskQueue(10);

        assertThatThrownBy(() -> queue.enqueue(SubmissionTask.SHUTDOWN))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void signalShutdown_signalsServedBeforeQueuedTasks() throws InterruptedException {
        // given
        final SubmissionTaskQueue queue = new SubmissionTaskQueue(10);
        queue.enqueue(task("a", Integer.MIN_VALUE + 1));
        queue.enqueue(task("b", 0));

        // when
        queue.signalShutdown(2);

        // then
        assertThat(queue.dequeue(POLL_TIMEOUT).orElseThrow().isShutdownSignal()).isTrue();
        assertThat(queue.dequeue(POLL_TIMEOUT).orElseThrow().isShutdownSignal()).isTrue();
        assertThat(queue.size()).isEqualTo(2);
        assertThat(queue.drainUnprocessed()).extracting(SubmissionTask::submissionId).containsExactly("a", "b");
        assertThat(queue.size()).isZero();
    }

    @Test
    void stats_countsQueuedAndProcessed() throws InterruptedException {
        // given
        final SubmissionTaskQueue queue = new SubmissionTaskQueue(10);
        queue.enqueue(task("a", 0));
        queue.enqueue(task("b", 0));
        queue.acknowledge(queue.dequeue(POLL_TIMEOUT).orElseThrow());

        // when
        final QueueStats stats = queue.stats(3);

        // then
        assertThat(stats).isEqualTo(new QueueStats(2, 1, 1, 3));
    }

    @Test
    void concurrentConsumers_eachTaskProcessedExactlyOnce() throws InterruptedException {
        // given
        final int numberOfTasks = 200;
        final int numberOfConsumers = 4;
        final SubmissionTaskQueue queue = new SubmissionTaskQueue(numberOfTasks);
        final Set<String> seen = ConcurrentHashMap.newKeySet();
        final AtomicInteger duplicates = new AtomicInteger();
        final CountDownLatch done = new CountDownLatch(numberOfConsumers);
        final ExecutorService consumers = Executors.newFixedThreadPool(numberOfConsumers);

        for (int i = 0; i < numberOfConsumers; i++) {
            consumers.submit(() -> {
                try {
                    while (true) {
                        final Optional<SubmissionTask> next = queue.dequeue(POLL_TIMEOUT);
                        if (next.isEmpty()) {
                            continue;
                        }
                        if (next.get().isShutdownSignal()) {
                            break;
                        }
                        if (!seen.add(next.get().submissionId())) {
                            duplicates.incrementAndGet();
                        }
                        queue.acknowledge(next.get());
                    }
                } catch (final InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }

        // when
        for (int i = 0; i < numberOfTasks; i++) {
            assertThat(queue.enqueue(task("task-" + i, i % 3))).isTrue();
        }
        while (queue.stats(0).totalProcessed() < numberOfTasks) {
            Thread.sleep(10);
        }
        queue.signalShutdown(numberOfConsumers);

        // then
        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        consumers.shutdownNow();
        assertThat(seen).hasSize(numberOfTasks);
        assertThat(duplicates.get()).isZero();
        assertThat(queue.stats(0).totalProcessed()).isEqualTo(numberOfTasks);
    }

}
