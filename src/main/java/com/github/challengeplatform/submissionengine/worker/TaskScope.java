package com.github.challengeplatform.submissionengine.worker;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Executor owned by a single task for its network bound stages. Created when the task starts and shut down when it
 * ends, so stalled calls of one task never hold threads of another.
 *
 * @author timo.buechert
 */
@Slf4j
public class TaskScope implements AutoCloseable {

    private final ExecutorService executorService;

    private final Duration stageTimeout;

    public TaskScope(final String submissionId, final Duration stageTimeout) {
        this.stageTimeout = stageTimeout;
        this.executorService = Executors.newSingleThreadExecutor(runnable -> {
            final Thread thread = new Thread(runnable, "SubmissionTask-" + submissionId);
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Runs one stage and waits at most the stage timeout for it.
     *
     * @throws StageTimeoutException if the stage did not finish in time; the stage is cancelled
     * @throws Exception             whatever the stage itself threw
     */
    public <T> T run(final String stageName, final Callable<T> stage) throws Exception {
        final Future<T> future = executorService.submit(stage);
        try {
            return future.get(stageTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (final TimeoutException e) {
            future.cancel(true);
            log.warn("{} timed out after {}", stageName, stageTimeout);
            throw new StageTimeoutException(stageName + " timed out after " + stageTimeout);
        } catch (final ExecutionException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            throw e;
        } catch (final InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw e;
        }
    }

    @Override
    public void close() {
        executorService.shutdownNow();
    }

}
