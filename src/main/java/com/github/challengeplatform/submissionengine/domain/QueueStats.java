package com.github.challengeplatform.submissionengine.domain;

/**
 * @author timo.buechert
 */
public record QueueStats(long totalQueued, long totalProcessed, int queueSize, int activeWorkers) {
}
