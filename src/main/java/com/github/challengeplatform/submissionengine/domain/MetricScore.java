package com.github.challengeplatform.submissionengine.domain;

/**
 * @author timo.buechert
 */
public record MetricScore(String type, String submissionId, double score) {
}
