package com.github.challengeplatform.submissionengine.domain;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Scores of one evaluated submission, keyed by metric. Error rate metrics range from 0.0 (perfect) to
 * {@link #WORST_SCORE}, which also marks a submission that could not be evaluated.
 *
 * @author timo.buechert
 */
public final class EvaluationResult {

    public static final double WORST_SCORE = 1.0;

    private final Map<MetricType, Double> scores;

    private final int evaluatedPairs;

    public EvaluationResult(final Map<MetricType, Double> scores, final int evaluatedPairs) {
        this.scores = Collections.unmodifiableMap(new EnumMap<>(scores));
        this.evaluatedPairs = evaluatedPairs;
    }

    public static EvaluationResult worstCase(final Collection<MetricType> metrics) {
        final Map<MetricType, Double> scores = new EnumMap<>(MetricType.class);
        metrics.forEach(metric -> scores.put(metric, WORST_SCORE));
        return new EvaluationResult(scores, 0);
    }

    public Map<MetricType, Double> scores() {
        return scores;
    }

    public double score(final MetricType metric) {
        final Double score = scores.get(metric);
        if (score == null) {
            throw new IllegalArgumentException("No score for metric " + metric);
        }
        return score;
    }

    public int evaluatedPairs() {
        return evaluatedPairs;
    }

    public boolean hasScoredPairs() {
        return evaluatedPairs > 0;
    }

    @Override
    public String toString() {
        return "EvaluationResult{scores=" + scores + ", evaluatedPairs=" + evaluatedPairs + "}";
    }

}
