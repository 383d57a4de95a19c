package com.github.challengeplatform.submissionengine.evaluation;

import com.github.challengeplatform.submissionengine.domain.DatasetRecord;
import com.github.challengeplatform.submissionengine.domain.EvaluationResult;
import com.github.challengeplatform.submissionengine.domain.MetricType;
import com.github.challengeplatform.submissionengine.util.TextUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Scores a prediction dataset against the ground truth of a challenge.
 * <p>
 * Only keys present on both sides are evaluated. Every metric is averaged over the pairs that could be scored and
 * rounded to {@value TextUtil#SCORE_SCALE} decimals. If nothing can be scored, or anything unexpected happens, every
 * metric gets the worst score instead of an exception.
 *
 * @author timo.buechert
 */
@Component
@Slf4j
public class SubmissionEvaluator {

    private final List<ErrorRateMetric> metrics;

    private final TextNormalizer textNormalizer;

    public SubmissionEvaluator(final List<ErrorRateMetric> metrics, final TextNormalizer textNormalizer) {
        if (metrics.isEmpty()) {
            throw new IllegalArgumentException("At least one metric is required");
        }
        this.metrics = List.copyOf(metrics);
        this.textNormalizer = textNormalizer;
    }

    public List<MetricType> metricTypes() {
        return metrics.stream().map(ErrorRateMetric::type).toList();
    }

    public EvaluationResult evaluate(final List<DatasetRecord> groundTruth, final List<DatasetRecord> submission) {
        try {
            return evaluateIntersection(toMap(groundTruth), toMap(submission));
        } catch (final RuntimeException e) {
            log.error("Unexpected error during evaluation", e);
            return EvaluationResult.worstCase(metricTypes());
        }
    }

    private EvaluationResult evaluateIntersection(final Map<String, String> references,
                                                  final Map<String, String> predictions) {
        final Set<String> commonKeys = new TreeSet<>(references.keySet());
        commonKeys.retainAll(predictions.keySet());

        if (commonKeys.isEmpty()) {
            log.warn("No common files found between challenge and submission data");
            return EvaluationResult.worstCase(metricTypes());
        }

        logOneSidedKeys(references, predictions);
        log.info("Found {} common files for evaluation", commonKeys.size());

        final Map<MetricType, List<Double>> pairScores = new EnumMap<>(MetricType.class);
        metrics.forEach(metric -> pairScores.put(metric.type(), new ArrayList<>()));
        int scoredPairs = 0;

        for (final String key : commonKeys) {
            final String reference = references.get(key).trim();
            final String prediction = predictions.get(key).trim();
            if (reference.isEmpty() || prediction.isEmpty()) {
                log.warn("Skipping empty label or prediction for {}", key);
                continue;
            }

            try {
                final Map<MetricType, Double> scores = scorePair(reference, prediction);
                scores.forEach((type, score) -> pairScores.get(type).add(score));
                scoredPairs++;
            } catch (final RuntimeException e) {
                log.error("Failed to process {}: {}", key, e.getMessage());
            }
        }

        if (scoredPairs == 0) {
            log.warn("No valid files could be evaluated");
            return EvaluationResult.worstCase(metricTypes());
        }

        final Map<MetricType, Double> means = new EnumMap<>(MetricType.class);
        pairScores.forEach((type, scores) -> means.put(type, TextUtil.roundScore(mean(scores))));
        log.info("Evaluated {} samples: {}", scoredPairs, means);

        return new EvaluationResult(means, scoredPairs);
    }

    private Map<MetricType, Double> scorePair(final String reference, final String prediction) {
        final String normalizedReference = textNormalizer.normalize(reference);
        final String normalizedPrediction = textNormalizer.normalize(prediction);

        final Map<MetricType, Double> scores = new EnumMap<>(MetricType.class);
        for (final ErrorRateMetric metric : metrics) {
            scores.put(metric.type(), metric.compute(normalizedReference, normalizedPrediction));
        }
        return scores;
    }

    private void logOneSidedKeys(final Map<String, String> references, final Map<String, String> predictions) {
        final Set<String> missingInPrediction = new TreeSet<>(references.keySet());
        missingInPrediction.removeAll(predictions.keySet());
        if (!missingInPrediction.isEmpty()) {
            log.warn("Missing predictions for {} files: {}", missingInPrediction.size(), missingInPrediction);
        }

        final Set<String> extraInPrediction = new TreeSet<>(predictions.keySet());
        extraInPrediction.removeAll(references.keySet());
        if (!extraInPrediction.isEmpty()) {
            log.warn("Extra predictions for {} files not in ground truth: {}", extraInPrediction.size(),
                    extraInPrediction);
        }
    }

    private static Map<String, String> toMap(final List<DatasetRecord> records) {
        final Map<String, String> byKey = new LinkedHashMap<>();
        for (final DatasetRecord record : records) {
            if (record == null || record.key() == null) {
                continue;
            }
            byKey.put(record.key(), record.value() == null ? "" : record.value());
        }
        return byKey;
    }

    private static double mean(final List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(EvaluationResult.WORST_SCORE);
    }

}
