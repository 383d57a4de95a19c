package com.github.challengeplatform.submissionengine.evaluation;

import com.github.challengeplatform.submissionengine.domain.MetricType;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * Edit distance over whitespace separated words, divided by the number of reference words.
 *
 * @author timo.buechert
 */
@Component
@Order(2)
public class WordErrorRate implements ErrorRateMetric {

    @Override
    public MetricType type() {
        return MetricType.WER;
    }

    @Override
    public double compute(final String reference, final String prediction) {
        return EditDistance.rate(words(reference), words(prediction));
    }

    private static List<String> words(final String text) {
        final String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(trimmed.split("\\s+"));
    }

}
