package com.github.challengeplatform.submissionengine.evaluation;

import com.github.challengeplatform.submissionengine.domain.MetricType;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Edit distance over Unicode code points, divided by the reference length.
 *
 * @author timo.buechert
 */
@Component
@Order(1)
public class CharacterErrorRate implements ErrorRateMetric {

    @Override
    public MetricType type() {
        return MetricType.CER;
    }

    @Override
    public double compute(final String reference, final String prediction) {
        return EditDistance.rate(codePoints(reference), codePoints(prediction));
    }

    private static List<Integer> codePoints(final String text) {
        return text.codePoints().boxed().toList();
    }

}
