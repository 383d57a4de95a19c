package com.github.challengeplatform.submissionengine.evaluation;

import com.github.challengeplatform.submissionengine.domain.MetricType;

/**
 * Error rate of a single prediction against its reference. Implementations are stateless.
 *
 * @author timo.buechert
 */
public interface ErrorRateMetric {

    MetricType type();

    /**
     * @param reference  normalized, non-blank reference text
     * @param prediction normalized, non-blank predicted text
     * @return the error rate in [0, 1], where 0 is a perfect match
     */
    double compute(String reference, String prediction);

}
