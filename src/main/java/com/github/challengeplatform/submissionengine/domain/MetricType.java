package com.github.challengeplatform.submissionengine.domain;

/**
 * @author timo.buechert
 */
public enum MetricType {
    CER,
    WER
}
