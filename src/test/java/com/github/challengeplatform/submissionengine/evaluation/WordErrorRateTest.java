package com.github.challengeplatform.submissionengine.evaluation;

import com.github.challengeplatform.submissionengine.domain.MetricType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class WordErrorRateTest {

    private final WordErrorRate wordErrorRate = new WordErrorRate();

    @Test
    void type() {
        assertThat(wordErrorRate.type()).isEqualTo(MetricType.WER);
    }

    @Test
    void compute_oneWrongWord() {
        assertThat(wordErrorRate.compute("the cat sat", "the cat sit")).isCloseTo(1.0 / 3, within(1e-9));
    }

    @Test
    void compute_missingWords() {
        assertThat(wordErrorRate.compute("a b c d", "a b")).isCloseTo(0.5, within(1e-9));
    }

    @Test
    void compute_ignoresWhitespaceRuns() {
        assertThat(wordErrorRate.compute("the  cat\tsat", " the cat sat ")).isEqualTo(0.0);
    }

}
