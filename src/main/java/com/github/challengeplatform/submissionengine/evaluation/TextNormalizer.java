package com.github.challengeplatform.submissionengine.evaluation;

/**
 * Canonical form applied to reference and prediction before scoring.
 *
 * @author timo.buechert
 */
public interface TextNormalizer {

    String normalize(String text);

}
