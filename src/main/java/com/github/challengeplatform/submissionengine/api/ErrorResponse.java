package com.github.challengeplatform.submissionengine.api;

/**
 * @author timo.buechert
 */
public record ErrorResponse(String message) {
}
