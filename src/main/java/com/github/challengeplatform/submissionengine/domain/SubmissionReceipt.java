package com.github.challengeplatform.submissionengine.domain;

/**
 * Answer to an accepted submission upload.
 *
 * @author timo.buechert
 */
public record SubmissionReceipt(String submissionId, String status, String message) {
}
