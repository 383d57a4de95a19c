package com.github.challengeplatform.submissionengine.domain;

import lombok.Builder;

/**
 * A prediction file handed in by the API layer, before it has been given a submission id.
 *
 * @author timo.buechert
 */
@Builder
public record NewSubmission(String userId, String modelId, String challengeId, String description,
                            String filename, byte[] content, int priority) {
}
