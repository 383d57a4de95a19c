package com.github.challengeplatform.submissionengine.service;

/**
 * @author timo.buechert
 */
public class ChallengeNotFoundException extends SubmissionServiceException {
    public ChallengeNotFoundException(String challengeId) {
        super("Challenge " + challengeId + " not found");
    }
}
