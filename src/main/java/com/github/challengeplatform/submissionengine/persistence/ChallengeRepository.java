package com.github.challengeplatform.submissionengine.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

/**
 * @author timo.buechert
 */
public interface ChallengeRepository extends JpaRepository<ChallengeEntity, String> {

}
