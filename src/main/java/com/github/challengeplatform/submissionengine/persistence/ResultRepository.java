package com.github.challengeplatform.submissionengine.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

/**
 * @author timo.buechert
 */
public interface ResultRepository extends JpaRepository<ResultEntity, Long> {

    List<ResultEntity> findBySubmissionId(String submissionId);

}
