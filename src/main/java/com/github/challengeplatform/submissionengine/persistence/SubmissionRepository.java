package com.github.challengeplatform.submissionengine.persistence;

import com.github.challengeplatform.submissionengine.domain.SubmissionStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

/**
 * @author timo.buechert
 */
public interface SubmissionRepository extends JpaRepository<SubmissionEntity, String> {

    List<SubmissionEntity> findByStatusIn(List<SubmissionStatus> statuses);

}
