package com.github.challengeplatform.submissionengine.mapper;

import com.github.challengeplatform.submissionengine.domain.MetricScore;
import com.github.challengeplatform.submissionengine.domain.ProgressEntry;
import com.github.challengeplatform.submissionengine.domain.SubmissionStatusView;
import com.github.challengeplatform.submissionengine.persistence.ResultEntity;
import com.github.challengeplatform.submissionengine.persistence.SubmissionEntity;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

import java.time.Instant;
import java.time.ZonedDateTime;

/**
 * @author timo.buechert
 */
@Mapper
public interface SubmissionViewMapper {

    @Mapping(target = "submissionId", source = "submissionId")
    @Mapping(target = "status", expression = "java(progressEntry.status().toSubmissionStatus().value())")
    @Mapping(target = "statusMessage", source = "message")
    @Mapping(target = "progressPercentage", source = "progressPercentage")
    @Mapping(target = "currentStep", source = "step")
    @Mapping(target = "errorDetails", source = "errorDetails")
    @Mapping(target = "source", constant = SubmissionStatusView.SOURCE_CACHE)
    @Mapping(target = "updatedAt", source = "updatedAt")
    SubmissionStatusView fromProgressEntry(ProgressEntry progressEntry);

    @Mapping(target = "submissionId", source = "id")
    @Mapping(target = "status", expression = "java(submissionEntity.getStatus().value())")
    @Mapping(target = "statusMessage", source = "statusMessage")
    @Mapping(target = "progressPercentage", ignore = true)
    @Mapping(target = "currentStep", ignore = true)
    @Mapping(target = "errorDetails", ignore = true)
    @Mapping(target = "source", constant = SubmissionStatusView.SOURCE_DATABASE)
    @Mapping(target = "updatedAt", source = "updatedAt")
    SubmissionStatusView fromSubmissionEntity(SubmissionEntity submissionEntity);

    MetricScore toMetricScore(ResultEntity resultEntity);

    default Instant toInstant(final ZonedDateTime timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

}
