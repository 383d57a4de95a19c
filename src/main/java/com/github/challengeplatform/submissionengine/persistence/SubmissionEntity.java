package com.github.challengeplatform.submissionengine.persistence;

import com.github.challengeplatform.submissionengine.domain.SubmissionStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.ZonedDateTime;

/**
 * @author timo.buechert
 */
@Entity
@Table(name = "submission")
@Data
@AllArgsConstructor
@NoArgsConstructor
public class SubmissionEntity {

    @Id
    private String id;

    @Column(nullable = false)
    private String userId;

    @Column(nullable = false)
    private String modelId;

    @Column(nullable = false)
    private String challengeId;

    private String description;

    private String datasetUrl;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private SubmissionStatus status;

    @Lob
    private String statusMessage;

    private ZonedDateTime createdAt;

    private ZonedDateTime updatedAt;

}
