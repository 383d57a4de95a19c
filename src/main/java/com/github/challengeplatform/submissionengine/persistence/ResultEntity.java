package com.github.challengeplatform.submissionengine.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.ZonedDateTime;

/**
 * One metric score of an evaluated submission.
 *
 * @author timo.buechert
 */
@Entity
@Table(name = "result")
@Data
@AllArgsConstructor
@NoArgsConstructor
public class ResultEntity {

    @Id
    @GeneratedValue
    private Long id;

    @Column(nullable = false)
    private String type;

    @Column(nullable = false)
    private String userId;

    @Column(nullable = false)
    private String submissionId;

    private double score;

    private String createdBy;

    private ZonedDateTime createdAt;

}
