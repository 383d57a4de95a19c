package com.github.challengeplatform.submissionengine.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.ZonedDateTime;

/**
 * A competition whose submissions are scored against {@link #groundTruthUrl}.
 *
 * @author timo.buechert
 */
@Entity
@Table(name = "challenge")
@Data
@AllArgsConstructor
@NoArgsConstructor
public class ChallengeEntity {

    @Id
    private String id;

    @Column(nullable = false)
    private String title;

    @Column(nullable = false)
    private String groundTruthUrl;

    @Lob
    private String description;

    private String status;

    private ZonedDateTime createdAt;

}
