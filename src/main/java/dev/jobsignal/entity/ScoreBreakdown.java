package dev.jobsignal.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Cached company scores, one row per company. Always recomputable from evidence.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "score_breakdown")
public class ScoreBreakdown {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    private Long companyId;

    private double leadershipScore;

    private double toolAdoptionScore;

    private double cultureScore;

    private double evidenceDepthScore;

    private double recencyScore;

    private double compositeScore;

    private Instant lastComputedAt;
}
