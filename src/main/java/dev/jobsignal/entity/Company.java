package dev.jobsignal.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A tracked company. Score and tier are cached results of scoring; the
 * evidence rows are the source of truth.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "companies", indexes = {
        @Index(name = "idx_companies_score", columnList = "compositeScore"),
        @Index(name = "idx_companies_tier", columnList = "tier")
})
public class Company {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    private String name;

    private String domain;

    @Column(length = 2048)
    private String careersUrl;

    // greenhouse, lever, ashby, custom, ...
    private String careersPlatform;

    @Column(length = 2000)
    private String description;

    @Builder.Default
    @Column(nullable = false)
    private double compositeScore = 0.0;

    @Builder.Default
    @Column(nullable = false)
    private int tier = 4;

    private Instant lastResearchedAt;

    private Instant updatedAt;
}
