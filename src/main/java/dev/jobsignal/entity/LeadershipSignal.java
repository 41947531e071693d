package dev.jobsignal.entity;

import dev.jobsignal.model.ImpactLevel;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * A statement observed from a named leader.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "leadership_signals", indexes = {
        @Index(name = "idx_leadership_company", columnList = "companyId")
})
public class LeadershipSignal {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long companyId;

    @Column(nullable = false)
    private String leaderName;

    private String leaderTitle;

    @Column(nullable = false, length = 4000)
    private String content;

    @Column(length = 2048)
    private String sourceUrl;

    private LocalDate dateObserved;

    @Enumerated(EnumType.STRING)
    private ImpactLevel impactLevel;

    private Instant createdAt;
}
