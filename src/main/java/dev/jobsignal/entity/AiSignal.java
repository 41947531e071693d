package dev.jobsignal.entity;

import dev.jobsignal.model.SignalType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * General evidence about a company (blog post, employee report, job ad wording, ...).
 * Culture signals are the subset whose type is culture-indicating.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "ai_signals", indexes = {
        @Index(name = "idx_signals_company", columnList = "companyId"),
        @Index(name = "idx_signals_type", columnList = "signalType")
})
public class AiSignal {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long companyId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private SignalType signalType;

    @Column(nullable = false)
    private String title;

    @Column(length = 2048)
    private String sourceUrl;

    private String sourceName;

    @Column(length = 4000)
    private String excerpt;

    // 1..5, null when not assessed
    private Integer signalStrength;

    private LocalDate dateObserved;

    @Builder.Default
    private boolean verified = false;

    private Instant createdAt;
}
