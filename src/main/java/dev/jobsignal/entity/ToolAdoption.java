package dev.jobsignal.entity;

import dev.jobsignal.model.AdoptionLevel;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * A tool the company is known to use, and how firmly.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "tools_adopted", indexes = {
        @Index(name = "idx_tools_company", columnList = "companyId")
})
public class ToolAdoption {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long companyId;

    @Column(nullable = false)
    private String toolName;

    @Enumerated(EnumType.STRING)
    private AdoptionLevel adoptionLevel;

    @Column(length = 2048)
    private String evidenceUrl;

    @Column(length = 4000)
    private String evidenceExcerpt;

    private LocalDate dateObserved;

    private Instant createdAt;
}
