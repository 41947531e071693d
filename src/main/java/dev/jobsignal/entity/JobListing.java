package dev.jobsignal.entity;

import dev.jobsignal.model.JobStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * A job posting seen on a company's board, tracked across scans.
 * Identity is (companyId, title, url), or (companyId, title, contentHash) when
 * the posting has no URL.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "job_listings", indexes = {
        @Index(name = "idx_jobs_company", columnList = "companyId"),
        @Index(name = "idx_jobs_status", columnList = "status"),
        @Index(name = "idx_jobs_identity", columnList = "companyId, title")
})
public class JobListing {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long companyId;

    @Column(nullable = false, length = 500)
    private String title;

    @Column(length = 2048)
    private String url;

    @Column(length = 500)
    private String location;

    private String department;

    @Column(length = 10000)
    private String description;

    private LocalDate datePosted;

    @Column(nullable = false, updatable = false)
    private Instant dateFirstSeen;

    @Column(nullable = false)
    private Instant dateLastSeen;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JobStatus status = JobStatus.ACTIVE;

    private double relevanceScore;

    @Builder.Default
    @Convert(converter = StringListJsonConverter.class)
    @Column(length = 4000)
    private List<String> matchReasons = new ArrayList<>();

    @Column(nullable = false, length = 64)
    private String contentHash;
}
