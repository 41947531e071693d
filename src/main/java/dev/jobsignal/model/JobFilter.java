package dev.jobsignal.model;

import lombok.Builder;

import java.time.Instant;

/**
 * Job listing query. Null fields do not filter; limit defaults to 50.
 */
@Builder
public record JobFilter(
        Long companyId,
        JobStatus status,
        Double minRelevance,
        Instant firstSeenSince,
        Integer limit) {

    public static final int DEFAULT_LIMIT = 50;

    public JobFilter {
        if (limit == null || limit <= 0) {
            limit = DEFAULT_LIMIT;
        }
    }

    public static JobFilter all() {
        return JobFilter.builder().build();
    }
}
