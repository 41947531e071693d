package dev.jobsignal.model;

import lombok.Builder;

import java.time.LocalDate;

/**
 * Platform-neutral job posting produced by every source adapter.
 * Only the title is required; every other field may be null.
 */
@Builder
public record CanonicalJob(
        String title,
        String url,
        String location,
        String department,
        String description,
        LocalDate datePosted) {

    public static CanonicalJob ofTitle(String title) {
        return CanonicalJob.builder().title(title).build();
    }
}
