package dev.jobsignal.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle state of a stored job listing.
 */
public enum JobStatus {
    ACTIVE,
    CLOSED,
    APPLIED,
    IGNORED;

    /**
     * Applied and ignored are set by the user and are never touched by scans.
     */
    public boolean isUserManaged() {
        return this == APPLIED || this == IGNORED;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static JobStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Job status is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown job status: " + value, e);
        }
    }
}
