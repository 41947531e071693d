package dev.jobsignal.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of general evidence recorded about a company.
 */
public enum SignalType {
    LEADERSHIP_STATEMENT,
    ENGINEERING_BLOG,
    JOB_POSTING_LANGUAGE,
    CONFERENCE_TALK,
    EMPLOYEE_REPORT,
    PRESS_COVERAGE,
    GITHUB_ACTIVITY,
    COMPANY_POLICY,
    PRODUCT_INTEGRATION,
    TOOL_MANDATE;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SignalType fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Signal type is required");
        }
        try {
            return valueOf(value.trim().replace('-', '_').toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown signal type: " + value, e);
        }
    }
}
