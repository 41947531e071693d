package dev.jobsignal.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Reach of a leadership statement.
 */
public enum ImpactLevel {
    PERSONAL("personal"),
    TEAM("team"),
    ENGINEERING("engineering"),
    COMPANY_WIDE("company-wide");

    private final String value;

    ImpactLevel(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ImpactLevel fromValue(String value) {
        for (ImpactLevel level : values()) {
            if (level.value.equalsIgnoreCase(value)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown impact level: " + value);
    }
}
