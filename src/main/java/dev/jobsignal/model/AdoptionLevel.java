package dev.jobsignal.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How firmly a company has adopted a tool, weakest first.
 */
public enum AdoptionLevel {
    RUMORED,
    EXPLORING,
    ALLOWED,
    ENCOURAGED,
    REQUIRED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AdoptionLevel fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Adoption level is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown adoption level: " + value, e);
        }
    }
}
