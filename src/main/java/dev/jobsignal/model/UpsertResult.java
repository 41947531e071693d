package dev.jobsignal.model;

public record UpsertResult(long id, boolean isNew) {
}
