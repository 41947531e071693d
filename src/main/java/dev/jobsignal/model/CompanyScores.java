package dev.jobsignal.model;

/**
 * The five company sub-scores and their weighted composite.
 */
public record CompanyScores(
        double leadership,
        double toolAdoption,
        double culture,
        double evidenceDepth,
        double recency,
        double composite) {
}
