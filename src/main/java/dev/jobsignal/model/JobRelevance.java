package dev.jobsignal.model;

import java.util.List;

/**
 * Relevance of one job posting: composite 0-10, the sub-scores behind it and
 * the reason tags in title, keyword, location, seniority order.
 */
public record JobRelevance(
        double score,
        List<String> reasons,
        double titleScore,
        double keywordScore,
        double locationScore,
        double seniorityScore) {

    public JobRelevance {
        reasons = List.copyOf(reasons);
    }
}
