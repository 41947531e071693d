package dev.jobsignal.config;

import java.util.List;
import java.util.Locale;

/**
 * Immutable weights and word lists used to score job postings.
 * Lists are matched as lower-case substrings, first match wins, in list order.
 */
public record JobScoringRules(
        double titleWeight,
        double keywordWeight,
        double locationWeight,
        double seniorityWeight,
        List<String> targetRoles,
        List<String> domainWords,
        List<String> roleWords,
        List<String> positiveKeywords,
        List<String> negativeKeywords,
        List<String> preferredLocations,
        List<String> juniorSignals,
        List<String> executiveSignals,
        List<String> targetSeniority) {

    static final double WEIGHT_TOLERANCE = 1e-9;

    public JobScoringRules {
        double sum = titleWeight + keywordWeight + locationWeight + seniorityWeight;
        if (Math.abs(sum - 1.0) > WEIGHT_TOLERANCE) {
            throw new IllegalArgumentException("Job scoring weights must sum to 1.0 but sum to " + sum);
        }
        targetRoles = lower(targetRoles);
        domainWords = lower(domainWords);
        roleWords = lower(roleWords);
        positiveKeywords = lower(positiveKeywords);
        negativeKeywords = lower(negativeKeywords);
        preferredLocations = lower(preferredLocations);
        juniorSignals = lower(juniorSignals);
        executiveSignals = lower(executiveSignals);
        targetSeniority = lower(targetSeniority);
    }

    public static JobScoringRules defaults() {
        return new JobScoringConfig().toRules();
    }

    public double weightSum() {
        return titleWeight + keywordWeight + locationWeight + seniorityWeight;
    }

    private static List<String> lower(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
                .filter(value -> value != null && !value.isBlank())
                .map(value -> value.toLowerCase(Locale.ROOT))
                .toList();
    }
}
