package dev.jobsignal.service;

import dev.jobsignal.config.JobScoringRules;
import dev.jobsignal.model.CanonicalJob;
import dev.jobsignal.model.JobRelevance;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Scores how relevant a job posting is to the target profile.
 * <p>
 * Four sub-scores on a 0-10 scale are combined with the configured weights:
 * title, description keywords, location and seniority. Missing fields score
 * neutral rather than zero, so a posting with only a title is scorable.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobRelevanceScorer {

    static final double MAX_SCORE = 10.0;

    private final JobScoringRules rules;

    /**
     * Sub-score with the reason tags that explain it.
     */
    record SubScore(double score, List<String> reasons) {
        static SubScore of(double score, String reason) {
            return new SubScore(score, List.of(reason));
        }
    }

    /**
     * Score a posting.
     *
     * @param job the posting; only the title is required
     * @return composite and sub-scores, reasons in title, keyword, location, seniority order
     */
    public JobRelevance score(CanonicalJob job) {
        String title = lower(job.title());

        SubScore titleScore = scoreTitle(title);
        SubScore keywordScore = scoreKeywords(lower(job.description()));
        SubScore locationScore = scoreLocation(lower(job.location()));
        SubScore seniorityScore = scoreSeniority(title);

        double raw = titleScore.score() * rules.titleWeight()
                + keywordScore.score() * rules.keywordWeight()
                + locationScore.score() * rules.locationWeight()
                + seniorityScore.score() * rules.seniorityWeight();
        double composite = Math.min(round2(raw), MAX_SCORE);

        List<String> reasons = new ArrayList<>();
        reasons.addAll(titleScore.reasons());
        reasons.addAll(keywordScore.reasons());
        reasons.addAll(locationScore.reasons());
        reasons.addAll(seniorityScore.reasons());

        log.debug("Scored '{}': {} {}", job.title(), composite, reasons);

        return new JobRelevance(composite, reasons,
                titleScore.score(), keywordScore.score(), locationScore.score(), seniorityScore.score());
    }

    SubScore scoreTitle(String title) {
        String role = firstMatch(title, rules.targetRoles());
        if (role != null) {
            return SubScore.of(10.0, "title_match:" + role);
        }

        boolean hasDomain = firstMatch(title, rules.domainWords()) != null;
        boolean hasRole = firstMatch(title, rules.roleWords()) != null;

        if (hasDomain && hasRole) {
            return SubScore.of(8.0, "partial_title_match:data+engineering");
        }
        if (hasDomain) {
            return SubScore.of(5.0, "partial_title_match:data_related");
        }
        if (hasRole) {
            return SubScore.of(3.0, "partial_title_match:engineering_role");
        }
        return new SubScore(0.0, List.of());
    }

    SubScore scoreKeywords(String description) {
        if (description.isEmpty()) {
            return SubScore.of(5.0, "no_description");
        }

        int positive = countMatches(description, rules.positiveKeywords());
        int negative = countMatches(description, rules.negativeKeywords());

        List<String> reasons = new ArrayList<>();
        if (positive > 0) {
            reasons.add("positive_keywords:" + positive);
        }
        if (negative > 0) {
            reasons.add("negative_keywords:" + negative);
        }

        // 2 with no hits, 10 from five hits on, minus 2 per negative
        double score = Math.min(2.0 + positive * 1.6, MAX_SCORE) - negative * 2.0;
        return new SubScore(Math.max(score, 0.0), reasons);
    }

    SubScore scoreLocation(String location) {
        if (location.isEmpty()) {
            return SubScore.of(5.0, "no_location");
        }
        String preferred = firstMatch(location, rules.preferredLocations());
        if (preferred != null) {
            return SubScore.of(10.0, "preferred_location:" + preferred);
        }
        return SubScore.of(3.0, "non_preferred_location");
    }

    SubScore scoreSeniority(String title) {
        String junior = firstMatch(title, rules.juniorSignals());
        if (junior != null) {
            return SubScore.of(2.0, "junior_role:" + junior);
        }
        String executive = firstMatch(title, rules.executiveSignals());
        if (executive != null) {
            return SubScore.of(4.0, "exec_role:" + executive);
        }
        String target = firstMatch(title, rules.targetSeniority());
        if (target != null) {
            return SubScore.of(10.0, "target_seniority:" + target);
        }
        return SubScore.of(6.0, "no_seniority_signal");
    }

    private static String firstMatch(String text, List<String> candidates) {
        if (text.isEmpty()) {
            return null;
        }
        for (String candidate : candidates) {
            if (text.contains(candidate)) {
                return candidate;
            }
        }
        return null;
    }

    private static int countMatches(String text, List<String> candidates) {
        return (int) candidates.stream()
                .distinct()
                .filter(text::contains)
                .count();
    }

    private static String lower(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }

    static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
