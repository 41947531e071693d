package dev.jobsignal.config;

import dev.jobsignal.model.AdoptionLevel;
import dev.jobsignal.model.ImpactLevel;
import dev.jobsignal.model.SignalType;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Immutable weights and lookup tables used to score companies from evidence.
 */
public record CompanyScoringRules(
        double leadershipWeight,
        double toolAdoptionWeight,
        double cultureWeight,
        double evidenceDepthWeight,
        double recencyWeight,
        Map<ImpactLevel, Double> impactScores,
        double unknownImpactScore,
        Map<AdoptionLevel, Double> adoptionScores,
        double unknownAdoptionScore,
        Set<SignalType> cultureSignalTypes,
        int defaultSignalStrength) {

    public CompanyScoringRules {
        double sum = leadershipWeight + toolAdoptionWeight + cultureWeight + evidenceDepthWeight + recencyWeight;
        if (Math.abs(sum - 1.0) > JobScoringRules.WEIGHT_TOLERANCE) {
            throw new IllegalArgumentException("Company scoring weights must sum to 1.0 but sum to " + sum);
        }
        impactScores = Map.copyOf(impactScores);
        adoptionScores = Map.copyOf(adoptionScores);
        cultureSignalTypes = Set.copyOf(cultureSignalTypes);
    }

    public static CompanyScoringRules defaults() {
        return new CompanyScoringConfig().toRules();
    }

    public double weightSum() {
        return leadershipWeight + toolAdoptionWeight + cultureWeight + evidenceDepthWeight + recencyWeight;
    }

    public double impactScore(ImpactLevel level) {
        return level == null ? unknownImpactScore : impactScores.getOrDefault(level, unknownImpactScore);
    }

    public double adoptionScore(AdoptionLevel level) {
        return level == null ? unknownAdoptionScore : adoptionScores.getOrDefault(level, unknownAdoptionScore);
    }

    static Map<ImpactLevel, Double> defaultImpactScores() {
        Map<ImpactLevel, Double> scores = new EnumMap<>(ImpactLevel.class);
        scores.put(ImpactLevel.COMPANY_WIDE, 10.0);
        scores.put(ImpactLevel.ENGINEERING, 7.0);
        scores.put(ImpactLevel.TEAM, 4.0);
        scores.put(ImpactLevel.PERSONAL, 2.0);
        return scores;
    }

    static Map<AdoptionLevel, Double> defaultAdoptionScores() {
        Map<AdoptionLevel, Double> scores = new EnumMap<>(AdoptionLevel.class);
        scores.put(AdoptionLevel.REQUIRED, 10.0);
        scores.put(AdoptionLevel.ENCOURAGED, 8.0);
        scores.put(AdoptionLevel.ALLOWED, 5.0);
        scores.put(AdoptionLevel.EXPLORING, 3.0);
        scores.put(AdoptionLevel.RUMORED, 1.0);
        return scores;
    }

    static Set<SignalType> defaultCultureSignalTypes() {
        return EnumSet.of(
                SignalType.EMPLOYEE_REPORT,
                SignalType.ENGINEERING_BLOG,
                SignalType.JOB_POSTING_LANGUAGE,
                SignalType.GITHUB_ACTIVITY,
                SignalType.COMPANY_POLICY);
    }
}
