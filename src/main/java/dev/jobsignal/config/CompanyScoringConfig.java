package dev.jobsignal.config;

import dev.jobsignal.model.AdoptionLevel;
import dev.jobsignal.model.ImpactLevel;
import dev.jobsignal.model.SignalType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.Map;
import java.util.Set;

/**
 * Configuration for company scoring.
 * Loaded from application.yml under 'company-scoring' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "company-scoring")
public class CompanyScoringConfig {

    private double leadershipWeight = 0.30;
    private double toolAdoptionWeight = 0.25;
    private double cultureWeight = 0.25;
    private double evidenceDepthWeight = 0.10;
    private double recencyWeight = 0.10;

    private Map<ImpactLevel, Double> impactScores = CompanyScoringRules.defaultImpactScores();
    private double unknownImpactScore = 2.0;

    private Map<AdoptionLevel, Double> adoptionScores = CompanyScoringRules.defaultAdoptionScores();
    private double unknownAdoptionScore = 1.0;

    private Set<SignalType> cultureSignalTypes = CompanyScoringRules.defaultCultureSignalTypes();
    private int defaultSignalStrength = 3;

    public CompanyScoringRules toRules() {
        return new CompanyScoringRules(
                leadershipWeight, toolAdoptionWeight, cultureWeight, evidenceDepthWeight, recencyWeight,
                impactScores, unknownImpactScore,
                adoptionScores, unknownAdoptionScore,
                cultureSignalTypes, defaultSignalStrength);
    }
}
