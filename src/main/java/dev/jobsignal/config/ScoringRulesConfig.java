package dev.jobsignal.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Freezes the bound scoring properties into the immutable rule values the
 * scorers are built with.
 */
@Slf4j
@Configuration
public class ScoringRulesConfig {

    @Bean
    public JobScoringRules jobScoringRules(JobScoringConfig config) {
        JobScoringRules rules = config.toRules();
        log.info("Job scoring: {} target roles, {} positive / {} negative keywords",
                rules.targetRoles().size(), rules.positiveKeywords().size(), rules.negativeKeywords().size());
        return rules;
    }

    @Bean
    public CompanyScoringRules companyScoringRules(CompanyScoringConfig config) {
        return config.toRules();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
