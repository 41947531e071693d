package dev.jobsignal.service;

import dev.jobsignal.config.CompanyScoringRules;
import dev.jobsignal.entity.AiSignal;
import dev.jobsignal.entity.Company;
import dev.jobsignal.entity.LeadershipSignal;
import dev.jobsignal.entity.ScoreBreakdown;
import dev.jobsignal.entity.ToolAdoption;
import dev.jobsignal.metrics.ScannerMetrics;
import dev.jobsignal.model.CompanyScores;
import dev.jobsignal.model.EvidenceSignals;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Turns the evidence stored for a company into five sub-scores and a
 * weighted composite, all on a 0-10 scale.
 * <p>
 * Scores are always recomputed from scratch; the stored breakdown is a cache.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CompanyScoreEngine {

    private static final double MAX_SCORE = 10.0;
    private static final double NEUTRAL_RECENCY = 5.0;

    private static final int MAX_EXTRA_LEADERSHIP_SIGNALS = 3;
    private static final int MAX_EXTRA_TOOLS = 4;
    private static final double BONUS_PER_EXTRA = 0.5;

    private final SignalStore signalStore;
    private final CompanyScoringRules rules;
    private final Clock clock;
    private final ScannerMetrics metrics;

    /**
     * Recompute and persist the scores of one company.
     *
     * @throws IllegalArgumentException if the company does not exist
     */
    @Transactional
    public ScoreBreakdown refresh(Long companyId) {
        Company company = signalStore.findCompany(companyId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown company id: " + companyId));

        CompanyScores scores = compute(signalStore.getEvidenceSignals(companyId), LocalDate.now(clock));

        ScoreBreakdown breakdown = signalStore.upsertScoreBreakdown(companyId, scores);
        signalStore.updateCompanyScore(companyId, scores.composite());
        metrics.recordScoreRefreshed();

        log.debug("Refreshed {}: composite {} (leadership {}, tools {}, culture {}, depth {}, recency {})",
                company.getName(), scores.composite(), scores.leadership(), scores.toolAdoption(),
                scores.culture(), scores.evidenceDepth(), scores.recency());
        return breakdown;
    }

    /**
     * Recompute every company.
     *
     * @return number of companies refreshed
     */
    public int refreshAll() {
        List<Company> companies = signalStore.getAllCompanies();
        for (Company company : companies) {
            refresh(company.getId());
        }
        log.info("Refreshed scores for {} companies", companies.size());
        return companies.size();
    }

    /**
     * Pure scoring of a company's evidence as of the given day.
     */
    public CompanyScores compute(EvidenceSignals evidence, LocalDate today) {
        double leadership = leadershipScore(evidence.leadership());
        double tools = toolAdoptionScore(evidence.tools());
        double culture = cultureScore(evidence.culture(rules.cultureSignalTypes()));
        double depth = evidenceDepthScore(evidence.totalCount());
        double recency = recencyScore(evidence, today);

        double composite = leadership * rules.leadershipWeight()
                + tools * rules.toolAdoptionWeight()
                + culture * rules.cultureWeight()
                + depth * rules.evidenceDepthWeight()
                + recency * rules.recencyWeight();

        return new CompanyScores(leadership, tools, culture, depth, recency, round2(composite));
    }

    /**
     * Highest impact level plus 0.5 per extra statement, at most three extras.
     */
    double leadershipScore(List<LeadershipSignal> signals) {
        if (signals.isEmpty()) {
            return 0.0;
        }
        double base = signals.stream()
                .mapToDouble(signal -> rules.impactScore(signal.getImpactLevel()))
                .max()
                .orElse(0.0);
        double bonus = Math.min(signals.size() - 1, MAX_EXTRA_LEADERSHIP_SIGNALS) * BONUS_PER_EXTRA;
        return Math.min(base + bonus, MAX_SCORE);
    }

    /**
     * Deepest adoption level plus 0.5 per extra distinct tool, at most four extras.
     */
    double toolAdoptionScore(List<ToolAdoption> tools) {
        if (tools.isEmpty()) {
            return 0.0;
        }
        double base = tools.stream()
                .mapToDouble(tool -> rules.adoptionScore(tool.getAdoptionLevel()))
                .max()
                .orElse(0.0);
        long distinctTools = tools.stream()
                .map(ToolAdoption::getToolName)
                .distinct()
                .count();
        double bonus = Math.min(distinctTools - 1, MAX_EXTRA_TOOLS) * BONUS_PER_EXTRA;
        return Math.min(base + bonus, MAX_SCORE);
    }

    /**
     * Average strength doubled, damped by min(log2(n + 1) / 2.5, 1).
     */
    double cultureScore(List<AiSignal> cultureSignals) {
        if (cultureSignals.isEmpty()) {
            return 0.0;
        }
        double averageStrength = cultureSignals.stream()
                .mapToInt(this::strength)
                .average()
                .orElse(0.0);
        double countFactor = Math.min(log2(cultureSignals.size() + 1) / 2.5, 1.0);
        return Math.min(averageStrength * 2 * countFactor, MAX_SCORE);
    }

    double evidenceDepthScore(int total) {
        if (total == 0) {
            return 0.0;
        }
        return Math.min(log2(total + 1) * 2.5, MAX_SCORE);
    }

    /**
     * Step function of the age in days of the newest dated evidence.
     */
    double recencyScore(EvidenceSignals evidence, LocalDate today) {
        Optional<LocalDate> mostRecent = Stream.of(
                        evidence.leadership().stream().map(LeadershipSignal::getDateObserved),
                        evidence.tools().stream().map(ToolAdoption::getDateObserved),
                        evidence.signals().stream().map(AiSignal::getDateObserved))
                .flatMap(dates -> dates)
                .filter(Objects::nonNull)
                .max(LocalDate::compareTo);

        if (mostRecent.isEmpty()) {
            return NEUTRAL_RECENCY;
        }

        long daysAgo = ChronoUnit.DAYS.between(mostRecent.get(), today);
        if (daysAgo <= 30) {
            return 10.0;
        } else if (daysAgo <= 90) {
            return 9.0;
        } else if (daysAgo <= 180) {
            return 7.0;
        } else if (daysAgo <= 365) {
            return 5.0;
        } else if (daysAgo <= 730) {
            return 3.0;
        }
        return 1.0;
    }

    private int strength(AiSignal signal) {
        Integer strength = signal.getSignalStrength();
        return strength == null || strength <= 0 ? rules.defaultSignalStrength() : strength;
    }

    private static double log2(double value) {
        return Math.log(value) / Math.log(2);
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
