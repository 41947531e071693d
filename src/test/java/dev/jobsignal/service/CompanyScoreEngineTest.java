package dev.jobsignal.service;

import dev.jobsignal.config.CompanyScoringRules;
import dev.jobsignal.entity.AiSignal;
import dev.jobsignal.entity.Company;
import dev.jobsignal.entity.LeadershipSignal;
import dev.jobsignal.entity.ScoreBreakdown;
import dev.jobsignal.entity.ToolAdoption;
import dev.jobsignal.metrics.ScannerMetrics;
import dev.jobsignal.model.AdoptionLevel;
import dev.jobsignal.model.CompanyScores;
import dev.jobsignal.model.EvidenceSignals;
import dev.jobsignal.model.ImpactLevel;
import dev.jobsignal.model.SignalType;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CompanyScoreEngineTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 6, 15);

    @Mock
    private SignalStore signalStore;

    private CompanyScoreEngine engine;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-06-15T12:00:00Z"), ZoneOffset.UTC);
        engine = new CompanyScoreEngine(signalStore, CompanyScoringRules.defaults(), clock,
                new ScannerMetrics(new SimpleMeterRegistry()));
    }

    private LeadershipSignal leader(ImpactLevel impact) {
        return LeadershipSignal.builder().companyId(1L).leaderName("CEO").content("AI first").impactLevel(impact).build();
    }

    private ToolAdoption tool(String name, AdoptionLevel level) {
        return ToolAdoption.builder().companyId(1L).toolName(name).adoptionLevel(level).build();
    }

    private AiSignal signal(SignalType type, Integer strength, LocalDate observed) {
        return AiSignal.builder().companyId(1L).signalType(type).title("signal")
                .signalStrength(strength).dateObserved(observed).build();
    }

    private EvidenceSignals evidence(List<LeadershipSignal> leadership, List<ToolAdoption> tools, List<AiSignal> signals) {
        return new EvidenceSignals(leadership, tools, signals);
    }

    @Test
    @DisplayName("Default weights sum to exactly 1.0")
    void defaultWeightsSumToOne() {
        assertThat(CompanyScoringRules.defaults().weightSum()).isEqualTo(1.0);
    }

    @Nested
    @DisplayName("Leadership")
    class LeadershipTests {

        @Test
        @DisplayName("One company-wide signal scores exactly 10")
        void oneCompanyWideSignal() {
            assertThat(engine.leadershipScore(List.of(leader(ImpactLevel.COMPANY_WIDE)))).isEqualTo(10.0);
        }

        @Test
        @DisplayName("Bonus cannot lift a company-wide signal above 10")
        void twoCompanyWideSignalsCapped() {
            assertThat(engine.leadershipScore(List.of(
                    leader(ImpactLevel.COMPANY_WIDE), leader(ImpactLevel.COMPANY_WIDE)))).isEqualTo(10.0);
        }

        @Test
        @DisplayName("Extra statements add 0.5 each, three at most")
        void extraStatementsBonus() {
            assertThat(engine.leadershipScore(List.of(
                    leader(ImpactLevel.ENGINEERING), leader(ImpactLevel.TEAM), leader(ImpactLevel.TEAM))))
                    .isEqualTo(8.0);
            assertThat(engine.leadershipScore(List.of(
                    leader(ImpactLevel.TEAM), leader(ImpactLevel.TEAM), leader(ImpactLevel.TEAM),
                    leader(ImpactLevel.TEAM), leader(ImpactLevel.TEAM), leader(ImpactLevel.TEAM))))
                    .isEqualTo(5.5);
        }

        @Test
        @DisplayName("Unknown impact scores like personal")
        void unknownImpact() {
            assertThat(engine.leadershipScore(List.of(leader(null)))).isEqualTo(2.0);
        }

        @Test
        @DisplayName("No statements scores 0")
        void noStatements() {
            assertThat(engine.leadershipScore(List.of())).isEqualTo(0.0);
        }
    }

    @Nested
    @DisplayName("Tool adoption")
    class ToolAdoptionTests {

        @Test
        @DisplayName("Distinct tools add 0.5 each")
        void diversityBonus() {
            assertThat(engine.toolAdoptionScore(List.of(
                    tool("Copilot", AdoptionLevel.EXPLORING),
                    tool("Cursor", AdoptionLevel.EXPLORING),
                    tool("Claude", AdoptionLevel.RUMORED)))).isEqualTo(4.0);
        }

        @Test
        @DisplayName("Repeated tool names do not count as diversity")
        void repeatedToolNoBonus() {
            assertThat(engine.toolAdoptionScore(List.of(
                    tool("Copilot", AdoptionLevel.ALLOWED),
                    tool("Copilot", AdoptionLevel.EXPLORING)))).isEqualTo(5.0);
        }

        @Test
        @DisplayName("Diversity bonus stops at four extra tools and the total at 10")
        void bonusCapped() {
            List<ToolAdoption> tools = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                tools.add(tool("tool-" + i, AdoptionLevel.ALLOWED));
            }
            assertThat(engine.toolAdoptionScore(tools)).isEqualTo(7.0);

            tools.add(tool("mandated", AdoptionLevel.REQUIRED));
            assertThat(engine.toolAdoptionScore(tools)).isEqualTo(10.0);
        }

        @Test
        @DisplayName("Unknown adoption level scores like rumored")
        void unknownAdoption() {
            assertThat(engine.toolAdoptionScore(List.of(tool("Copilot", null)))).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Culture")
    class CultureTests {

        @Test
        @DisplayName("Single signal with unset strength uses the default and is damped")
        void singleDefaultStrength() {
            // 3 * 2 * min(log2(2) / 2.5, 1)
            assertThat(engine.cultureScore(List.of(signal(SignalType.ENGINEERING_BLOG, null, null))))
                    .isCloseTo(2.4, within(1e-9));
        }

        @Test
        @DisplayName("Many strong signals reach 10")
        void manyStrongSignals() {
            List<AiSignal> signals = new ArrayList<>();
            for (int i = 0; i < 7; i++) {
                signals.add(signal(SignalType.EMPLOYEE_REPORT, 5, null));
            }
            assertThat(engine.cultureScore(signals)).isEqualTo(10.0);
        }

        @Test
        @DisplayName("Only culture-indicating signal types count")
        void nonCultureTypesIgnored() {
            EvidenceSignals evidence = evidence(List.of(), List.of(), List.of(
                    signal(SignalType.PRESS_COVERAGE, 5, null),
                    signal(SignalType.CONFERENCE_TALK, 5, null)));

            CompanyScores scores = engine.compute(evidence, TODAY);

            assertThat(scores.culture()).isEqualTo(0.0);
            assertThat(scores.evidenceDepth()).isGreaterThan(0.0);
        }
    }

    @Nested
    @DisplayName("Evidence depth")
    class EvidenceDepthTests {

        @Test
        @DisplayName("No evidence scores 0")
        void noEvidence() {
            assertThat(engine.evidenceDepthScore(0)).isEqualTo(0.0);
        }

        @Test
        @DisplayName("Fifteen signals land in (7, 10]")
        void fifteenSignals() {
            List<LeadershipSignal> leadership = List.of(leader(ImpactLevel.TEAM), leader(ImpactLevel.TEAM),
                    leader(ImpactLevel.TEAM), leader(ImpactLevel.TEAM), leader(ImpactLevel.TEAM));
            List<ToolAdoption> tools = List.of(tool("a", AdoptionLevel.ALLOWED), tool("b", AdoptionLevel.ALLOWED),
                    tool("c", AdoptionLevel.ALLOWED), tool("d", AdoptionLevel.ALLOWED), tool("e", AdoptionLevel.ALLOWED));
            List<AiSignal> signals = List.of(signal(SignalType.ENGINEERING_BLOG, 3, null),
                    signal(SignalType.PRESS_COVERAGE, 3, null), signal(SignalType.TOOL_MANDATE, 3, null),
                    signal(SignalType.GITHUB_ACTIVITY, 3, null), signal(SignalType.COMPANY_POLICY, 3, null));

            double depth = engine.compute(evidence(leadership, tools, signals), TODAY).evidenceDepth();

            assertThat(depth).isGreaterThan(7.0).isLessThanOrEqualTo(10.0);
        }
    }

    @Nested
    @DisplayName("Recency")
    class RecencyTests {

        @ParameterizedTest(name = "{0} days ago -> {1}")
        @CsvSource({
                "0, 10.0",
                "30, 10.0",
                "31, 9.0",
                "90, 9.0",
                "180, 7.0",
                "365, 5.0",
                "400, 3.0",
                "730, 3.0",
                "731, 1.0"
        })
        void shouldBucketByAge(int daysAgo, double expected) {
            EvidenceSignals evidence = evidence(List.of(), List.of(),
                    List.of(signal(SignalType.PRESS_COVERAGE, null, TODAY.minusDays(daysAgo))));

            assertThat(engine.recencyScore(evidence, TODAY)).isEqualTo(expected);
        }

        @Test
        @DisplayName("Newest date across all evidence kinds wins")
        void newestAcrossKinds() {
            LeadershipSignal old = leader(ImpactLevel.TEAM);
            old.setDateObserved(TODAY.minusDays(1000));
            ToolAdoption recent = tool("Copilot", AdoptionLevel.ALLOWED);
            recent.setDateObserved(TODAY.minusDays(10));

            assertThat(engine.recencyScore(evidence(List.of(old), List.of(recent), List.of()), TODAY))
                    .isEqualTo(10.0);
        }

        @Test
        @DisplayName("No dated evidence is neutral")
        void noDatesNeutral() {
            EvidenceSignals evidence = evidence(List.of(leader(ImpactLevel.TEAM)), List.of(), List.of());

            assertThat(engine.recencyScore(evidence, TODAY)).isEqualTo(5.0);
        }
    }

    @Nested
    @DisplayName("Composite")
    class CompositeTests {

        @Test
        @DisplayName("Empty evidence scores only the neutral recency")
        void emptyEvidence() {
            CompanyScores scores = engine.compute(EvidenceSignals.empty(), TODAY);

            assertThat(scores.leadership()).isEqualTo(0.0);
            assertThat(scores.toolAdoption()).isEqualTo(0.0);
            assertThat(scores.culture()).isEqualTo(0.0);
            assertThat(scores.evidenceDepth()).isEqualTo(0.0);
            assertThat(scores.recency()).isEqualTo(5.0);
            assertThat(scores.composite()).isEqualTo(0.5);
        }

        @Test
        @DisplayName("Composite is the weighted sum rounded to two decimals")
        void weightedSum() {
            EvidenceSignals evidence = evidence(
                    List.of(leader(ImpactLevel.COMPANY_WIDE)),
                    List.of(tool("Copilot", AdoptionLevel.REQUIRED)),
                    List.of(signal(SignalType.ENGINEERING_BLOG, 5, TODAY)));

            CompanyScores scores = engine.compute(evidence, TODAY);

            double expected = 10.0 * 0.30 + 10.0 * 0.25 + scores.culture() * 0.25
                    + scores.evidenceDepth() * 0.10 + 10.0 * 0.10;
            assertThat(scores.composite()).isCloseTo(expected, within(0.005));
        }

        @Test
        @DisplayName("Computing twice gives identical scores")
        void idempotent() {
            EvidenceSignals evidence = evidence(
                    List.of(leader(ImpactLevel.ENGINEERING)),
                    List.of(tool("Cursor", AdoptionLevel.ENCOURAGED)),
                    List.of(signal(SignalType.EMPLOYEE_REPORT, 4, TODAY.minusDays(45))));

            assertThat(engine.compute(evidence, TODAY)).isEqualTo(engine.compute(evidence, TODAY));
        }

        @Test
        @DisplayName("Every score stays within 0..10 for random evidence")
        void boundsOnRandomEvidence() {
            Random random = new Random(7);
            ImpactLevel[] impacts = ImpactLevel.values();
            AdoptionLevel[] adoptions = AdoptionLevel.values();
            SignalType[] types = SignalType.values();

            for (int round = 0; round < 300; round++) {
                List<LeadershipSignal> leadership = new ArrayList<>();
                for (int i = random.nextInt(6); i > 0; i--) {
                    leadership.add(leader(random.nextInt(5) == 0 ? null : impacts[random.nextInt(impacts.length)]));
                }
                List<ToolAdoption> tools = new ArrayList<>();
                for (int i = random.nextInt(8); i > 0; i--) {
                    tools.add(tool("tool-" + random.nextInt(6), adoptions[random.nextInt(adoptions.length)]));
                }
                List<AiSignal> signals = new ArrayList<>();
                for (int i = random.nextInt(20); i > 0; i--) {
                    Integer strength = random.nextInt(4) == 0 ? null : 1 + random.nextInt(5);
                    LocalDate observed = random.nextBoolean() ? null : TODAY.minusDays(random.nextInt(1500));
                    signals.add(signal(types[random.nextInt(types.length)], strength, observed));
                }

                CompanyScores scores = engine.compute(evidence(leadership, tools, signals), TODAY);

                assertThat(List.of(scores.leadership(), scores.toolAdoption(), scores.culture(),
                        scores.evidenceDepth(), scores.recency(), scores.composite()))
                        .allSatisfy(score -> assertThat(score).isBetween(0.0, 10.0));
            }
        }
    }

    @Nested
    @DisplayName("Refresh")
    class RefreshTests {

        @Test
        @DisplayName("Should persist the breakdown and mirror the composite")
        void shouldPersistAndMirror() {
            Company company = Company.builder().id(1L).name("Acme").build();
            EvidenceSignals evidence = evidence(List.of(leader(ImpactLevel.COMPANY_WIDE)), List.of(), List.of());
            CompanyScores expected = engine.compute(evidence, TODAY);
            ScoreBreakdown saved = ScoreBreakdown.builder().companyId(1L).compositeScore(expected.composite()).build();

            when(signalStore.findCompany(1L)).thenReturn(Optional.of(company));
            when(signalStore.getEvidenceSignals(1L)).thenReturn(evidence);
            when(signalStore.upsertScoreBreakdown(1L, expected)).thenReturn(saved);

            ScoreBreakdown result = engine.refresh(1L);

            assertThat(result).isSameAs(saved);
            verify(signalStore).updateCompanyScore(1L, expected.composite());
        }

        @Test
        @DisplayName("Should reject an unknown company")
        void shouldRejectUnknownCompany() {
            when(signalStore.findCompany(99L)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> engine.refresh(99L))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("99");
            verify(signalStore, never()).upsertScoreBreakdown(any(), any());
        }

        @Test
        @DisplayName("refreshAll returns the number of companies refreshed")
        void refreshAllCounts() {
            Company first = Company.builder().id(1L).name("Acme").build();
            Company second = Company.builder().id(2L).name("Globex").build();
            when(signalStore.getAllCompanies()).thenReturn(List.of(first, second));
            when(signalStore.findCompany(1L)).thenReturn(Optional.of(first));
            when(signalStore.findCompany(2L)).thenReturn(Optional.of(second));
            when(signalStore.getEvidenceSignals(any())).thenReturn(EvidenceSignals.empty());
            when(signalStore.upsertScoreBreakdown(any(), any())).thenReturn(new ScoreBreakdown());

            assertThat(engine.refreshAll()).isEqualTo(2);
            verify(signalStore).updateCompanyScore(1L, 0.5);
            verify(signalStore).updateCompanyScore(2L, 0.5);
        }
    }
}
