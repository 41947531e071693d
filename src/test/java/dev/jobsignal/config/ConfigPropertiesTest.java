package dev.jobsignal.config;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import dev.jobsignal.CommandRunner;
import dev.jobsignal.ExitManager;
import dev.jobsignal.model.AdoptionLevel;
import dev.jobsignal.model.ImpactLevel;
import dev.jobsignal.source.AdapterRegistry;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class ConfigPropertiesTest {

  @MockitoBean
  private CommandRunner commandRunner;

  @MockitoBean
  private ExitManager exitManager;

  @Autowired
  private SourcesConfig sourcesConfig;

  @Autowired
  private JobScoringRules jobScoringRules;

  @Autowired
  private CompanyScoringRules companyScoringRules;

  @Autowired
  private AdapterRegistry adapterRegistry;

  @Test
  void shouldLoadSourcesConfig() {
    assertThat(sourcesConfig.getTimeoutSeconds()).isEqualTo(5);
    assertThat(sourcesConfig.greenhouseToken("Example.com")).isEqualTo("example-board");
    assertThat(sourcesConfig.greenhouseToken("anthropic.com")).isEqualTo("anthropic");
    assertThat(sourcesConfig.greenhouseToken("unknown.org")).isNull();
  }

  @Test
  void shouldMapBoardTokensThatDifferFromDomain() {
    assertThat(sourcesConfig.greenhouseToken("scale.com")).isEqualTo("scaleai");
    assertThat(sourcesConfig.greenhouseToken("getdbt.com")).isEqualTo("daboraio");
    assertThat(sourcesConfig.greenhouseToken("together.ai")).isEqualTo("togetherai");
    assertThat(sourcesConfig.greenhouseToken("stripe.com")).isNull();
  }

  @Test
  void shouldBuildJobScoringRules() {
    assertThat(jobScoringRules.weightSum()).isEqualTo(1.0);
    assertThat(jobScoringRules.targetRoles()).contains("data engineer");
    assertThat(jobScoringRules.preferredLocations()).contains("remote");
  }

  @Test
  void shouldBuildCompanyScoringRules() {
    assertThat(companyScoringRules.weightSum()).isEqualTo(1.0);
    assertThat(companyScoringRules.impactScore(ImpactLevel.COMPANY_WIDE)).isEqualTo(10.0);
    assertThat(companyScoringRules.adoptionScore(AdoptionLevel.REQUIRED)).isEqualTo(10.0);
    assertThat(companyScoringRules.impactScore(null)).isEqualTo(2.0);
  }

  @Test
  void shouldRegisterEveryAdapter() {
    assertThat(adapterRegistry.platforms()).containsExactlyInAnyOrder("greenhouse", "lever", "ashby", "custom");
  }
}
