package dev.jobsignal.source;

import dev.jobsignal.model.CanonicalJob;
import dev.jobsignal.model.CompanyDescriptor;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AdapterRegistryTest {

  private static SourceAdapter adapter(String platform) {
    return new SourceAdapter() {
      @Override
      public String getPlatform() {
        return platform;
      }

      @Override
      public Mono<List<CanonicalJob>> fetchJobs(CompanyDescriptor company) {
        return Mono.just(List.of());
      }
    };
  }

  @Test
  void shouldResolveCaseInsensitively() {
    SourceAdapter lever = adapter("lever");
    AdapterRegistry registry = new AdapterRegistry(List.of(lever, adapter("ashby")));

    assertThat(registry.resolve("Lever")).containsSame(lever);
    assertThat(registry.resolve(" LEVER ")).containsSame(lever);
    assertThat(registry.platforms()).containsExactly("ashby", "lever");
  }

  @Test
  void shouldReturnEmptyForUnknownPlatform() {
    AdapterRegistry registry = new AdapterRegistry(List.of(adapter("lever")));

    assertThat(registry.resolve("workday")).isEmpty();
    assertThat(registry.resolve(null)).isEmpty();
    assertThat(registry.resolve("  ")).isEmpty();
  }

  @Test
  void shouldRejectDuplicatePlatforms() {
    List<SourceAdapter> adapters = List.of(adapter("lever"), adapter("Lever"));

    assertThatThrownBy(() -> new AdapterRegistry(adapters))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("lever");
  }
}
