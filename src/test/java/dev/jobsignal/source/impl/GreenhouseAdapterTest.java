package dev.jobsignal.source.impl;

import dev.jobsignal.config.SourcesConfig;
import dev.jobsignal.metrics.ScannerMetrics;
import dev.jobsignal.model.CanonicalJob;
import dev.jobsignal.model.CompanyDescriptor;
import dev.jobsignal.source.SourceFetchException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class GreenhouseAdapterTest {

  private static final CompanyDescriptor COMPANY =
      new CompanyDescriptor(1L, "Example", "greenhouse", "example.com", null);

  private MockWebServer mockWebServer;
  private SourcesConfig sourcesConfig;
  private GreenhouseAdapter greenhouseAdapter;

  @BeforeEach
  void setUp() throws IOException {
    mockWebServer = new MockWebServer();
    mockWebServer.start();

    sourcesConfig = new SourcesConfig();
    sourcesConfig.getGreenhouseTokens().put("example.com", "example-board");
    ScannerMetrics metrics = new ScannerMetrics(new SimpleMeterRegistry());
    greenhouseAdapter = new TestGreenhouseAdapter(WebClient.builder(), metrics, sourcesConfig,
        mockWebServer.url("/").toString());
  }

  @AfterEach
  void tearDown() throws IOException {
    mockWebServer.shutdown();
  }

  @Test
  void shouldFetchAndMapJobsCorrectly() {
    String jsonResponse = """
        {
            "jobs": [
                {
                    "id": 12345,
                    "title": "Senior Data Engineer",
                    "location": { "name": "Remote - US" },
                    "departments": [ { "name": "Data Platform" } ],
                    "absolute_url": "https://boards.greenhouse.io/example/jobs/12345",
                    "updated_at": "2025-03-01T10:00:00-05:00",
                    "content": "&lt;p&gt;Build &lt;b&gt;pipelines&lt;/b&gt; with Spark&lt;/p&gt;"
                },
                {
                    "id": 12346,
                    "title": "  ",
                    "absolute_url": "https://boards.greenhouse.io/example/jobs/12346"
                }
            ]
        }
        """;

    mockWebServer.enqueue(new MockResponse()
        .setBody(jsonResponse)
        .addHeader("Content-Type", "application/json"));

    StepVerifier.create(greenhouseAdapter.fetchJobs(COMPANY))
        .assertNext(jobs -> {
          assertThat(jobs).hasSize(1);
          CanonicalJob job = jobs.get(0);
          assertThat(job.title()).isEqualTo("Senior Data Engineer");
          assertThat(job.url()).isEqualTo("https://boards.greenhouse.io/example/jobs/12345");
          assertThat(job.location()).isEqualTo("Remote - US");
          assertThat(job.department()).isEqualTo("Data Platform");
          assertThat(job.description()).isEqualTo("Build pipelines with Spark");
          assertThat(job.datePosted()).isEqualTo(LocalDate.of(2025, 3, 1));
        })
        .verifyComplete();
  }

  @Test
  void shouldHandleMissingJobsArray() {
    mockWebServer.enqueue(new MockResponse()
        .setBody("{}")
        .addHeader("Content-Type", "application/json"));

    StepVerifier.create(greenhouseAdapter.fetchJobs(COMPANY))
        .assertNext(jobs -> assertThat(jobs).isEmpty())
        .verifyComplete();
  }

  @Test
  void shouldFailWithoutBoardToken() {
    CompanyDescriptor unknown = new CompanyDescriptor(2L, "Globex", "greenhouse", "globex.com", null);

    StepVerifier.create(greenhouseAdapter.fetchJobs(unknown))
        .expectErrorSatisfies(error -> assertThat(error)
            .isInstanceOf(SourceFetchException.class)
            .hasMessageContaining("globex.com"))
        .verify();
    assertThat(mockWebServer.getRequestCount()).isZero();
  }

  @Test
  void shouldFailOnServerError() {
    mockWebServer.enqueue(new MockResponse().setResponseCode(500));

    StepVerifier.create(greenhouseAdapter.fetchJobs(COMPANY))
        .expectError(SourceFetchException.class)
        .verify();
  }

  @Test
  void shouldBuildApiUrlFromToken() {
    GreenhouseAdapter adapter = new GreenhouseAdapter(WebClient.builder(),
        new ScannerMetrics(new SimpleMeterRegistry()), sourcesConfig);

    assertThat(adapter.getApiUrl("example-board"))
        .isEqualTo("https://boards-api.greenhouse.io/v1/boards/example-board/jobs?content=true");
  }

  static class TestGreenhouseAdapter extends GreenhouseAdapter {
    private final String mockUrl;

    public TestGreenhouseAdapter(WebClient.Builder builder, ScannerMetrics metrics, SourcesConfig config, String url) {
      super(builder, metrics, config);
      this.mockUrl = url;
    }

    @Override
    protected String getApiUrl(String token) {
      return mockUrl;
    }
  }
}
