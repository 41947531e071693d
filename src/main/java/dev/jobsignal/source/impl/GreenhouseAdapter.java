package dev.jobsignal.source.impl;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.jobsignal.config.SourcesConfig;
import dev.jobsignal.metrics.ScannerMetrics;
import dev.jobsignal.model.CanonicalJob;
import dev.jobsignal.model.CompanyDescriptor;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.parser.Parser;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Greenhouse public boards API. The board token is looked up by company domain.
 */
@Slf4j
@Component
public class GreenhouseAdapter extends AbstractSourceAdapter {

    private static final String API_URL = "https://boards-api.greenhouse.io/v1/boards/%s/jobs?content=true";

    public GreenhouseAdapter(WebClient.Builder webClientBuilder, ScannerMetrics metrics, SourcesConfig sourcesConfig) {
        super(webClientBuilder, metrics, sourcesConfig);
    }

    @Override
    public String getPlatform() {
        return "greenhouse";
    }

    protected String getApiUrl(String token) {
        return String.format(API_URL, token);
    }

    @Override
    protected Mono<List<CanonicalJob>> fetchCompanyJobs(CompanyDescriptor company) {
        String token = sourcesConfig.greenhouseToken(company.domain());
        if (token == null) {
            return failure(company, "No Greenhouse token for domain: " + company.domain());
        }

        return timedGet(getApiUrl(token), GreenhouseResponse.class)
                .map(response -> {
                    if (response.getJobs() == null) {
                        return List.<CanonicalJob>of();
                    }
                    return response.getJobs().stream()
                            .map(this::mapToJob)
                            .toList();
                });
    }

    private CanonicalJob mapToJob(GreenhouseJob ghJob) {
        String location = ghJob.getLocation() != null ? ghJob.getLocation().getName() : null;

        String department = null;
        if (ghJob.getDepartments() != null && !ghJob.getDepartments().isEmpty()) {
            department = ghJob.getDepartments().get(0).getName();
        }

        // content arrives entity-escaped ("&lt;p&gt;...")
        String description = ghJob.getContent() != null
                ? stripHtml(Parser.unescapeEntities(ghJob.getContent(), false))
                : null;

        return CanonicalJob.builder()
                .title(ghJob.getTitle())
                .url(ghJob.getAbsoluteUrl())
                .location(location)
                .department(department)
                .description(description)
                .datePosted(parseDate(ghJob.getUpdatedAt()))
                .build();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class GreenhouseResponse {
        private List<GreenhouseJob> jobs;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class GreenhouseJob {
        private String title;
        @JsonProperty("absolute_url")
        private String absoluteUrl;
        private String content;
        @JsonProperty("updated_at")
        private String updatedAt;
        private NamedRef location;
        private List<NamedRef> departments;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class NamedRef {
        private String name;
    }
}
