package dev.jobsignal.source.impl;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.jobsignal.config.SourcesConfig;
import dev.jobsignal.metrics.ScannerMetrics;
import dev.jobsignal.model.CanonicalJob;
import dev.jobsignal.model.CompanyDescriptor;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;

/**
 * Lever public postings API. The board slug is the first label of the
 * company domain ("netflix.com" -> "netflix").
 */
@Slf4j
@Component
public class LeverAdapter extends AbstractSourceAdapter {

    private static final String API_URL = "https://api.lever.co/v0/postings/%s?mode=json";

    public LeverAdapter(WebClient.Builder webClientBuilder, ScannerMetrics metrics, SourcesConfig sourcesConfig) {
        super(webClientBuilder, metrics, sourcesConfig);
    }

    @Override
    public String getPlatform() {
        return "lever";
    }

    protected String getApiUrl(String slug) {
        return String.format(API_URL, slug);
    }

    @Override
    protected Mono<List<CanonicalJob>> fetchCompanyJobs(CompanyDescriptor company) {
        String slug = company.domainSlug();
        if (slug == null) {
            return failure(company, "No domain to derive a Lever slug for " + company.name());
        }

        return timedGet(getApiUrl(slug), LeverPosting[].class)
                .map(postings -> Arrays.stream(postings)
                        .map(this::mapToJob)
                        .toList());
    }

    private CanonicalJob mapToJob(LeverPosting posting) {
        LeverCategories categories = posting.getCategories();
        String location = null;
        String department = null;
        if (categories != null) {
            location = categories.getLocation();
            department = clean(categories.getDepartment()) != null ? categories.getDepartment() : categories.getTeam();
        }

        String url = clean(posting.getHostedUrl()) != null ? posting.getHostedUrl() : posting.getApplyUrl();

        return CanonicalJob.builder()
                .title(posting.getText())
                .url(url)
                .location(location)
                .department(department)
                .description(posting.getDescriptionPlain())
                .datePosted(toDate(posting.getCreatedAt()))
                .build();
    }

    private LocalDate toDate(Long epochMillis) {
        if (epochMillis == null) {
            return null;
        }
        return Instant.ofEpochMilli(epochMillis).atZone(ZoneOffset.UTC).toLocalDate();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class LeverPosting {
        private String text;
        private String hostedUrl;
        private String applyUrl;
        private String descriptionPlain;
        private Long createdAt;
        private LeverCategories categories;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class LeverCategories {
        private String location;
        private String department;
        private String team;
    }
}
