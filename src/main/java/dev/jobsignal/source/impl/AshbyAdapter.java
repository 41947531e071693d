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

import java.util.List;

/**
 * Ashby public posting API. The board slug is the first label of the company
 * domain ("linear.app" -> "linear").
 */
@Slf4j
@Component
public class AshbyAdapter extends AbstractSourceAdapter {

    private static final String API_URL = "https://api.ashbyhq.com/posting-api/job-board/%s";
    private static final String JOB_PAGE_URL = "https://jobs.ashbyhq.com/%s/%s";

    public AshbyAdapter(WebClient.Builder webClientBuilder, ScannerMetrics metrics, SourcesConfig sourcesConfig) {
        super(webClientBuilder, metrics, sourcesConfig);
    }

    @Override
    public String getPlatform() {
        return "ashby";
    }

    protected String getApiUrl(String slug) {
        return String.format(API_URL, slug);
    }

    @Override
    protected Mono<List<CanonicalJob>> fetchCompanyJobs(CompanyDescriptor company) {
        String slug = company.domainSlug();
        if (slug == null) {
            return failure(company, "No domain to derive an Ashby slug for " + company.name());
        }

        return timedGet(getApiUrl(slug), AshbyResponse.class)
                .map(response -> {
                    if (response.getJobs() == null) {
                        return List.<CanonicalJob>of();
                    }
                    return response.getJobs().stream()
                            .map(job -> mapToJob(job, slug))
                            .toList();
                });
    }

    private CanonicalJob mapToJob(AshbyJob ashbyJob, String slug) {
        String url = ashbyJob.getJobUrl();
        if (clean(url) == null && clean(ashbyJob.getId()) != null) {
            url = String.format(JOB_PAGE_URL, slug, ashbyJob.getId());
        }

        String description = clean(ashbyJob.getDescriptionPlain()) != null
                ? ashbyJob.getDescriptionPlain()
                : stripHtml(ashbyJob.getDescriptionHtml());

        return CanonicalJob.builder()
                .title(ashbyJob.getTitle())
                .url(url)
                .location(ashbyJob.getLocation())
                .department(ashbyJob.getDepartment())
                .description(description)
                .datePosted(parseDate(ashbyJob.getPublishedAt()))
                .build();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class AshbyResponse {
        private List<AshbyJob> jobs;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class AshbyJob {
        private String id;
        private String title;
        private String location;
        private String department;
        private String descriptionPlain;
        private String descriptionHtml;
        private String publishedAt;
        private String jobUrl;
    }
}
