package dev.jobsignal.source.impl;

import dev.jobsignal.config.SourcesConfig;
import dev.jobsignal.metrics.ScannerMetrics;
import dev.jobsignal.model.CanonicalJob;
import dev.jobsignal.model.CompanyDescriptor;
import dev.jobsignal.source.SourceAdapter;
import dev.jobsignal.source.SourceFetchException;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Objects;

@Slf4j
public abstract class AbstractSourceAdapter implements SourceAdapter {

    protected final WebClient webClient;
    protected final ScannerMetrics metrics;
    protected final SourcesConfig sourcesConfig;

    protected AbstractSourceAdapter(WebClient.Builder webClientBuilder, ScannerMetrics metrics,
                                    SourcesConfig sourcesConfig) {
        HttpClient httpClient = HttpClient.create()
                .followRedirect(true)
                .httpResponseDecoder(spec -> spec.maxHeaderSize(32768));

        this.webClient = webClientBuilder
                .codecs(config -> config.defaultCodecs().maxInMemorySize(10 * 1024 * 1024))
                .clientConnector(new ReactorClientHttpConnector(Objects.requireNonNull(httpClient)))
                .defaultHeader("User-Agent", sourcesConfig.getUserAgent())
                .defaultHeader("Accept", "application/json, text/html;q=0.9, */*;q=0.8")
                .defaultHeader("Accept-Language", "en-US,en;q=0.9")
                .build();
        this.metrics = metrics;
        this.sourcesConfig = sourcesConfig;
    }

    /**
     * Fetch and map one company's postings. May emit an error or return
     * postings with blank fields; {@link #fetchJobs} cleans both up.
     */
    protected abstract Mono<List<CanonicalJob>> fetchCompanyJobs(CompanyDescriptor company);

    @Override
    public Mono<List<CanonicalJob>> fetchJobs(CompanyDescriptor company) {
        return Mono.defer(() -> fetchCompanyJobs(company))
                .defaultIfEmpty(List.of())
                .map(jobs -> jobs.stream()
                        .map(this::normalize)
                        .filter(Objects::nonNull)
                        .toList())
                .doOnNext(jobs -> {
                    log.debug("{} - {} returned {} postings", getPlatform(), company.name(), jobs.size());
                    metrics.recordJobsDiscovered(getPlatform(), jobs.size());
                })
                .onErrorMap(e -> !(e instanceof SourceFetchException),
                        e -> new SourceFetchException(getPlatform(), company.name(), e));
    }

    protected <T> Mono<T> failure(CompanyDescriptor company, String message) {
        return Mono.error(new SourceFetchException(getPlatform(), company.name(), message));
    }

    /**
     * Trim every field, turn blanks into nulls and cap the description.
     * Postings without a title are dropped.
     */
    protected CanonicalJob normalize(CanonicalJob job) {
        String title = clean(job.title());
        if (title == null) {
            return null;
        }
        return CanonicalJob.builder()
                .title(title)
                .url(clean(job.url()))
                .location(clean(job.location()))
                .department(clean(job.department()))
                .description(truncate(clean(job.description())))
                .datePosted(job.datePosted())
                .build();
    }

    /**
     * Strip HTML tags from text.
     */
    protected String stripHtml(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        return Jsoup.parse(html).text();
    }

    protected String clean(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    protected String truncate(String description) {
        int max = sourcesConfig.getMaxDescriptionLength();
        if (description == null || max <= 0 || description.length() <= max) {
            return description;
        }
        return description.substring(0, max);
    }

    /**
     * Date part of an ISO date or date-time string, or null if unreadable.
     */
    protected LocalDate parseDate(String value) {
        if (value == null || value.length() < 10) {
            return null;
        }
        try {
            return LocalDate.parse(value.substring(0, 10));
        } catch (DateTimeParseException e) {
            log.debug("{} - unreadable date '{}'", getPlatform(), value);
            return null;
        }
    }

    /**
     * Execute a timed GET request.
     */
    @SuppressWarnings("null")
    protected <T> Mono<T> timedGet(String url, Class<T> responseType) {
        long start = System.currentTimeMillis();
        return webClient.get()
                .uri(url)
                .retrieve()
                .bodyToMono(responseType)
                .timeout(Duration.ofSeconds(sourcesConfig.getTimeoutSeconds()))
                .doOnTerminate(() -> {
                    long latency = System.currentTimeMillis() - start;
                    metrics.recordFetchLatency(getPlatform(), latency);
                });
    }
}
