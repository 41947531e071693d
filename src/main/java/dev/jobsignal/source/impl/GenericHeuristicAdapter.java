package dev.jobsignal.source.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.jobsignal.config.SourcesConfig;
import dev.jobsignal.metrics.ScannerMetrics;
import dev.jobsignal.model.CanonicalJob;
import dev.jobsignal.model.CompanyDescriptor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Best-effort scraper for career pages with no known API.
 * <p>
 * Tries schema.org JobPosting JSON-LD first and falls back to anchors whose
 * href looks like a job detail page. Pages rendered client-side usually
 * yield nothing.
 */
@Slf4j
@Component
public class GenericHeuristicAdapter extends AbstractSourceAdapter {

    private static final Pattern JOB_LINK = Pattern.compile(
            "/(jobs?|careers?|positions?|openings?|roles?)/[a-zA-Z0-9\\-_]+",
            Pattern.CASE_INSENSITIVE);

    private static final Set<String> NAVIGATION_TEXT = Set.of(
            "apply", "learn more", "view", "see all", "back", "home", "jobs", "careers");

    private static final int MIN_TITLE_LENGTH = 3;
    private static final int MAX_TITLE_LENGTH = 200;

    private final ObjectMapper objectMapper;

    public GenericHeuristicAdapter(WebClient.Builder webClientBuilder, ScannerMetrics metrics,
                                   SourcesConfig sourcesConfig, ObjectMapper objectMapper) {
        super(webClientBuilder, metrics, sourcesConfig);
        this.objectMapper = objectMapper;
    }

    @Override
    public String getPlatform() {
        return "custom";
    }

    @Override
    protected Mono<List<CanonicalJob>> fetchCompanyJobs(CompanyDescriptor company) {
        String careersUrl = clean(company.careersUrl());
        if (careersUrl == null) {
            log.debug("custom - {} has no careers URL, skipping", company.name());
            return Mono.just(List.of());
        }

        return timedGet(careersUrl, String.class)
                .map(html -> extract(html, careersUrl));
    }

    List<CanonicalJob> extract(String html, String baseUrl) {
        if (html == null || html.isBlank()) {
            return List.of();
        }
        Document document = Jsoup.parse(html, baseUrl);

        List<CanonicalJob> jobs = extractJsonLd(document, baseUrl);
        if (!jobs.isEmpty()) {
            return jobs;
        }
        return extractJobLinks(document);
    }

    private List<CanonicalJob> extractJsonLd(Document document, String baseUrl) {
        List<JsonNode> postings = new ArrayList<>();
        for (Element script : document.select("script[type=application/ld+json]")) {
            String payload = script.data();
            if (payload == null || payload.isBlank()) {
                continue;
            }
            try {
                collectJobPostings(objectMapper.readTree(payload), postings);
            } catch (JsonProcessingException e) {
                log.debug("custom - skipping malformed JSON-LD block on {}: {}", baseUrl, e.getOriginalMessage());
            }
        }

        List<CanonicalJob> jobs = new ArrayList<>();
        for (JsonNode node : postings) {
            jobs.add(mapJsonLd(node, baseUrl));
        }
        return jobs;
    }

    private void collectJobPostings(JsonNode node, List<JsonNode> out) {
        if (node == null || node.isNull()) {
            return;
        }
        if (node.isObject()) {
            if (isJobPosting(node.get("@type"))) {
                out.add(node);
                return;
            }
            node.fields().forEachRemaining(entry -> {
                JsonNode value = entry.getValue();
                if (value.isArray() || value.isObject()) {
                    collectJobPostings(value, out);
                }
            });
            return;
        }
        if (node.isArray()) {
            for (JsonNode child : node) {
                collectJobPostings(child, out);
            }
        }
    }

    private boolean isJobPosting(JsonNode typeNode) {
        if (typeNode == null || typeNode.isNull()) {
            return false;
        }
        if (typeNode.isTextual()) {
            return "jobposting".equalsIgnoreCase(typeNode.asText());
        }
        if (typeNode.isArray()) {
            for (JsonNode child : typeNode) {
                if (child.isTextual() && "jobposting".equalsIgnoreCase(child.asText())) {
                    return true;
                }
            }
        }
        return false;
    }

    private CanonicalJob mapJsonLd(JsonNode node, String baseUrl) {
        String title = firstNonBlank(text(node, "title"), text(node, "name"));
        String description = text(node, "description");
        if (description != null && description.contains("<")) {
            description = stripHtml(description);
        }

        return CanonicalJob.builder()
                .title(title)
                .url(resolveUrl(text(node, "url"), baseUrl))
                .location(extractLocation(node))
                .department(text(node.path("employmentUnit"), "name"))
                .description(description)
                .datePosted(parseDate(text(node, "datePosted")))
                .build();
    }

    private String extractLocation(JsonNode posting) {
        if ("TELECOMMUTE".equalsIgnoreCase(text(posting, "jobLocationType"))) {
            return "Remote";
        }
        JsonNode jobLocation = posting.get("jobLocation");
        if (jobLocation == null || jobLocation.isNull()) {
            return null;
        }
        if (jobLocation.isArray()) {
            jobLocation = jobLocation.isEmpty() ? null : jobLocation.get(0);
            if (jobLocation == null) {
                return null;
            }
        }
        if (jobLocation.isTextual()) {
            return jobLocation.asText();
        }

        JsonNode address = jobLocation.get("address");
        if (address == null || address.isNull()) {
            return text(jobLocation, "name");
        }
        if (address.isTextual()) {
            return address.asText();
        }
        List<String> parts = new ArrayList<>();
        addIfPresent(parts, text(address, "addressLocality"));
        addIfPresent(parts, text(address, "addressRegion"));
        return parts.isEmpty() ? text(jobLocation, "name") : String.join(", ", parts);
    }

    private List<CanonicalJob> extractJobLinks(Document document) {
        Set<String> seenUrls = new LinkedHashSet<>();
        List<CanonicalJob> jobs = new ArrayList<>();

        for (Element link : document.select("a[href]")) {
            String href = link.attr("href");
            if (!JOB_LINK.matcher(href).find()) {
                continue;
            }

            String url = link.absUrl("href");
            if (url.isEmpty()) {
                url = href;
            }
            if (!seenUrls.add(url)) {
                continue;
            }

            String title = link.text().trim();
            if (title.length() < MIN_TITLE_LENGTH || title.length() > MAX_TITLE_LENGTH) {
                continue;
            }
            if (NAVIGATION_TEXT.contains(title.toLowerCase())) {
                continue;
            }

            jobs.add(CanonicalJob.builder()
                    .title(title)
                    .url(url)
                    .build());
        }
        return jobs;
    }

    private String resolveUrl(String url, String baseUrl) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            return URI.create(baseUrl).resolve(url.trim()).toString();
        } catch (IllegalArgumentException e) {
            log.debug("custom - cannot resolve '{}' against {}", url, baseUrl);
            return url;
        }
    }

    private String text(JsonNode node, String field) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isTextual() || value.isNumber() || value.isBoolean()) {
            return value.asText().trim();
        }
        return null;
    }

    private String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }

    private void addIfPresent(List<String> list, String value) {
        if (value != null && !value.isBlank()) {
            list.add(value.trim());
        }
    }
}
