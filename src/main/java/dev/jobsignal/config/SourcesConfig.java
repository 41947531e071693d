package dev.jobsignal.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration for job board adapters.
 * Loaded from application.yml under 'sources' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "sources")
public class SourcesConfig {

    private int timeoutSeconds = 30;
    private int maxDescriptionLength = 5000;
    private String userAgent =
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/121.0.0.0 Safari/537.36";

    /**
     * Company domain -> Greenhouse board token (e.g. "anthropic.com" -> "anthropic").
     */
    private Map<String, String> greenhouseTokens = new LinkedHashMap<>();

    public String greenhouseToken(String domain) {
        if (domain == null) {
            return null;
        }
        return greenhouseTokens.get(domain.trim().toLowerCase());
    }
}
