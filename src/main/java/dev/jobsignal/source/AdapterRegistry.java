package dev.jobsignal.source;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Maps a careers platform key to its adapter. Built once from the adapter
 * beans; unknown platforms resolve to empty.
 */
@Slf4j
@Component
public class AdapterRegistry {

    private final Map<String, SourceAdapter> adapters;

    public AdapterRegistry(List<SourceAdapter> sourceAdapters) {
        Map<String, SourceAdapter> byPlatform = new TreeMap<>();
        for (SourceAdapter adapter : sourceAdapters) {
            String key = normalize(adapter.getPlatform());
            SourceAdapter previous = byPlatform.putIfAbsent(key, adapter);
            if (previous != null) {
                throw new IllegalStateException("Two adapters registered for platform '" + key + "': "
                        + previous.getClass().getSimpleName() + ", " + adapter.getClass().getSimpleName());
            }
        }
        this.adapters = Collections.unmodifiableMap(byPlatform);
        log.info("Source adapters registered: {}", adapters.keySet());
    }

    public Optional<SourceAdapter> resolve(String platform) {
        if (platform == null || platform.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(adapters.get(normalize(platform)));
    }

    public Set<String> platforms() {
        return adapters.keySet();
    }

    private static String normalize(String platform) {
        return platform.trim().toLowerCase(Locale.ROOT);
    }
}
