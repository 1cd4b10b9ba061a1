package com.livebundle.core.watch;

import com.livebundle.core.config.LivebundleProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Decides whether a changed file can affect a bundle.
 * <p>
 * A path is relevant when it ends with one of the source extensions and contains
 * none of the noise markers (dependency trees, tests, VCS metadata, OS litter).
 * Backslashes are normalized to {@code /} before matching.
 */
@Component
public class ChangeFilter {

    private final List<String> relevantExtensions;
    private final List<String> ignoredMarkers;

    @Autowired
    public ChangeFilter(LivebundleProperties properties) {
        this(properties.getRelevantExtensions(), properties.getIgnoredPathMarkers());
    }

    public ChangeFilter(List<String> relevantExtensions, List<String> ignoredMarkers) {
        this.relevantExtensions = relevantExtensions.stream()
                .map(ext -> ext.toLowerCase(Locale.ROOT))
                .toList();
        this.ignoredMarkers = List.copyOf(ignoredMarkers);
    }

    public boolean isRelevant(String filePath) {
        if (filePath == null || filePath.isBlank()) {
            return false;
        }
        String normalized = filePath.replace('\\', '/');
        // Markers like "node_modules/" must also match at the start of a relative path
        String anchored = normalized.startsWith("/") ? normalized : "/" + normalized;

        for (String marker : ignoredMarkers) {
            if (anchored.contains(marker)) {
                return false;
            }
        }

        String lower = normalized.toLowerCase(Locale.ROOT);
        for (String ext : relevantExtensions) {
            if (lower.endsWith(ext)) {
                return true;
            }
        }
        return false;
    }
}
