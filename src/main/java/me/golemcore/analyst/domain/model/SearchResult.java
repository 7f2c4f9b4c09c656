package me.golemcore.analyst.domain.model;

import java.util.List;
import java.util.Map;

/**
 * Matches returned by the search backend.
 *
 * @param total
 *            total number of matches reported by the backend
 * @param hits
 *            returned documents, at most the requested size
 */
public record SearchResult(long total, List<Map<String, Object>> hits) {

    public SearchResult {
        hits = hits != null ? List.copyOf(hits) : List.of();
    }

    public static SearchResult empty() {
        return new SearchResult(0, List.of());
    }
}
