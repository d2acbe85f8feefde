package com.gazetteindex.query;

import java.util.List;

public record SearchResult(
        List<SearchHit> hits,
        int count,
        long elapsedMs,
        SearchFilters filters
) {
}
