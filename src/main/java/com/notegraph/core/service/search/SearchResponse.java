package com.notegraph.core.service.search;

import java.util.List;

public record SearchResponse(SearchQuery query, List<SearchResultItem> items, long durationMs) {
}
