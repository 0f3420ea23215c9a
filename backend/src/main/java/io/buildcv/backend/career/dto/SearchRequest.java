package io.buildcv.backend.career.dto;

import io.buildcv.backend.career.RequestNormalizer;
import io.buildcv.backend.store.HighlightType;
import io.buildcv.backend.store.SearchFilters;
import java.util.List;

public record SearchRequest(
    String query,
    List<HighlightType> types,
    List<String> domains,
    List<String> skills,
    Boolean onlyWithMetrics) {

  public SearchFilters toFilters() {
    return new SearchFilters(
        RequestNormalizer.blankToNull(query),
        types,
        RequestNormalizer.tags(domains),
        RequestNormalizer.tags(skills),
        onlyWithMetrics);
  }
}
