package io.buildcv.backend.store;

import java.util.List;

/**
 * Highlight search criteria. Every present criterion must hold; a {@code null} or empty field does
 * not constrain the result.
 *
 * @param query case-insensitive substring of title or content
 * @param types at least one must equal the highlight type
 * @param domains at least one must appear in the highlight's domains
 * @param skills at least one must appear in the highlight's skills
 * @param onlyWithMetrics when {@code true}, the highlight must carry a metric
 */
public record SearchFilters(
    String query,
    List<HighlightType> types,
    List<String> domains,
    List<String> skills,
    Boolean onlyWithMetrics) {

  public static SearchFilters none() {
    return new SearchFilters(null, null, null, null, null);
  }
}
