package io.buildcv.backend.store;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

/** Applies {@link SearchFilters} to highlights. Both store implementations filter through here. */
public final class HighlightSearch {

  private HighlightSearch() {}

  public static Predicate<Highlight> predicate(SearchFilters filters) {
    Predicate<Highlight> predicate = highlight -> true;
    if (filters == null) {
      return predicate;
    }
    if (filters.query() != null && !filters.query().isBlank()) {
      String query = filters.query().trim().toLowerCase(Locale.ROOT);
      predicate = predicate.and(highlight -> containsQuery(highlight, query));
    }
    if (filters.types() != null && !filters.types().isEmpty()) {
      predicate = predicate.and(highlight -> filters.types().contains(highlight.type()));
    }
    if (filters.domains() != null && !filters.domains().isEmpty()) {
      predicate = predicate.and(highlight -> intersects(highlight.domains(), filters.domains()));
    }
    if (filters.skills() != null && !filters.skills().isEmpty()) {
      predicate = predicate.and(highlight -> intersects(highlight.skills(), filters.skills()));
    }
    if (Boolean.TRUE.equals(filters.onlyWithMetrics())) {
      predicate = predicate.and(Highlight::hasMetrics);
    }
    return predicate;
  }

  public static List<Highlight> filter(Collection<Highlight> highlights, SearchFilters filters) {
    return highlights.stream().filter(predicate(filters)).toList();
  }

  private static boolean containsQuery(Highlight highlight, String query) {
    return lower(highlight.title()).contains(query) || lower(highlight.content()).contains(query);
  }

  private static boolean intersects(List<String> values, List<String> wanted) {
    return values.stream().anyMatch(wanted::contains);
  }

  private static String lower(String value) {
    return value == null ? "" : value.toLowerCase(Locale.ROOT);
  }
}
