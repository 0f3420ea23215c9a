package io.buildcv.backend.store;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * One unit of career experience. {@code jobId} is a soft reference: deleting the job leaves the
 * highlight in place with a {@code null} job.
 */
public record Highlight(
    String id,
    String jobId,
    HighlightType type,
    String title,
    String content,
    LocalDate startDate,
    LocalDate endDate,
    List<String> domains,
    List<String> skills,
    List<String> keywords,
    List<Metric> metrics,
    @JsonProperty("isHidden") boolean hidden,
    Instant createdAt,
    Instant updatedAt) {

  public Highlight {
    domains = withoutNulls(domains);
    skills = withoutNulls(skills);
    keywords = withoutNulls(keywords);
    metrics = withoutNulls(metrics);
  }

  /**
   * Copy with the scalar fields taken from {@code input}. List fields and visibility that the
   * input leaves {@code null} keep their current values.
   */
  public Highlight update(HighlightInput input, Instant now) {
    return new Highlight(
        id,
        input.jobId(),
        input.type(),
        input.title(),
        input.content(),
        input.startDate(),
        input.endDate(),
        input.domains() != null ? input.domains() : domains,
        input.skills() != null ? input.skills() : skills,
        input.keywords() != null ? input.keywords() : keywords,
        input.metrics() != null ? input.metrics() : metrics,
        input.hidden() != null ? input.hidden() : hidden,
        createdAt,
        now);
  }

  public Highlight withJobId(String newJobId, Instant now) {
    return new Highlight(
        id,
        newJobId,
        type,
        title,
        content,
        startDate,
        endDate,
        domains,
        skills,
        keywords,
        metrics,
        hidden,
        createdAt,
        now);
  }

  public Highlight withHidden(boolean newHidden, Instant now) {
    return new Highlight(
        id,
        jobId,
        type,
        title,
        content,
        startDate,
        endDate,
        domains,
        skills,
        keywords,
        metrics,
        newHidden,
        createdAt,
        now);
  }

  public boolean hasMetrics() {
    return !metrics.isEmpty();
  }

  private static <T> List<T> withoutNulls(List<T> values) {
    return values == null ? List.of() : values.stream().filter(Objects::nonNull).toList();
  }
}
