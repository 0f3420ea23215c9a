package io.buildcv.backend.store;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Mutable fields of a highlight. On update, {@code null} lists and a {@code null} {@code hidden}
 * mean "keep the stored value"; on create they default to empty and visible.
 */
public record HighlightInput(
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
    Boolean hidden) {

  public Highlight toHighlight(String id, Instant now) {
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
        Boolean.TRUE.equals(hidden),
        now,
        now);
  }

  public static HighlightInput from(Highlight highlight) {
    return new HighlightInput(
        highlight.jobId(),
        highlight.type(),
        highlight.title(),
        highlight.content(),
        highlight.startDate(),
        highlight.endDate(),
        highlight.domains(),
        highlight.skills(),
        highlight.keywords(),
        highlight.metrics(),
        highlight.hidden());
  }
}
