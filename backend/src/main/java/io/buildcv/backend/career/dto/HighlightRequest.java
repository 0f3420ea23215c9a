package io.buildcv.backend.career.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.buildcv.backend.career.RequestNormalizer;
import io.buildcv.backend.store.HighlightInput;
import io.buildcv.backend.store.HighlightType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.List;

/** Create or update payload. On update, omitted lists and visibility keep their stored values. */
public record HighlightRequest(
    String jobId,
    @NotNull(message = "type is required") HighlightType type,
    @NotBlank(message = "title is required") @Size(max = 512) String title,
    @NotBlank(message = "content is required") String content,
    @NotBlank(message = "startDate is required") String startDate,
    String endDate,
    List<String> domains,
    List<String> skills,
    List<String> keywords,
    List<@Valid MetricRequest> metrics,
    @JsonProperty("isHidden") Boolean hidden) {

  public HighlightInput toInput() {
    return new HighlightInput(
        RequestNormalizer.blankToNull(jobId),
        type,
        title.trim(),
        content.trim(),
        RequestNormalizer.date(startDate, "startDate"),
        RequestNormalizer.date(endDate, "endDate"),
        RequestNormalizer.tags(domains),
        RequestNormalizer.tags(skills),
        RequestNormalizer.tags(keywords),
        metrics == null ? null : metrics.stream().map(MetricRequest::toMetric).toList(),
        hidden);
  }
}
