package io.buildcv.backend.career.dto;

import io.buildcv.backend.career.RequestNormalizer;
import io.buildcv.backend.store.Metric;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;

public record MetricRequest(
    @NotBlank(message = "label is required") String label,
    @NotNull(message = "value is required") BigDecimal value,
    String unit,
    String prefix,
    String description) {

  public Metric toMetric() {
    return new Metric(
        label.trim(),
        value,
        unit == null ? "" : unit.trim(),
        RequestNormalizer.blankToNull(prefix),
        RequestNormalizer.blankToNull(description));
  }
}
