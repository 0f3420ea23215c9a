package io.buildcv.backend.career.dto;

import io.buildcv.backend.career.RequestNormalizer;
import io.buildcv.backend.store.JobInput;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record JobRequest(
    @NotBlank(message = "company is required") @Size(max = 255) String company,
    @NotBlank(message = "role is required") @Size(max = 255) String role,
    @NotBlank(message = "startDate is required") String startDate,
    String endDate,
    @Size(max = 2048) String logoUrl,
    @Size(max = 2048) String website) {

  public JobInput toInput() {
    return new JobInput(
        company.trim(),
        role.trim(),
        RequestNormalizer.date(startDate, "startDate"),
        RequestNormalizer.date(endDate, "endDate"),
        RequestNormalizer.blankToNull(logoUrl),
        RequestNormalizer.blankToNull(website));
  }
}
