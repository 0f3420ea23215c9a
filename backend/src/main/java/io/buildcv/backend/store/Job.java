package io.buildcv.backend.store;

import java.time.Instant;
import java.time.LocalDate;

public record Job(
    String id,
    String company,
    String role,
    LocalDate startDate,
    LocalDate endDate,
    String logoUrl,
    String website,
    Instant createdAt,
    Instant updatedAt) {

  /** Copy with every mutable field taken from {@code input} and a new modification time. */
  public Job update(JobInput input, Instant now) {
    return new Job(
        id,
        input.company(),
        input.role(),
        input.startDate(),
        input.endDate(),
        input.logoUrl(),
        input.website(),
        createdAt,
        now);
  }
}
