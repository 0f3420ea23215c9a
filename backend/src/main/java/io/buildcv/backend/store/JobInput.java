package io.buildcv.backend.store;

import java.time.LocalDate;

/** Mutable fields of a job, already normalized (blank optionals are {@code null}). */
public record JobInput(
    String company,
    String role,
    LocalDate startDate,
    LocalDate endDate,
    String logoUrl,
    String website) {

  public static JobInput from(Job job) {
    return new JobInput(
        job.company(),
        job.role(),
        job.startDate(),
        job.endDate(),
        job.logoUrl(),
        job.website());
  }
}
