package io.buildcv.backend.store;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;
import java.util.List;

/** Full dump of one store, the format of backup files and of the anonymous-data migration. */
public record BackupSnapshot(
    String version,
    Instant exportedAt,
    List<Job> jobs,
    List<Highlight> highlights,
    Profile profile) {

  public static final String CURRENT_VERSION = "1.0";

  public BackupSnapshot {
    jobs = jobs == null ? List.of() : jobs;
    highlights = highlights == null ? List.of() : highlights;
  }

  @JsonIgnore
  public boolean isEmpty() {
    return jobs.isEmpty() && highlights.isEmpty() && profile == null;
  }
}
