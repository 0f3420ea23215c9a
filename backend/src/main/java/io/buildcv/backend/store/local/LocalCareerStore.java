package io.buildcv.backend.store.local;

import io.buildcv.backend.exception.ResourceNotFoundException;
import io.buildcv.backend.store.BackupSnapshot;
import io.buildcv.backend.store.CareerStore;
import io.buildcv.backend.store.CareerViews;
import io.buildcv.backend.store.ClearResult;
import io.buildcv.backend.store.Highlight;
import io.buildcv.backend.store.HighlightInput;
import io.buildcv.backend.store.HighlightWithJob;
import io.buildcv.backend.store.ImportResult;
import io.buildcv.backend.store.ImportValidation;
import io.buildcv.backend.store.Job;
import io.buildcv.backend.store.JobInput;
import io.buildcv.backend.store.JobSummary;
import io.buildcv.backend.store.JobWithFilteredHighlights;
import io.buildcv.backend.store.JobWithHighlights;
import io.buildcv.backend.store.Profile;
import io.buildcv.backend.store.SearchFilters;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * Store for an anonymous device session, kept in memory and written through to one JSON document.
 * Every mutation rewrites the document via a temporary file, so a crash leaves either the old or
 * the new state on disk. A mutation whose write fails is undone in memory as well. Calls are
 * serialized on the instance; {@link LocalCareerStores} hands out one instance per device.
 */
public class LocalCareerStore implements CareerStore {

  private static final Logger log = LoggerFactory.getLogger(LocalCareerStore.class);

  private final Path file;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  private final Map<String, Job> jobs = new LinkedHashMap<>();
  private final Map<String, Highlight> highlights = new LinkedHashMap<>();
  private Profile profile;

  public LocalCareerStore(Path file, ObjectMapper objectMapper, Clock clock) {
    this.file = file;
    this.objectMapper = objectMapper;
    this.clock = clock;
    load();
  }

  Path file() {
    return file;
  }

  @Override
  public synchronized List<JobSummary> listJobsWithHighlightCounts() {
    return CareerViews.summaries(jobs.values(), highlights.values());
  }

  @Override
  public synchronized List<JobWithHighlights> listJobsWithVisibleHighlights() {
    return CareerViews.withVisibleHighlights(jobs.values(), highlights.values());
  }

  @Override
  public synchronized Optional<Job> findJob(String id) {
    return Optional.ofNullable(jobs.get(id));
  }

  @Override
  public synchronized Job createJob(JobInput input) {
    Instant now = clock.instant();
    var job =
        new Job(
            UUID.randomUUID().toString(),
            input.company(),
            input.role(),
            input.startDate(),
            input.endDate(),
            input.logoUrl(),
            input.website(),
            now,
            now);
    return mutate(
        () -> {
          jobs.put(job.id(), job);
          return job;
        });
  }

  @Override
  public synchronized Job updateJob(String id, JobInput input) {
    var updated = requireJob(id).update(input, clock.instant());
    return mutate(
        () -> {
          jobs.put(id, updated);
          return updated;
        });
  }

  @Override
  public synchronized Job deleteJob(String id) {
    var job = requireJob(id);
    Instant now = clock.instant();
    return mutate(
        () -> {
          highlights.replaceAll(
              (highlightId, highlight) ->
                  id.equals(highlight.jobId()) ? highlight.withJobId(null, now) : highlight);
          jobs.remove(id);
          return job;
        });
  }

  @Override
  public synchronized List<Highlight> listHighlights() {
    return highlights.values().stream().sorted(CareerViews.HIGHLIGHTS_NEWEST_FIRST).toList();
  }

  @Override
  public synchronized Optional<Highlight> findHighlight(String id) {
    return Optional.ofNullable(highlights.get(id));
  }

  @Override
  public synchronized Highlight createHighlight(HighlightInput input) {
    var highlight = input.toHighlight(UUID.randomUUID().toString(), clock.instant());
    return mutate(
        () -> {
          highlights.put(highlight.id(), highlight);
          return highlight;
        });
  }

  @Override
  public synchronized Highlight updateHighlight(String id, HighlightInput input) {
    var updated = requireHighlight(id).update(input, clock.instant());
    return mutate(
        () -> {
          highlights.put(id, updated);
          return updated;
        });
  }

  @Override
  public synchronized Highlight deleteHighlight(String id) {
    var highlight = requireHighlight(id);
    return mutate(
        () -> {
          highlights.remove(id);
          return highlight;
        });
  }

  @Override
  public synchronized Highlight toggleVisibility(String id) {
    var current = requireHighlight(id);
    var toggled = current.withHidden(!current.hidden(), clock.instant());
    return mutate(
        () -> {
          highlights.put(id, toggled);
          return toggled;
        });
  }

  @Override
  public synchronized List<HighlightWithJob> search(SearchFilters filters) {
    return CareerViews.searchHighlights(jobs.values(), highlights.values(), filters);
  }

  @Override
  public synchronized List<JobWithFilteredHighlights> searchJobsWithHighlights(
      SearchFilters filters) {
    return CareerViews.searchJobs(jobs.values(), highlights.values(), filters);
  }

  @Override
  public synchronized List<String> listDomains() {
    return CareerViews.distinctTags(highlights.values(), Highlight::domains);
  }

  @Override
  public synchronized List<String> listSkills() {
    return CareerViews.distinctTags(highlights.values(), Highlight::skills);
  }

  @Override
  public synchronized Optional<Profile> findProfile() {
    return Optional.ofNullable(profile);
  }

  @Override
  public synchronized Profile updateProfile(String fullName) {
    var updated = new Profile(fullName, clock.instant());
    return mutate(
        () -> {
          profile = updated;
          return updated;
        });
  }

  @Override
  public synchronized BackupSnapshot exportAll() {
    return new BackupSnapshot(
        BackupSnapshot.CURRENT_VERSION,
        clock.instant(),
        jobs.values().stream().sorted(CareerViews.JOBS_FOR_EXPORT).toList(),
        highlights.values().stream().sorted(CareerViews.HIGHLIGHTS_FOR_EXPORT).toList(),
        profile);
  }

  @Override
  public synchronized ImportResult importAll(BackupSnapshot snapshot) {
    return mutate(() -> importRecords(snapshot));
  }

  private ImportResult importRecords(BackupSnapshot snapshot) {
    Instant now = clock.instant();
    var errors = new ArrayList<String>();
    int jobsImported = 0;
    int highlightsImported = 0;

    for (var job : snapshot.jobs()) {
      var problems = ImportValidation.check(job);
      if (!problems.isEmpty()) {
        errors.add(ImportValidation.jobError(job.id(), String.join(", ", problems)));
        continue;
      }
      var existing = jobs.get(job.id());
      jobs.put(
          job.id(),
          existing != null
              ? existing.update(JobInput.from(job), now)
              : new Job(
                  job.id(),
                  job.company(),
                  job.role(),
                  job.startDate(),
                  job.endDate(),
                  job.logoUrl(),
                  job.website(),
                  job.createdAt() != null ? job.createdAt() : now,
                  job.updatedAt() != null ? job.updatedAt() : now));
      jobsImported++;
    }

    for (var highlight : snapshot.highlights()) {
      var problems = ImportValidation.check(highlight, jobs::containsKey);
      if (!problems.isEmpty()) {
        errors.add(ImportValidation.highlightError(highlight.id(), String.join(", ", problems)));
        continue;
      }
      var existing = highlights.get(highlight.id());
      highlights.put(
          highlight.id(),
          existing != null
              ? existing.update(HighlightInput.from(highlight), now)
              : new Highlight(
                  highlight.id(),
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
                  highlight.hidden(),
                  highlight.createdAt() != null ? highlight.createdAt() : now,
                  highlight.updatedAt() != null ? highlight.updatedAt() : now));
      highlightsImported++;
    }

    if (snapshot.profile() != null) {
      var problems = ImportValidation.check(snapshot.profile());
      if (problems.isEmpty()) {
        profile = new Profile(snapshot.profile().fullName(), now);
      } else {
        errors.add(ImportValidation.profileError(String.join(", ", problems)));
      }
    }

    return ImportResult.of(jobsImported, highlightsImported, errors);
  }

  @Override
  public synchronized ClearResult clearAll() {
    var result =
        mutate(
            () -> {
              var cleared = new ClearResult(jobs.size(), highlights.size());
              jobs.clear();
              highlights.clear();
              profile = null;
              return cleared;
            });
    log.info(
        "Cleared local store {}: {} jobs, {} highlights",
        file.getFileName(),
        result.jobsDeleted(),
        result.highlightsDeleted());
    return result;
  }

  /** Applies {@code change} and writes the document, restoring the previous state on failure. */
  private <T> T mutate(Supplier<T> change) {
    var jobsBefore = new LinkedHashMap<>(jobs);
    var highlightsBefore = new LinkedHashMap<>(highlights);
    var profileBefore = profile;
    try {
      T result = change.get();
      persist();
      return result;
    } catch (RuntimeException e) {
      jobs.clear();
      jobs.putAll(jobsBefore);
      highlights.clear();
      highlights.putAll(highlightsBefore);
      profile = profileBefore;
      throw e;
    }
  }

  private Job requireJob(String id) {
    var job = jobs.get(id);
    if (job == null) {
      throw new ResourceNotFoundException("Job", id);
    }
    return job;
  }

  private Highlight requireHighlight(String id) {
    var highlight = highlights.get(id);
    if (highlight == null) {
      throw new ResourceNotFoundException("Highlight", id);
    }
    return highlight;
  }

  private void load() {
    if (!Files.exists(file)) {
      return;
    }
    try {
      var document =
          objectMapper.readValue(
              Files.readString(file, StandardCharsets.UTF_8), LocalStoreDocument.class);
      document.jobs().forEach(job -> jobs.put(job.id(), job));
      document.highlights().forEach(highlight -> highlights.put(highlight.id(), highlight));
      profile = document.profile();
      log.debug(
          "Loaded local store {} ({} jobs, {} highlights)",
          file.getFileName(),
          jobs.size(),
          highlights.size());
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read local store " + file, e);
    } catch (JacksonException e) {
      throw new UncheckedIOException(
          "Local store " + file + " is not a valid document", new IOException(e));
    }
  }

  private void persist() {
    var document =
        new LocalStoreDocument(
            LocalStoreDocument.CURRENT_FORMAT,
            List.copyOf(jobs.values()),
            List.copyOf(highlights.values()),
            profile);
    Path temp = file.resolveSibling(file.getFileName() + ".tmp");
    try {
      if (file.getParent() != null) {
        Files.createDirectories(file.getParent());
      }
      Files.writeString(temp, objectMapper.writeValueAsString(document), StandardCharsets.UTF_8);
      try {
        Files.move(
            temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write local store " + file, e);
    }
  }
}
