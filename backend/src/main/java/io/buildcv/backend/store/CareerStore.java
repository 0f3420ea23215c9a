package io.buildcv.backend.store;

import io.buildcv.backend.exception.ResourceNotFoundException;
import java.util.List;
import java.util.Optional;

/**
 * Career history of one scope: an anonymous device or a signed-in user. Implementations must
 * behave identically; inputs arrive already validated and normalized.
 */
public interface CareerStore {

  // Jobs

  /** All jobs, newest first, each with its highlight count (hidden highlights included). */
  List<JobSummary> listJobsWithHighlightCounts();

  /** All jobs, newest first, each with its visible highlights. */
  List<JobWithHighlights> listJobsWithVisibleHighlights();

  Optional<Job> findJob(String id);

  Job createJob(JobInput input);

  /**
   * Replaces every mutable field of the job.
   *
   * @throws ResourceNotFoundException if no job has this id
   */
  Job updateJob(String id, JobInput input);

  /**
   * Deletes the job. Its highlights stay, detached.
   *
   * @throws ResourceNotFoundException if no job has this id
   */
  Job deleteJob(String id);

  // Highlights

  /** All highlights, hidden ones included, newest first. */
  List<Highlight> listHighlights();

  Optional<Highlight> findHighlight(String id);

  Highlight createHighlight(HighlightInput input);

  /** @throws ResourceNotFoundException if no highlight has this id */
  Highlight updateHighlight(String id, HighlightInput input);

  /** @throws ResourceNotFoundException if no highlight has this id */
  Highlight deleteHighlight(String id);

  /** @throws ResourceNotFoundException if no highlight has this id */
  Highlight toggleVisibility(String id);

  // Search

  /** Visible highlights matching every given filter, newest first. */
  List<HighlightWithJob> search(SearchFilters filters);

  /** Every job with its visible highlights that match the filters. */
  List<JobWithFilteredHighlights> searchJobsWithHighlights(SearchFilters filters);

  List<String> listDomains();

  List<String> listSkills();

  // Profile

  Optional<Profile> findProfile();

  Profile updateProfile(String fullName);

  // Bulk

  BackupSnapshot exportAll();

  /**
   * Upserts jobs, then highlights, then the profile. A record that fails is reported in {@link
   * ImportResult#errors()} and the remaining records are still imported.
   */
  ImportResult importAll(BackupSnapshot snapshot);

  /** Deletes every job, highlight and the profile. */
  ClearResult clearAll();
}
