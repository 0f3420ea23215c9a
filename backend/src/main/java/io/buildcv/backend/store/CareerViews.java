package io.buildcv.backend.store;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Read models assembled from the full job and highlight lists. Orderings are shared so both stores
 * return the same sequence for the same data.
 */
public final class CareerViews {

  /** Most recent start date first; ties broken by id. */
  public static final Comparator<Job> JOBS_NEWEST_FIRST =
      Comparator.comparing(Job::startDate, Comparator.reverseOrder()).thenComparing(Job::id);

  public static final Comparator<Highlight> HIGHLIGHTS_NEWEST_FIRST =
      Comparator.comparing(Highlight::startDate, Comparator.reverseOrder())
          .thenComparing(Highlight::id);

  /** Backup files list jobs chronologically. */
  public static final Comparator<Job> JOBS_FOR_EXPORT =
      Comparator.comparing(Job::startDate)
          .thenComparing(Job::company)
          .thenComparing(Job::role)
          .thenComparing(Job::id);

  public static final Comparator<Highlight> HIGHLIGHTS_FOR_EXPORT =
      Comparator.comparing(Highlight::startDate)
          .thenComparing(Highlight::title)
          .thenComparing(Highlight::id);

  private CareerViews() {}

  public static List<JobSummary> summaries(Collection<Job> jobs, Collection<Highlight> highlights) {
    Map<String, Long> counts = new HashMap<>();
    for (var highlight : highlights) {
      if (highlight.jobId() != null) {
        counts.merge(highlight.jobId(), 1L, Long::sum);
      }
    }
    return jobs.stream()
        .sorted(JOBS_NEWEST_FIRST)
        .map(job -> new JobSummary(job, counts.getOrDefault(job.id(), 0L)))
        .toList();
  }

  public static List<JobWithHighlights> withVisibleHighlights(
      Collection<Job> jobs, Collection<Highlight> highlights) {
    var byJob = groupByJob(visible(highlights));
    return jobs.stream()
        .sorted(JOBS_NEWEST_FIRST)
        .map(job -> new JobWithHighlights(job, byJob.getOrDefault(job.id(), List.of())))
        .toList();
  }

  public static List<JobWithFilteredHighlights> searchJobs(
      Collection<Job> jobs, Collection<Highlight> highlights, SearchFilters filters) {
    var visible = visible(highlights);
    var allByJob = groupByJob(visible);
    var matchingByJob = groupByJob(HighlightSearch.filter(visible, filters));
    return jobs.stream()
        .sorted(JOBS_NEWEST_FIRST)
        .map(
            job ->
                new JobWithFilteredHighlights(
                    job,
                    matchingByJob.getOrDefault(job.id(), List.of()),
                    allByJob.getOrDefault(job.id(), List.of()).size()))
        .toList();
  }

  public static List<HighlightWithJob> searchHighlights(
      Collection<Job> jobs, Collection<Highlight> highlights, SearchFilters filters) {
    Map<String, Job> jobsById = new HashMap<>();
    jobs.forEach(job -> jobsById.put(job.id(), job));
    return HighlightSearch.filter(visible(highlights), filters).stream()
        .map(
            highlight ->
                new HighlightWithJob(
                    highlight, highlight.jobId() == null ? null : jobsById.get(highlight.jobId())))
        .toList();
  }

  /** Sorted distinct values of a tag list across visible highlights. */
  public static List<String> distinctTags(
      Collection<Highlight> highlights, Function<Highlight, List<String>> tags) {
    var result = new TreeSet<String>();
    for (var highlight : highlights) {
      if (!highlight.hidden()) {
        result.addAll(tags.apply(highlight));
      }
    }
    return List.copyOf(result);
  }

  private static List<Highlight> visible(Collection<Highlight> highlights) {
    return highlights.stream()
        .filter(highlight -> !highlight.hidden())
        .sorted(HIGHLIGHTS_NEWEST_FIRST)
        .toList();
  }

  private static Map<String, List<Highlight>> groupByJob(List<Highlight> highlights) {
    Map<String, List<Highlight>> byJob = new HashMap<>();
    for (var highlight : highlights) {
      if (highlight.jobId() != null) {
        byJob.computeIfAbsent(highlight.jobId(), id -> new ArrayList<>()).add(highlight);
      }
    }
    return byJob;
  }
}
