package io.buildcv.backend.store.remote;

import io.buildcv.backend.exception.ResourceNotFoundException;
import io.buildcv.backend.store.BackupSnapshot;
import io.buildcv.backend.store.CareerStore;
import io.buildcv.backend.store.CareerViews;
import io.buildcv.backend.store.ClearResult;
import io.buildcv.backend.store.Highlight;
import io.buildcv.backend.store.HighlightInput;
import io.buildcv.backend.store.HighlightType;
import io.buildcv.backend.store.HighlightWithJob;
import io.buildcv.backend.store.ImportResult;
import io.buildcv.backend.store.ImportValidation;
import io.buildcv.backend.store.Job;
import io.buildcv.backend.store.JobInput;
import io.buildcv.backend.store.JobSummary;
import io.buildcv.backend.store.JobWithFilteredHighlights;
import io.buildcv.backend.store.JobWithHighlights;
import io.buildcv.backend.store.Metric;
import io.buildcv.backend.store.Profile;
import io.buildcv.backend.store.SearchFilters;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.simple.JdbcClient;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

/**
 * Store backed by a principal's dedicated database. Each statement runs on its own; multi-step
 * operations such as {@link #deleteJob} are not wrapped in a transaction. List fields are stored
 * as JSON text.
 */
public class RemoteCareerStore implements CareerStore {

  private static final Logger log = LoggerFactory.getLogger(RemoteCareerStore.class);

  private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
  private static final TypeReference<List<Metric>> METRIC_LIST = new TypeReference<>() {};

  private static final String PROFILE_ID = "default";

  private static final String JOB_COLUMNS =
      "id, company, role, start_date, end_date, logo_url, website, created_at, updated_at";

  private static final String HIGHLIGHT_COLUMNS =
      """
      id, job_id, type, title, content, start_date, end_date, domains, skills, keywords, \
      metrics, is_hidden, created_at, updated_at""";

  private final JdbcClient jdbc;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public RemoteCareerStore(DataSource dataSource, ObjectMapper objectMapper, Clock clock) {
    this.jdbc = JdbcClient.create(dataSource);
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  private static Timestamp toTimestamp(Instant instant) {
    return instant != null ? Timestamp.from(instant) : null;
  }

  // ── Jobs ────────────────────────────────────────────────────────────

  @Override
  public List<JobSummary> listJobsWithHighlightCounts() {
    return jdbc.sql(
            """
            SELECT j.id, j.company, j.role, j.start_date, j.end_date, j.logo_url, j.website,
                   j.created_at, j.updated_at, COUNT(h.id) AS highlight_count
            FROM jobs j
            LEFT JOIN highlights h ON h.job_id = j.id
            GROUP BY j.id, j.company, j.role, j.start_date, j.end_date, j.logo_url, j.website,
                     j.created_at, j.updated_at
            ORDER BY j.start_date DESC, j.id
            """)
        .query((rs, rowNum) -> new JobSummary(mapJob(rs), rs.getLong("highlight_count")))
        .list();
  }

  @Override
  public List<JobWithHighlights> listJobsWithVisibleHighlights() {
    return CareerViews.withVisibleHighlights(allJobs(), allHighlights());
  }

  @Override
  public Optional<Job> findJob(String id) {
    return jdbc.sql("SELECT " + JOB_COLUMNS + " FROM jobs WHERE id = ?")
        .param(id)
        .query((rs, rowNum) -> mapJob(rs))
        .optional();
  }

  @Override
  public Job createJob(JobInput input) {
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
    insertJob(job);
    return job;
  }

  @Override
  public Job updateJob(String id, JobInput input) {
    var updated = requireJob(id).update(input, clock.instant());
    updateJobRow(updated);
    return updated;
  }

  @Override
  public Job deleteJob(String id) {
    var job = requireJob(id);
    jdbc.sql("UPDATE highlights SET job_id = NULL, updated_at = ? WHERE job_id = ?")
        .params(toTimestamp(clock.instant()), id)
        .update();
    jdbc.sql("DELETE FROM jobs WHERE id = ?").param(id).update();
    return job;
  }

  // ── Highlights ──────────────────────────────────────────────────────

  @Override
  public List<Highlight> listHighlights() {
    return allHighlights();
  }

  @Override
  public Optional<Highlight> findHighlight(String id) {
    return jdbc.sql("SELECT " + HIGHLIGHT_COLUMNS + " FROM highlights WHERE id = ?")
        .param(id)
        .query((rs, rowNum) -> mapHighlight(rs))
        .optional();
  }

  @Override
  public Highlight createHighlight(HighlightInput input) {
    var highlight = input.toHighlight(UUID.randomUUID().toString(), clock.instant());
    insertHighlight(highlight);
    return highlight;
  }

  @Override
  public Highlight updateHighlight(String id, HighlightInput input) {
    var updated = requireHighlight(id).update(input, clock.instant());
    updateHighlightRow(updated);
    return updated;
  }

  @Override
  public Highlight deleteHighlight(String id) {
    var highlight = requireHighlight(id);
    jdbc.sql("DELETE FROM highlights WHERE id = ?").param(id).update();
    return highlight;
  }

  @Override
  public Highlight toggleVisibility(String id) {
    var current = requireHighlight(id);
    var toggled = current.withHidden(!current.hidden(), clock.instant());
    jdbc.sql("UPDATE highlights SET is_hidden = ?, updated_at = ? WHERE id = ?")
        .params(toggled.hidden(), toTimestamp(toggled.updatedAt()), id)
        .update();
    return toggled;
  }

  // ── Search ──────────────────────────────────────────────────────────

  @Override
  public List<HighlightWithJob> search(SearchFilters filters) {
    return CareerViews.searchHighlights(allJobs(), allHighlights(), filters);
  }

  @Override
  public List<JobWithFilteredHighlights> searchJobsWithHighlights(SearchFilters filters) {
    return CareerViews.searchJobs(allJobs(), allHighlights(), filters);
  }

  @Override
  public List<String> listDomains() {
    return CareerViews.distinctTags(visibleHighlights(), Highlight::domains);
  }

  @Override
  public List<String> listSkills() {
    return CareerViews.distinctTags(visibleHighlights(), Highlight::skills);
  }

  // ── Profile ─────────────────────────────────────────────────────────

  @Override
  public Optional<Profile> findProfile() {
    return jdbc.sql("SELECT full_name, updated_at FROM profile WHERE id = ?")
        .param(PROFILE_ID)
        .query(
            (rs, rowNum) ->
                new Profile(rs.getString("full_name"), rs.getTimestamp("updated_at").toInstant()))
        .optional();
  }

  @Override
  public Profile updateProfile(String fullName) {
    var profile = new Profile(fullName, clock.instant());
    int updated =
        jdbc.sql("UPDATE profile SET full_name = ?, updated_at = ? WHERE id = ?")
            .params(fullName, toTimestamp(profile.updatedAt()), PROFILE_ID)
            .update();
    if (updated == 0) {
      jdbc.sql("INSERT INTO profile (id, full_name, updated_at) VALUES (?, ?, ?)")
          .params(PROFILE_ID, fullName, toTimestamp(profile.updatedAt()))
          .update();
    }
    return profile;
  }

  // ── Bulk ────────────────────────────────────────────────────────────

  @Override
  public BackupSnapshot exportAll() {
    return new BackupSnapshot(
        BackupSnapshot.CURRENT_VERSION,
        clock.instant(),
        allJobs().stream().sorted(CareerViews.JOBS_FOR_EXPORT).toList(),
        allHighlights().stream().sorted(CareerViews.HIGHLIGHTS_FOR_EXPORT).toList(),
        findProfile().orElse(null));
  }

  @Override
  public ImportResult importAll(BackupSnapshot snapshot) {
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
      try {
        upsertJob(job, now);
        jobsImported++;
      } catch (DataAccessException e) {
        log.warn("Import of job {} failed", job.id(), e);
        errors.add(ImportValidation.jobError(job.id(), rootMessage(e)));
      }
    }

    for (var highlight : snapshot.highlights()) {
      var problems = ImportValidation.check(highlight, jobId -> findJob(jobId).isPresent());
      if (!problems.isEmpty()) {
        errors.add(ImportValidation.highlightError(highlight.id(), String.join(", ", problems)));
        continue;
      }
      try {
        upsertHighlight(highlight, now);
        highlightsImported++;
      } catch (DataAccessException e) {
        log.warn("Import of highlight {} failed", highlight.id(), e);
        errors.add(ImportValidation.highlightError(highlight.id(), rootMessage(e)));
      }
    }

    if (snapshot.profile() != null) {
      var problems = ImportValidation.check(snapshot.profile());
      if (!problems.isEmpty()) {
        errors.add(ImportValidation.profileError(String.join(", ", problems)));
      } else {
        try {
          updateProfile(snapshot.profile().fullName());
        } catch (DataAccessException e) {
          log.warn("Import of profile failed", e);
          errors.add(ImportValidation.profileError(rootMessage(e)));
        }
      }
    }

    return ImportResult.of(jobsImported, highlightsImported, errors);
  }

  @Override
  public ClearResult clearAll() {
    int highlightsDeleted = jdbc.sql("DELETE FROM highlights").update();
    int jobsDeleted = jdbc.sql("DELETE FROM jobs").update();
    jdbc.sql("DELETE FROM profile").update();
    log.info("Cleared tenant store: {} jobs, {} highlights", jobsDeleted, highlightsDeleted);
    return new ClearResult(jobsDeleted, highlightsDeleted);
  }

  // ── Row access ──────────────────────────────────────────────────────

  private List<Job> allJobs() {
    return jdbc.sql("SELECT " + JOB_COLUMNS + " FROM jobs ORDER BY start_date DESC, id")
        .query((rs, rowNum) -> mapJob(rs))
        .list();
  }

  private List<Highlight> allHighlights() {
    return jdbc.sql(
            "SELECT " + HIGHLIGHT_COLUMNS + " FROM highlights ORDER BY start_date DESC, id")
        .query((rs, rowNum) -> mapHighlight(rs))
        .list();
  }

  private List<Highlight> visibleHighlights() {
    return jdbc.sql(
            "SELECT "
                + HIGHLIGHT_COLUMNS
                + " FROM highlights WHERE is_hidden = FALSE ORDER BY start_date DESC, id")
        .query((rs, rowNum) -> mapHighlight(rs))
        .list();
  }

  private Job requireJob(String id) {
    return findJob(id).orElseThrow(() -> new ResourceNotFoundException("Job", id));
  }

  private Highlight requireHighlight(String id) {
    return findHighlight(id).orElseThrow(() -> new ResourceNotFoundException("Highlight", id));
  }

  private void upsertJob(Job job, Instant now) {
    var existing = findJob(job.id());
    if (existing.isPresent()) {
      updateJobRow(existing.get().update(JobInput.from(job), now));
    } else {
      insertJob(
          new Job(
              job.id(),
              job.company(),
              job.role(),
              job.startDate(),
              job.endDate(),
              job.logoUrl(),
              job.website(),
              job.createdAt() != null ? job.createdAt() : now,
              job.updatedAt() != null ? job.updatedAt() : now));
    }
  }

  private void upsertHighlight(Highlight highlight, Instant now) {
    var existing = findHighlight(highlight.id());
    if (existing.isPresent()) {
      updateHighlightRow(existing.get().update(HighlightInput.from(highlight), now));
    } else {
      insertHighlight(
          new Highlight(
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
    }
  }

  private void insertJob(Job job) {
    jdbc.sql(
            """
            INSERT INTO jobs
                (id, company, role, start_date, end_date, logo_url, website, created_at,
                 updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            """)
        .params(
            job.id(),
            job.company(),
            job.role(),
            job.startDate(),
            job.endDate(),
            job.logoUrl(),
            job.website(),
            toTimestamp(job.createdAt()),
            toTimestamp(job.updatedAt()))
        .update();
  }

  private void updateJobRow(Job job) {
    jdbc.sql(
            """
            UPDATE jobs
            SET company = ?, role = ?, start_date = ?, end_date = ?, logo_url = ?,
                website = ?, updated_at = ?
            WHERE id = ?
            """)
        .params(
            job.company(),
            job.role(),
            job.startDate(),
            job.endDate(),
            job.logoUrl(),
            job.website(),
            toTimestamp(job.updatedAt()),
            job.id())
        .update();
  }

  private void insertHighlight(Highlight highlight) {
    jdbc.sql(
            """
            INSERT INTO highlights
                (id, job_id, type, title, content, start_date, end_date, domains, skills,
                 keywords, metrics, is_hidden, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """)
        .params(
            highlight.id(),
            highlight.jobId(),
            highlight.type().value(),
            highlight.title(),
            highlight.content(),
            highlight.startDate(),
            highlight.endDate(),
            toJson(highlight.domains()),
            toJson(highlight.skills()),
            toJson(highlight.keywords()),
            toJson(highlight.metrics()),
            highlight.hidden(),
            toTimestamp(highlight.createdAt()),
            toTimestamp(highlight.updatedAt()))
        .update();
  }

  private void updateHighlightRow(Highlight highlight) {
    jdbc.sql(
            """
            UPDATE highlights
            SET job_id = ?, type = ?, title = ?, content = ?, start_date = ?, end_date = ?,
                domains = ?, skills = ?, keywords = ?, metrics = ?, is_hidden = ?,
                updated_at = ?
            WHERE id = ?
            """)
        .params(
            highlight.jobId(),
            highlight.type().value(),
            highlight.title(),
            highlight.content(),
            highlight.startDate(),
            highlight.endDate(),
            toJson(highlight.domains()),
            toJson(highlight.skills()),
            toJson(highlight.keywords()),
            toJson(highlight.metrics()),
            highlight.hidden(),
            toTimestamp(highlight.updatedAt()),
            highlight.id())
        .update();
  }

  private static Job mapJob(ResultSet rs) throws SQLException {
    return new Job(
        rs.getString("id"),
        rs.getString("company"),
        rs.getString("role"),
        rs.getObject("start_date", LocalDate.class),
        rs.getObject("end_date", LocalDate.class),
        rs.getString("logo_url"),
        rs.getString("website"),
        rs.getTimestamp("created_at").toInstant(),
        rs.getTimestamp("updated_at").toInstant());
  }

  private Highlight mapHighlight(ResultSet rs) throws SQLException {
    return new Highlight(
        rs.getString("id"),
        rs.getString("job_id"),
        HighlightType.fromValue(rs.getString("type")),
        rs.getString("title"),
        rs.getString("content"),
        rs.getObject("start_date", LocalDate.class),
        rs.getObject("end_date", LocalDate.class),
        fromJson(rs.getString("domains"), STRING_LIST),
        fromJson(rs.getString("skills"), STRING_LIST),
        fromJson(rs.getString("keywords"), STRING_LIST),
        fromJson(rs.getString("metrics"), METRIC_LIST),
        rs.getBoolean("is_hidden"),
        rs.getTimestamp("created_at").toInstant(),
        rs.getTimestamp("updated_at").toInstant());
  }

  private String toJson(List<?> values) {
    return objectMapper.writeValueAsString(values);
  }

  private <T> List<T> fromJson(String json, TypeReference<List<T>> type) {
    if (json == null || json.isBlank()) {
      return List.of();
    }
    return objectMapper.readValue(json, type);
  }

  private static String rootMessage(DataAccessException e) {
    Throwable root = e.getMostSpecificCause();
    return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
  }
}
