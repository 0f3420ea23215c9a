package io.buildcv.backend.store;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/** Required-field checks for records arriving through a backup import. */
public final class ImportValidation {

  /** Width of the profile name column in tenant databases; device stores apply the same limit. */
  public static final int MAX_FULL_NAME_LENGTH = 255;

  private ImportValidation() {}

  /** Returns the problems with the job, empty when it can be imported. */
  public static List<String> check(Job job) {
    var problems = new ArrayList<String>();
    requireText(job.id(), "id", problems);
    requireText(job.company(), "company", problems);
    requireText(job.role(), "role", problems);
    if (job.startDate() == null) {
      problems.add("startDate is required");
    }
    return problems;
  }

  /**
   * Returns the problems with the highlight, empty when it can be imported.
   *
   * @param jobExists tells whether a referenced job id is present in the target store
   */
  public static List<String> check(Highlight highlight, Predicate<String> jobExists) {
    var problems = new ArrayList<String>();
    requireText(highlight.id(), "id", problems);
    requireText(highlight.title(), "title", problems);
    requireText(highlight.content(), "content", problems);
    if (highlight.type() == null) {
      problems.add("type is required");
    }
    if (highlight.startDate() == null) {
      problems.add("startDate is required");
    }
    if (highlight.jobId() != null && !jobExists.test(highlight.jobId())) {
      problems.add("job " + highlight.jobId() + " does not exist");
    }
    return problems;
  }

  /** Returns the problems with the profile, empty when it can be imported. */
  public static List<String> check(Profile profile) {
    var problems = new ArrayList<String>();
    requireText(profile.fullName(), "fullName", problems);
    if (profile.fullName() != null && profile.fullName().length() > MAX_FULL_NAME_LENGTH) {
      problems.add("fullName must be at most " + MAX_FULL_NAME_LENGTH + " characters");
    }
    return problems;
  }

  public static String jobError(String id, String reason) {
    return "Failed to import job " + id + ": " + reason;
  }

  public static String highlightError(String id, String reason) {
    return "Failed to import highlight " + id + ": " + reason;
  }

  public static String profileError(String reason) {
    return "Failed to import profile: " + reason;
  }

  private static void requireText(String value, String field, List<String> problems) {
    if (value == null || value.isBlank()) {
      problems.add(field + " is required");
    }
  }
}
