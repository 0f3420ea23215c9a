package io.buildcv.backend.career;

import io.buildcv.backend.exception.InvalidStateException;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Cleans request values once, before they reach a store: blank strings become {@code null} and
 * tag lists are trimmed, emptied of blanks and de-duplicated.
 */
public final class RequestNormalizer {

  private RequestNormalizer() {}

  public static String blankToNull(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    return value.trim();
  }

  /** Parses an ISO date; a blank value means "no date". */
  public static LocalDate date(String value, String field) {
    String normalized = blankToNull(value);
    if (normalized == null) {
      return null;
    }
    try {
      return LocalDate.parse(normalized);
    } catch (DateTimeParseException e) {
      throw new InvalidStateException("Invalid date", field + " must be a date as YYYY-MM-DD");
    }
  }

  /** Returns {@code null} for a {@code null} list so updates can tell "absent" from "empty". */
  public static List<String> tags(List<String> values) {
    if (values == null) {
      return null;
    }
    var result = new LinkedHashSet<String>();
    for (var value : values) {
      String normalized = blankToNull(value);
      if (normalized != null) {
        result.add(normalized);
      }
    }
    return List.copyOf(result);
  }
}
