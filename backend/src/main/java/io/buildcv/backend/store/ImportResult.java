package io.buildcv.backend.store;

import java.util.List;

public record ImportResult(
    boolean success, int jobsImported, int highlightsImported, List<String> errors) {

  public static ImportResult of(int jobsImported, int highlightsImported, List<String> errors) {
    return new ImportResult(
        errors.isEmpty(), jobsImported, highlightsImported, List.copyOf(errors));
  }
}
