package io.buildcv.backend.migration;

/**
 * @param provisioned whether this run had to provision the tenant database first
 * @param skipped whether the session had already migrated, in which case nothing was done
 */
public record MigrationResult(
    boolean provisioned, boolean skipped, int jobsMigrated, int highlightsMigrated) {

  static MigrationResult skippedRun() {
    return new MigrationResult(false, true, 0, 0);
  }
}
