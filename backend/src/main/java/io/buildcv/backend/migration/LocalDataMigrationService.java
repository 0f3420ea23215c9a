package io.buildcv.backend.migration;

import io.buildcv.backend.multitenancy.TenantConnectionCache;
import io.buildcv.backend.provisioning.TenantDatabase;
import io.buildcv.backend.provisioning.TenantDatabaseProvisioningService;
import io.buildcv.backend.store.ImportResult;
import io.buildcv.backend.store.local.LocalCareerStores;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Moves an anonymous device's data into the principal's tenant database when the user signs in.
 *
 * <p>The device store is cleared only after every job, highlight and the profile were written
 * remotely. A failed run leaves the device data untouched and may leave some records already
 * written remotely; since the import upserts by id, running again converges.
 */
@Service
public class LocalDataMigrationService {

  private static final Logger log = LoggerFactory.getLogger(LocalDataMigrationService.class);

  private final MigrationGuard migrationGuard;
  private final TenantDatabaseProvisioningService provisioningService;
  private final LocalCareerStores localStores;
  private final TenantConnectionCache connectionCache;

  public LocalDataMigrationService(
      MigrationGuard migrationGuard,
      TenantDatabaseProvisioningService provisioningService,
      LocalCareerStores localStores,
      TenantConnectionCache connectionCache) {
    this.migrationGuard = migrationGuard;
    this.provisioningService = provisioningService;
    this.localStores = localStores;
    this.connectionCache = connectionCache;
  }

  public MigrationResult migrate(String principalId, String deviceId) {
    if (!migrationGuard.tryAcquire(principalId, deviceId)) {
      log.info("Migration already ran for principal {} in this session", principalId);
      return MigrationResult.skippedRun();
    }

    try {
      return runMigration(principalId, deviceId);
    } catch (RuntimeException e) {
      migrationGuard.release(principalId, deviceId);
      throw e;
    }
  }

  private MigrationResult runMigration(String principalId, String deviceId) {
    boolean provisioned = false;
    boolean ready =
        provisioningService
            .findByPrincipalId(principalId)
            .map(TenantDatabase::isReady)
            .orElse(false);
    if (!ready) {
      log.info("Tenant database for principal {} not ready, provisioning", principalId);
      provisioningService.provision(principalId);
      provisioned = true;
    }

    var localStore = localStores.forDevice(deviceId);
    var dump = localStore.exportAll();
    if (dump.isEmpty()) {
      log.info("No local data to migrate for principal {}", principalId);
      return new MigrationResult(provisioned, false, 0, 0);
    }

    ImportResult result;
    try {
      result = connectionCache.storeFor(principalId).importAll(dump);
    } catch (RuntimeException e) {
      log.error("Migration of local data failed for principal {}", principalId, e);
      throw new LocalDataMigrationException(principalId, e);
    }
    if (!result.success()) {
      log.error(
          "Migration of local data for principal {} reported {} errors: {}",
          principalId,
          result.errors().size(),
          result.errors());
      throw new LocalDataMigrationException(principalId, result.errors());
    }

    localStore.clearAll();
    log.info(
        "Migrated {} jobs and {} highlights for principal {}",
        result.jobsImported(),
        result.highlightsImported(),
        principalId);
    return new MigrationResult(
        provisioned, false, result.jobsImported(), result.highlightsImported());
  }
}
