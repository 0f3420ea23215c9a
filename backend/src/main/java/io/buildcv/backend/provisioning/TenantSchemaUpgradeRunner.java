package io.buildcv.backend.provisioning;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Brings every ready tenant database up to the current schema version at startup. */
@Component
@ConditionalOnProperty(name = "buildcv.tenant-schema.upgrade-on-startup", havingValue = "true")
public class TenantSchemaUpgradeRunner implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(TenantSchemaUpgradeRunner.class);

  private final TenantDatabaseRepository tenantDatabaseRepository;
  private final TenantSchemaMigrator schemaMigrator;

  public TenantSchemaUpgradeRunner(
      TenantDatabaseRepository tenantDatabaseRepository, TenantSchemaMigrator schemaMigrator) {
    this.tenantDatabaseRepository = tenantDatabaseRepository;
    this.schemaMigrator = schemaMigrator;
  }

  @Override
  public void run(ApplicationArguments args) {
    var ready = tenantDatabaseRepository.findByStatus(TenantDatabase.Status.READY);
    if (ready.isEmpty()) {
      log.info("No ready tenant databases, skipping schema upgrade");
      return;
    }

    log.info("Upgrading schema of {} tenant databases", ready.size());
    int failed = 0;
    for (var database : ready) {
      try {
        schemaMigrator.migrate(
            database.getDbName(), database.getDbUrl(), database.getRwCredential());
      } catch (Exception e) {
        failed++;
        log.error("Failed to upgrade schema of database {}", database.getDbName(), e);
      }
    }
    log.info("Tenant schema upgrade completed, {} failed", failed);
  }
}
