package io.buildcv.backend.provisioning;

import io.buildcv.backend.multitenancy.TenantDataSourceFactory;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Applies the tenant schema ({@code jobs}, {@code highlights}, {@code profile}) to a tenant
 * database. Flyway records applied versions, so re-running against an up-to-date database is a
 * no-op.
 */
@Component
public class TenantSchemaMigrator {

  private static final Logger log = LoggerFactory.getLogger(TenantSchemaMigrator.class);
  static final String TENANT_MIGRATIONS = "classpath:db/migration/tenant";

  private final TenantDataSourceFactory dataSourceFactory;

  public TenantSchemaMigrator(TenantDataSourceFactory dataSourceFactory) {
    this.dataSourceFactory = dataSourceFactory;
  }

  /**
   * Opens a short-lived pool with the given credential and migrates through it.
   *
   * @return number of migrations applied
   * @throws SchemaMigrationException if the database is unreachable or a script fails
   */
  public int migrate(String dbName, String jdbcUrl, String credential) {
    try (var dataSource = dataSourceFactory.create(dbName, jdbcUrl, credential)) {
      return migrate(dbName, dataSource);
    } catch (SchemaMigrationException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new SchemaMigrationException(dbName, e);
    }
  }

  public int migrate(String dbName, DataSource dataSource) {
    try {
      var result =
          Flyway.configure()
              .dataSource(dataSource)
              .locations(TENANT_MIGRATIONS)
              .load()
              .migrate();
      log.info("Migrated database {}: {} migrations applied", dbName, result.migrationsExecuted);
      return result.migrationsExecuted;
    } catch (RuntimeException e) {
      log.error("Schema migration failed for database {}", dbName, e);
      throw new SchemaMigrationException(dbName, e);
    }
  }
}
