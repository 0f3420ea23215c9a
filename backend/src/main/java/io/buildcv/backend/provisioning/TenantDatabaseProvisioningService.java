package io.buildcv.backend.provisioning;

import io.buildcv.backend.exception.ResourceNotFoundException;
import io.buildcv.backend.exception.TenantDatabaseNotReadyException;
import io.buildcv.backend.multitenancy.TenantConnectionCache;
import io.buildcv.backend.platform.DatabaseAlreadyExistsException;
import io.buildcv.backend.platform.DatabasePlatformClient;
import io.buildcv.backend.platform.PlatformDatabase;
import io.buildcv.backend.platform.PlatformProperties;
import java.time.Clock;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Creates, initializes and activates the dedicated database of a principal.
 *
 * <p>The run is a sequence of {@link ProvisioningStep}s recorded in the registry. A {@code READY}
 * record short-circuits the whole run. Any other existing record is discarded and the run starts
 * over; the deterministic database name makes the platform step safe to repeat. A failure marks
 * the record {@code ERROR} and is rethrown. There is no automatic retry.
 */
@Service
public class TenantDatabaseProvisioningService {

  private static final Logger log =
      LoggerFactory.getLogger(TenantDatabaseProvisioningService.class);

  private final TenantDatabaseRepository tenantDatabaseRepository;
  private final DatabasePlatformClient platformClient;
  private final PlatformProperties platformProperties;
  private final TenantSchemaMigrator schemaMigrator;
  private final TenantConnectionCache connectionCache;
  private final Clock clock;

  public TenantDatabaseProvisioningService(
      TenantDatabaseRepository tenantDatabaseRepository,
      DatabasePlatformClient platformClient,
      PlatformProperties platformProperties,
      TenantSchemaMigrator schemaMigrator,
      TenantConnectionCache connectionCache,
      Clock clock) {
    this.tenantDatabaseRepository = tenantDatabaseRepository;
    this.platformClient = platformClient;
    this.platformProperties = platformProperties;
    this.schemaMigrator = schemaMigrator;
    this.connectionCache = connectionCache;
    this.clock = clock;
  }

  /**
   * Provisions the principal's database, or returns the existing one if it is ready.
   *
   * @throws ProvisioningException if a platform call fails
   * @throws SchemaMigrationException if the schema cannot be applied
   */
  public TenantDatabase provision(String principalId) {
    var step = enter(ProvisioningStep.CHECK_REGISTRY, principalId);
    var existing = tenantDatabaseRepository.findByPrincipalId(principalId);
    if (existing.isPresent() && existing.get().isReady()) {
      log.info("Tenant database already ready for principal {}", principalId);
      return existing.get();
    }

    if (existing.isPresent()) {
      step = enter(ProvisioningStep.RESTART_STALE, principalId);
      var stale = existing.get();
      log.warn(
          "Discarding {} tenant database record {} for principal {}",
          stale.getStatus(),
          stale.getId(),
          principalId);
      tenantDatabaseRepository.delete(stale);
      tenantDatabaseRepository.flush();
      connectionCache.evict(principalId);
    }

    step = enter(ProvisioningStep.RECORD_CREATING, principalId);
    var record = tenantDatabaseRepository.save(new TenantDatabase(principalId, clock.instant()));

    try {
      String dbName = DatabaseNameGenerator.generateDatabaseName(principalId);

      step = enter(ProvisioningStep.CREATE_DATABASE, principalId);
      var database = createOrFetchDatabase(dbName);

      step = enter(ProvisioningStep.ISSUE_CREDENTIALS, principalId);
      String rwCredential = platformClient.createAuthToken(dbName, false);
      String roCredential = platformClient.createAuthToken(dbName, true);

      step = enter(ProvisioningStep.RECORD_LOCATION, principalId);
      record.markMigrating(
          dbName,
          platformProperties.jdbcUrl(database.hostname(), dbName),
          rwCredential,
          roCredential,
          clock.instant());
      record = tenantDatabaseRepository.save(record);

      step = enter(ProvisioningStep.APPLY_SCHEMA, principalId);
      runTenantMigrations(record);

      step = enter(ProvisioningStep.ACTIVATE, principalId);
      record.markReady(clock.instant());
      record = tenantDatabaseRepository.save(record);

      log.info("Provisioned tenant database {} for principal {}", dbName, principalId);
      return record;
    } catch (RuntimeException e) {
      log.error("Provisioning failed for principal {} at step {}", principalId, step, e);
      recordFailure(record, e);
      connectionCache.evict(principalId);
      if (e instanceof SchemaMigrationException) {
        throw e;
      }
      throw new ProvisioningException(principalId, step, e);
    }
  }

  public Optional<TenantDatabase> findByPrincipalId(String principalId) {
    return tenantDatabaseRepository.findByPrincipalId(principalId);
  }

  /**
   * Location and read-only credential of a ready database, for use outside this service.
   *
   * @throws ResourceNotFoundException if the principal has no database
   * @throws TenantDatabaseNotReadyException if provisioning has not completed
   */
  public TenantDatabase requireReady(String principalId) {
    var record =
        tenantDatabaseRepository
            .findByPrincipalId(principalId)
            .orElseThrow(() -> new ResourceNotFoundException("TenantDatabase", principalId));
    if (!record.isReady()) {
      throw new TenantDatabaseNotReadyException(principalId, record.getStatus().name());
    }
    return record;
  }

  void runTenantMigrations(TenantDatabase record) {
    schemaMigrator.migrate(record.getDbName(), record.getDbUrl(), record.getRwCredential());
  }

  private PlatformDatabase createOrFetchDatabase(String dbName) {
    try {
      return platformClient.createDatabase(dbName, platformProperties.group());
    } catch (DatabaseAlreadyExistsException e) {
      log.info("Database {} already exists, reusing it", dbName);
      return platformClient.getDatabase(dbName);
    }
  }

  private void recordFailure(TenantDatabase record, RuntimeException failure) {
    try {
      if (record.isReady()) {
        // Only the activation write can fail after markReady; the stored row is still MIGRATING.
        tenantDatabaseRepository.updateStatus(
            record.getId(),
            TenantDatabase.Status.MIGRATING,
            TenantDatabase.Status.ERROR,
            clock.instant());
      } else {
        record.markFailed(clock.instant());
        tenantDatabaseRepository.save(record);
      }
    } catch (RuntimeException e) {
      log.error("Could not mark tenant database record {} as failed", record.getId(), e);
      failure.addSuppressed(e);
    }
  }

  private static ProvisioningStep enter(ProvisioningStep step, String principalId) {
    log.debug("Provisioning principal {}: {}", principalId, step);
    return step;
  }
}
