package io.buildcv.backend.multitenancy;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.Ticker;
import io.buildcv.backend.exception.ResourceNotFoundException;
import io.buildcv.backend.exception.TenantDatabaseNotReadyException;
import io.buildcv.backend.provisioning.TenantDatabaseRepository;
import io.buildcv.backend.store.remote.RemoteCareerStore;
import java.time.Clock;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import tools.jackson.databind.ObjectMapper;

/**
 * Live connections to tenant databases, keyed by principal id. A connection is opened on first use
 * from the registry's read-write credential, dropped after {@code idle-ttl} without access, and
 * its pool is closed when the entry leaves the cache.
 */
@Component
public class TenantConnectionCache {

  private static final Logger log = LoggerFactory.getLogger(TenantConnectionCache.class);

  private final TenantDatabaseRepository tenantDatabaseRepository;
  private final TenantDataSourceFactory dataSourceFactory;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final Cache<String, TenantConnection> connections;

  @Autowired
  public TenantConnectionCache(
      TenantDatabaseRepository tenantDatabaseRepository,
      TenantDataSourceFactory dataSourceFactory,
      ObjectMapper objectMapper,
      Clock clock,
      TenantConnectionProperties properties) {
    this(
        tenantDatabaseRepository,
        dataSourceFactory,
        objectMapper,
        clock,
        properties,
        Ticker.systemTicker(),
        ForkJoinPool.commonPool());
  }

  TenantConnectionCache(
      TenantDatabaseRepository tenantDatabaseRepository,
      TenantDataSourceFactory dataSourceFactory,
      ObjectMapper objectMapper,
      Clock clock,
      TenantConnectionProperties properties,
      Ticker ticker,
      Executor executor) {
    this.tenantDatabaseRepository = tenantDatabaseRepository;
    this.dataSourceFactory = dataSourceFactory;
    this.objectMapper = objectMapper;
    this.clock = clock;
    this.connections =
        Caffeine.newBuilder()
            .maximumSize(properties.maximumSize())
            .expireAfterAccess(properties.idleTtl())
            .ticker(ticker)
            .executor(executor)
            .removalListener(
                (String principalId, TenantConnection connection, RemovalCause cause) ->
                    onRemoval(principalId, connection, cause))
            .build();
  }

  /**
   * Returns the store bound to the principal's database.
   *
   * @throws ResourceNotFoundException if the principal has no registry record
   * @throws TenantDatabaseNotReadyException if the database is not {@code READY}
   */
  public RemoteCareerStore storeFor(String principalId) {
    return connections.get(principalId, this::open).store();
  }

  /** Drops the cached connection, e.g. after the credential was rotated or re-provisioned. */
  public void evict(String principalId) {
    connections.invalidate(principalId);
  }

  long size() {
    connections.cleanUp();
    return connections.estimatedSize();
  }

  private TenantConnection open(String principalId) {
    var record =
        tenantDatabaseRepository
            .findByPrincipalId(principalId)
            .orElseThrow(() -> new ResourceNotFoundException("TenantDatabase", principalId));
    if (!record.isReady()) {
      throw new TenantDatabaseNotReadyException(principalId, record.getStatus().name());
    }
    var dataSource =
        dataSourceFactory.create(record.getDbName(), record.getDbUrl(), record.getRwCredential());
    log.info("Opened connection to {} for principal {}", record.getDbName(), principalId);
    return new TenantConnection(
        principalId, dataSource, new RemoteCareerStore(dataSource, objectMapper, clock));
  }

  private void onRemoval(String principalId, TenantConnection connection, RemovalCause cause) {
    if (connection == null) {
      return;
    }
    log.info("Closing connection for principal {} ({})", principalId, cause);
    try {
      connection.close();
    } catch (RuntimeException e) {
      log.warn("Failed to close connection pool for principal {}", principalId, e);
    }
  }
}
