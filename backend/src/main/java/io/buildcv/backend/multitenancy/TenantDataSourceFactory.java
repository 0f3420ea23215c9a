package io.buildcv.backend.multitenancy;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.buildcv.backend.platform.PlatformProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Opens connection pools to tenant databases. Callers own the returned pool and must close it. */
@Component
public class TenantDataSourceFactory {

  private static final Logger log = LoggerFactory.getLogger(TenantDataSourceFactory.class);

  private final TenantConnectionProperties properties;
  private final PlatformProperties platformProperties;

  public TenantDataSourceFactory(
      TenantConnectionProperties properties, PlatformProperties platformProperties) {
    this.properties = properties;
    this.platformProperties = platformProperties;
  }

  public HikariDataSource create(String dbName, String jdbcUrl, String credential) {
    var config = new HikariConfig();
    config.setPoolName("tenant-" + dbName);
    config.setJdbcUrl(jdbcUrl);
    config.setUsername(platformProperties.jdbcUsername());
    config.setPassword(credential);
    config.setMaximumPoolSize(properties.poolSize());
    config.setMinimumIdle(0);
    config.setConnectionTimeout(properties.connectionTimeout().toMillis());
    log.debug("Opening connection pool for tenant database {}", dbName);
    return new HikariDataSource(config);
  }
}
