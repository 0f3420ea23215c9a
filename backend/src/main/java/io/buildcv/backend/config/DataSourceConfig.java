package io.buildcv.backend.config;

import com.zaxxer.hikari.HikariDataSource;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Control-plane registry connection. Tenant databases never go through this pool; they get their
 * own pools from {@code TenantDataSourceFactory}.
 */
@Configuration
public class DataSourceConfig {

  @Bean(name = "registryDataSource")
  @Primary
  @ConfigurationProperties("spring.datasource.registry")
  public HikariDataSource registryDataSource() {
    return new HikariDataSource();
  }
}
