package io.buildcv.backend.config;

import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class FlywayConfig {

  @Bean(initMethod = "migrate")
  public Flyway globalFlyway(@Qualifier("registryDataSource") DataSource registryDataSource) {
    return Flyway.configure()
        .dataSource(registryDataSource)
        .locations("classpath:db/migration/global")
        .baselineOnMigrate(true)
        .load();
  }
}
