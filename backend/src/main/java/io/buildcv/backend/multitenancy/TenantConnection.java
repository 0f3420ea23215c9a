package io.buildcv.backend.multitenancy;

import com.zaxxer.hikari.HikariDataSource;
import io.buildcv.backend.store.remote.RemoteCareerStore;

/** An open pool to one principal's database and the store bound to it. */
public record TenantConnection(
    String principalId, HikariDataSource dataSource, RemoteCareerStore store)
    implements AutoCloseable {

  @Override
  public void close() {
    dataSource.close();
  }
}
