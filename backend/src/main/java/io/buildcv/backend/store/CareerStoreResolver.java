package io.buildcv.backend.store;

import io.buildcv.backend.multitenancy.SessionScope;
import io.buildcv.backend.multitenancy.SessionScopeResolver;
import io.buildcv.backend.multitenancy.TenantConnectionCache;
import io.buildcv.backend.store.local.LocalCareerStores;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.stereotype.Component;

/**
 * Picks the store a request reads and writes: the device-local store for anonymous sessions, the
 * principal's tenant database once signed in.
 */
@Component
public class CareerStoreResolver {

  private final SessionScopeResolver scopeResolver;
  private final LocalCareerStores localStores;
  private final TenantConnectionCache connectionCache;

  public CareerStoreResolver(
      SessionScopeResolver scopeResolver,
      LocalCareerStores localStores,
      TenantConnectionCache connectionCache) {
    this.scopeResolver = scopeResolver;
    this.localStores = localStores;
    this.connectionCache = connectionCache;
  }

  public CareerStore resolve(HttpServletRequest request) {
    return forScope(scopeResolver.resolve(request));
  }

  public CareerStore forScope(SessionScope scope) {
    return switch (scope.mode()) {
      case ANONYMOUS -> localStores.forDevice(scope.requireDeviceId());
      case AUTHENTICATED -> connectionCache.storeFor(scope.requirePrincipalId());
    };
  }
}
