package io.buildcv.backend.multitenancy;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Sizing of the per-tenant connection cache and of each tenant's pool.
 *
 * @param idleTtl how long an unused tenant connection stays open
 * @param maximumSize upper bound on concurrently cached tenants
 * @param poolSize maximum connections per tenant pool
 * @param connectionTimeout how long a caller waits for a pooled connection
 */
@ConfigurationProperties(prefix = "buildcv.tenant-connections")
public record TenantConnectionProperties(
    @DefaultValue("30m") Duration idleTtl,
    @DefaultValue("1000") long maximumSize,
    @DefaultValue("3") int poolSize,
    @DefaultValue("10s") Duration connectionTimeout) {}
