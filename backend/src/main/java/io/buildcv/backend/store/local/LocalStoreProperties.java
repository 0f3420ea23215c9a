package io.buildcv.backend.store.local;

import java.nio.file.Path;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * @param directory where device documents are kept, one {@code <deviceId>.json} each
 * @param idleTtl how long an opened device store stays in memory without access
 * @param maximumSize upper bound on device stores held in memory
 */
@ConfigurationProperties(prefix = "buildcv.local-store")
public record LocalStoreProperties(
    @DefaultValue("data/local-stores") Path directory,
    @DefaultValue("1h") Duration idleTtl,
    @DefaultValue("10000") long maximumSize) {}
