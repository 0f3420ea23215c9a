package io.buildcv.backend.migration;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Run-once flag per sign-in session, keyed by principal and the anonymous device it signed in
 * from. Two devices of the same principal are separate sessions and may both migrate.
 */
@Component
public class MigrationGuard {

  private static final Duration SESSION_WINDOW = Duration.ofHours(24);

  private final Cache<String, Boolean> started;

  @Autowired
  public MigrationGuard() {
    this(Ticker.systemTicker());
  }

  MigrationGuard(Ticker ticker) {
    this.started =
        Caffeine.newBuilder()
            .maximumSize(100_000)
            .expireAfterWrite(SESSION_WINDOW)
            .ticker(ticker)
            .build();
  }

  /** Returns {@code true} exactly once per session until {@link #release} is called. */
  public boolean tryAcquire(String principalId, String deviceId) {
    return started.asMap().putIfAbsent(key(principalId, deviceId), Boolean.TRUE) == null;
  }

  /** Allows the session to migrate again, after a failed attempt. */
  public void release(String principalId, String deviceId) {
    started.invalidate(key(principalId, deviceId));
  }

  public boolean hasRun(String principalId, String deviceId) {
    return started.getIfPresent(key(principalId, deviceId)) != null;
  }

  private static String key(String principalId, String deviceId) {
    return principalId + ":" + deviceId;
  }
}
