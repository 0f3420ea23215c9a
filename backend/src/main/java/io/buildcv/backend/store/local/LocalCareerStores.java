package io.buildcv.backend.store.local;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import io.buildcv.backend.exception.InvalidStateException;
import java.time.Clock;
import java.util.regex.Pattern;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import tools.jackson.databind.ObjectMapper;

/**
 * Opens device stores on demand and keeps recently used ones in memory.
 *
 * <p>There is at most one live {@link LocalCareerStore} per device. Recently used stores are held
 * strongly until they go idle; after that a store stays registered for as long as any caller
 * still references it, and only a store nobody holds is reopened from disk.
 */
@Component
public class LocalCareerStores {

  private static final Pattern DEVICE_ID = Pattern.compile("[A-Za-z0-9_-]{8,64}");

  private final LocalStoreProperties properties;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final Cache<String, LocalCareerStore> recent;
  private final Cache<String, LocalCareerStore> live;

  @Autowired
  public LocalCareerStores(
      LocalStoreProperties properties, ObjectMapper objectMapper, Clock clock) {
    this(properties, objectMapper, clock, Ticker.systemTicker());
  }

  LocalCareerStores(
      LocalStoreProperties properties, ObjectMapper objectMapper, Clock clock, Ticker ticker) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.clock = clock;
    this.recent =
        Caffeine.newBuilder()
            .maximumSize(properties.maximumSize())
            .expireAfterAccess(properties.idleTtl())
            .ticker(ticker)
            .build();
    this.live = Caffeine.newBuilder().weakValues().build();
  }

  public LocalCareerStore forDevice(String deviceId) {
    if (deviceId == null || !DEVICE_ID.matcher(deviceId).matches()) {
      throw new InvalidStateException(
          "Invalid device id", "Device ids are 8 to 64 letters, digits, '-' or '_'");
    }
    return recent.get(deviceId, id -> live.get(id, this::open));
  }

  private LocalCareerStore open(String deviceId) {
    return new LocalCareerStore(
        properties.directory().resolve(deviceId + ".json"), objectMapper, clock);
  }
}
