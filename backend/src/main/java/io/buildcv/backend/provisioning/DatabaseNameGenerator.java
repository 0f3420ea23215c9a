package io.buildcv.backend.provisioning;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Derives the platform database name for a principal. The name is stable across retries, so a
 * second create call for the same principal hits the platform's "already exists" path.
 */
public final class DatabaseNameGenerator {

  private static final UUID NAMESPACE = UUID.fromString("6ba7b810-9dad-11d1-80b4-00c04fd430c8");

  private DatabaseNameGenerator() {}

  public static String generateDatabaseName(String principalId) {
    if (principalId == null || principalId.isBlank()) {
      throw new IllegalArgumentException("Principal ID must not be null or blank");
    }
    byte[] input = (NAMESPACE + principalId).getBytes(StandardCharsets.UTF_8);
    UUID hash = UUID.nameUUIDFromBytes(input);
    String hex = hash.toString().replace("-", "");
    return "buildcv-" + hex.substring(0, 12);
  }
}
