package io.buildcv.backend.platform;

/**
 * External platform that hosts one database per principal. Failures are reported as {@link
 * PlatformApiException}.
 */
public interface DatabasePlatformClient {

  /**
   * Creates a database.
   *
   * @throws DatabaseAlreadyExistsException if a database with this name exists already
   */
  PlatformDatabase createDatabase(String name, String group);

  PlatformDatabase getDatabase(String name);

  /** Issues a credential for the database; read-only tokens cannot write. */
  String createAuthToken(String databaseName, boolean readOnly);
}
