package io.buildcv.backend.platform;

/** The platform answered a create call with a conflict: the named database is already there. */
public class DatabaseAlreadyExistsException extends PlatformApiException {

  private final String databaseName;

  public DatabaseAlreadyExistsException(String databaseName) {
    super("Database " + databaseName + " already exists");
    this.databaseName = databaseName;
  }

  public String getDatabaseName() {
    return databaseName;
  }
}
