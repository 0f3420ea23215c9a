package io.buildcv.backend.provisioning;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * Control-plane record of a principal's dedicated database. Mutated only by {@link
 * TenantDatabaseProvisioningService}; status moves forward {@code CREATING -> MIGRATING -> READY},
 * or to {@code ERROR} from any unfinished step.
 */
@Entity
@Table(name = "tenant_databases")
public class TenantDatabase {

  static final String PENDING = "pending";

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "principal_id", nullable = false, unique = true)
  private String principalId;

  @Column(name = "db_name", nullable = false)
  private String dbName;

  @Column(name = "db_url", nullable = false)
  private String dbUrl;

  @Column(name = "rw_credential", nullable = false)
  private String rwCredential;

  @Column(name = "ro_credential")
  private String roCredential;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false)
  private Status status;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected TenantDatabase() {}

  public TenantDatabase(String principalId, Instant now) {
    this.principalId = principalId;
    this.dbName = PENDING;
    this.dbUrl = PENDING;
    this.rwCredential = PENDING;
    this.status = Status.CREATING;
    this.createdAt = now;
    this.updatedAt = now;
  }

  public UUID getId() {
    return id;
  }

  public String getPrincipalId() {
    return principalId;
  }

  public String getDbName() {
    return dbName;
  }

  public String getDbUrl() {
    return dbUrl;
  }

  public String getRwCredential() {
    return rwCredential;
  }

  public String getRoCredential() {
    return roCredential;
  }

  public Status getStatus() {
    return status;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public boolean isReady() {
    return status == Status.READY;
  }

  public void markMigrating(
      String dbName, String dbUrl, String rwCredential, String roCredential, Instant now) {
    transitionTo(Status.MIGRATING, now);
    this.dbName = dbName;
    this.dbUrl = dbUrl;
    this.rwCredential = rwCredential;
    this.roCredential = roCredential;
  }

  public void markReady(Instant now) {
    transitionTo(Status.READY, now);
  }

  public void markFailed(Instant now) {
    transitionTo(Status.ERROR, now);
  }

  private void transitionTo(Status next, Instant now) {
    if (!status.canTransitionTo(next)) {
      throw new IllegalStateException(
          "Tenant database for " + principalId + " cannot move from " + status + " to " + next);
    }
    this.status = next;
    this.updatedAt = now;
  }

  public enum Status {
    CREATING,
    MIGRATING,
    READY,
    ERROR;

    boolean canTransitionTo(Status next) {
      return switch (this) {
        case CREATING -> next == MIGRATING || next == ERROR;
        case MIGRATING -> next == READY || next == ERROR;
        case READY, ERROR -> false;
      };
    }
  }
}
