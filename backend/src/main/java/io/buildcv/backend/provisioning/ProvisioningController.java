package io.buildcv.backend.provisioning;

import io.buildcv.backend.multitenancy.SessionScopeResolver;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/tenant-database")
public class ProvisioningController {

  private static final Logger log = LoggerFactory.getLogger(ProvisioningController.class);

  private final TenantDatabaseProvisioningService provisioningService;
  private final SessionScopeResolver scopeResolver;

  public ProvisioningController(
      TenantDatabaseProvisioningService provisioningService, SessionScopeResolver scopeResolver) {
    this.provisioningService = provisioningService;
    this.scopeResolver = scopeResolver;
  }

  @PostMapping("/provision")
  public ResponseEntity<TenantDatabaseResponse> provision(HttpServletRequest request) {
    String principalId = scopeResolver.resolve(request).requirePrincipalId();
    log.info("Received provisioning request for principal {}", principalId);
    var record = provisioningService.provision(principalId);
    return ResponseEntity.ok(TenantDatabaseResponse.from(record));
  }

  @GetMapping("/status")
  public ResponseEntity<TenantDatabaseResponse> status(HttpServletRequest request) {
    String principalId = scopeResolver.resolve(request).requirePrincipalId();
    return ResponseEntity.ok(
        provisioningService
            .findByPrincipalId(principalId)
            .map(TenantDatabaseResponse::from)
            .orElseGet(() -> TenantDatabaseResponse.none(principalId)));
  }

  @GetMapping("/connection")
  public ResponseEntity<ConnectionInfoResponse> connection(HttpServletRequest request) {
    String principalId = scopeResolver.resolve(request).requirePrincipalId();
    var record = provisioningService.requireReady(principalId);
    return ResponseEntity.ok(
        new ConnectionInfoResponse(
            record.getDbName(), record.getDbUrl(), record.getRoCredential()));
  }

  /** Registry state of the caller's database. Credentials are never part of this view. */
  public record TenantDatabaseResponse(
      String principalId, String dbName, String status, boolean ready, Instant updatedAt) {

    static TenantDatabaseResponse from(TenantDatabase record) {
      return new TenantDatabaseResponse(
          record.getPrincipalId(),
          TenantDatabase.PENDING.equals(record.getDbName()) ? null : record.getDbName(),
          record.getStatus().name(),
          record.isReady(),
          record.getUpdatedAt());
    }

    static TenantDatabaseResponse none(String principalId) {
      return new TenantDatabaseResponse(principalId, null, "NONE", false, null);
    }
  }

  /** Read-only access details for external tooling. */
  public record ConnectionInfoResponse(String dbName, String dbUrl, String readOnlyToken) {}
}
