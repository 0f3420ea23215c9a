package io.buildcv.backend.migration;

import io.buildcv.backend.multitenancy.SessionScopeResolver;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/migration")
public class MigrationController {

  private final LocalDataMigrationService migrationService;
  private final SessionScopeResolver scopeResolver;

  public MigrationController(
      LocalDataMigrationService migrationService, SessionScopeResolver scopeResolver) {
    this.migrationService = migrationService;
    this.scopeResolver = scopeResolver;
  }

  /** Copies the data of the {@code X-Device-Id} device into the user's database. */
  @PostMapping
  public ResponseEntity<MigrationResult> migrate(HttpServletRequest request) {
    var scope = scopeResolver.resolve(request);
    String principalId = scope.requirePrincipalId();
    String deviceId = scope.requireDeviceId();
    return ResponseEntity.ok(migrationService.migrate(principalId, deviceId));
  }
}
