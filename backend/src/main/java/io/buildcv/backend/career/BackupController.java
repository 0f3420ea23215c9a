package io.buildcv.backend.career;

import io.buildcv.backend.exception.InvalidStateException;
import io.buildcv.backend.store.BackupSnapshot;
import io.buildcv.backend.store.CareerStoreResolver;
import io.buildcv.backend.store.ClearResult;
import io.buildcv.backend.store.ImportResult;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Whole-store export, import and wipe for the caller's current store. */
@RestController
@RequestMapping("/api/backup")
public class BackupController {

  private static final Logger log = LoggerFactory.getLogger(BackupController.class);

  private final CareerStoreResolver storeResolver;

  public BackupController(CareerStoreResolver storeResolver) {
    this.storeResolver = storeResolver;
  }

  @GetMapping
  public ResponseEntity<BackupSnapshot> exportBackup(HttpServletRequest request) {
    return ResponseEntity.ok(storeResolver.resolve(request).exportAll());
  }

  /** Per-record failures are reported in the body with {@code success=false}, not as an error. */
  @PostMapping
  public ResponseEntity<ImportResult> importBackup(
      @RequestBody BackupSnapshot snapshot, HttpServletRequest request) {
    if (snapshot.version() == null || snapshot.version().isBlank()) {
      throw new InvalidStateException("Invalid backup", "Backup version is missing");
    }
    var result = storeResolver.resolve(request).importAll(snapshot);
    if (!result.success()) {
      log.warn("Backup import finished with {} errors", result.errors().size());
    }
    return ResponseEntity.ok(result);
  }

  @DeleteMapping
  public ResponseEntity<ClearResult> clear(HttpServletRequest request) {
    return ResponseEntity.ok(storeResolver.resolve(request).clearAll());
  }
}
