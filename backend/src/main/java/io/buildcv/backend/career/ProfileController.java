package io.buildcv.backend.career;

import io.buildcv.backend.career.dto.ProfileRequest;
import io.buildcv.backend.store.CareerStoreResolver;
import io.buildcv.backend.store.Profile;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/profile")
public class ProfileController {

  private final CareerStoreResolver storeResolver;

  public ProfileController(CareerStoreResolver storeResolver) {
    this.storeResolver = storeResolver;
  }

  /** Returns 204 while no profile has been saved. */
  @GetMapping
  public ResponseEntity<Profile> getProfile(HttpServletRequest request) {
    return storeResolver
        .resolve(request)
        .findProfile()
        .map(ResponseEntity::ok)
        .orElseGet(() -> ResponseEntity.noContent().build());
  }

  @PutMapping
  public ResponseEntity<Profile> updateProfile(
      @Valid @RequestBody ProfileRequest body, HttpServletRequest request) {
    return ResponseEntity.ok(
        storeResolver.resolve(request).updateProfile(body.fullName().trim()));
  }
}
