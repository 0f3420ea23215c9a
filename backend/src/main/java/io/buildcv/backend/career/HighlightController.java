package io.buildcv.backend.career;

import io.buildcv.backend.career.dto.HighlightRequest;
import io.buildcv.backend.career.dto.SearchRequest;
import io.buildcv.backend.exception.ResourceNotFoundException;
import io.buildcv.backend.store.CareerStoreResolver;
import io.buildcv.backend.store.Highlight;
import io.buildcv.backend.store.HighlightWithJob;
import io.buildcv.backend.store.SearchFilters;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/highlights")
public class HighlightController {

  private final CareerStoreResolver storeResolver;

  public HighlightController(CareerStoreResolver storeResolver) {
    this.storeResolver = storeResolver;
  }

  @GetMapping
  public ResponseEntity<List<Highlight>> listHighlights(HttpServletRequest request) {
    return ResponseEntity.ok(storeResolver.resolve(request).listHighlights());
  }

  @PostMapping("/search")
  public ResponseEntity<List<HighlightWithJob>> searchHighlights(
      @RequestBody(required = false) SearchRequest search, HttpServletRequest request) {
    var filters = search != null ? search.toFilters() : SearchFilters.none();
    return ResponseEntity.ok(storeResolver.resolve(request).search(filters));
  }

  @GetMapping("/domains")
  public ResponseEntity<List<String>> listDomains(HttpServletRequest request) {
    return ResponseEntity.ok(storeResolver.resolve(request).listDomains());
  }

  @GetMapping("/skills")
  public ResponseEntity<List<String>> listSkills(HttpServletRequest request) {
    return ResponseEntity.ok(storeResolver.resolve(request).listSkills());
  }

  @GetMapping("/{id}")
  public ResponseEntity<Highlight> getHighlight(
      @PathVariable String id, HttpServletRequest request) {
    return storeResolver
        .resolve(request)
        .findHighlight(id)
        .map(ResponseEntity::ok)
        .orElseThrow(() -> new ResourceNotFoundException("Highlight", id));
  }

  @PostMapping
  public ResponseEntity<Highlight> createHighlight(
      @Valid @RequestBody HighlightRequest body, HttpServletRequest request) {
    var highlight = storeResolver.resolve(request).createHighlight(body.toInput());
    return ResponseEntity.created(URI.create("/api/highlights/" + highlight.id()))
        .body(highlight);
  }

  @PutMapping("/{id}")
  public ResponseEntity<Highlight> updateHighlight(
      @PathVariable String id,
      @Valid @RequestBody HighlightRequest body,
      HttpServletRequest request) {
    return ResponseEntity.ok(storeResolver.resolve(request).updateHighlight(id, body.toInput()));
  }

  @PatchMapping("/{id}/visibility")
  public ResponseEntity<Highlight> toggleVisibility(
      @PathVariable String id, HttpServletRequest request) {
    return ResponseEntity.ok(storeResolver.resolve(request).toggleVisibility(id));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> deleteHighlight(
      @PathVariable String id, HttpServletRequest request) {
    storeResolver.resolve(request).deleteHighlight(id);
    return ResponseEntity.noContent().build();
  }
}
