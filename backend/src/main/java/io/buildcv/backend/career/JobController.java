package io.buildcv.backend.career;

import io.buildcv.backend.career.dto.JobRequest;
import io.buildcv.backend.career.dto.SearchRequest;
import io.buildcv.backend.exception.ResourceNotFoundException;
import io.buildcv.backend.store.CareerStoreResolver;
import io.buildcv.backend.store.Job;
import io.buildcv.backend.store.JobSummary;
import io.buildcv.backend.store.JobWithFilteredHighlights;
import io.buildcv.backend.store.JobWithHighlights;
import io.buildcv.backend.store.SearchFilters;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/jobs")
public class JobController {

  private final CareerStoreResolver storeResolver;

  public JobController(CareerStoreResolver storeResolver) {
    this.storeResolver = storeResolver;
  }

  @GetMapping
  public ResponseEntity<List<JobSummary>> listJobs(HttpServletRequest request) {
    return ResponseEntity.ok(storeResolver.resolve(request).listJobsWithHighlightCounts());
  }

  @GetMapping("/with-highlights")
  public ResponseEntity<List<JobWithHighlights>> listJobsWithHighlights(
      HttpServletRequest request) {
    return ResponseEntity.ok(storeResolver.resolve(request).listJobsWithVisibleHighlights());
  }

  @PostMapping("/search")
  public ResponseEntity<List<JobWithFilteredHighlights>> searchJobs(
      @RequestBody(required = false) SearchRequest search, HttpServletRequest request) {
    var filters = search != null ? search.toFilters() : SearchFilters.none();
    return ResponseEntity.ok(storeResolver.resolve(request).searchJobsWithHighlights(filters));
  }

  @GetMapping("/{id}")
  public ResponseEntity<Job> getJob(@PathVariable String id, HttpServletRequest request) {
    return storeResolver
        .resolve(request)
        .findJob(id)
        .map(ResponseEntity::ok)
        .orElseThrow(() -> new ResourceNotFoundException("Job", id));
  }

  @PostMapping
  public ResponseEntity<Job> createJob(
      @Valid @RequestBody JobRequest body, HttpServletRequest request) {
    var job = storeResolver.resolve(request).createJob(body.toInput());
    return ResponseEntity.created(URI.create("/api/jobs/" + job.id())).body(job);
  }

  @PutMapping("/{id}")
  public ResponseEntity<Job> updateJob(
      @PathVariable String id, @Valid @RequestBody JobRequest body, HttpServletRequest request) {
    return ResponseEntity.ok(storeResolver.resolve(request).updateJob(id, body.toInput()));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> deleteJob(@PathVariable String id, HttpServletRequest request) {
    storeResolver.resolve(request).deleteJob(id);
    return ResponseEntity.noContent().build();
  }
}
