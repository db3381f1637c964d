package com.visualoom.controller;

import com.visualoom.dto.JobStatus;
import com.visualoom.service.IndexJobService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST controller for indexing jobs.
 *
 * Endpoints:
 * POST /api/index - start a background sweep of a directory
 * GET /api/index/{jobId} - poll one job
 * GET /api/index - list all jobs of this process
 */
@RestController
@RequestMapping("/api/index")
public class IndexController {

    private final IndexJobService indexJobService;

    public IndexController(IndexJobService indexJobService) {
        this.indexJobService = indexJobService;
    }

    /**
     * Starts a sweep and returns its job id immediately.
     * Body: { "path": "/photos", "tag": "optional tag name" }
     */
    @PostMapping
    public ResponseEntity<Map<String, Object>> startIndexing(@RequestBody Map<String, String> body) {
        String path = body.get("path");
        if (path == null || path.isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "path is required"));
        }
        String jobId = indexJobService.submit(path.trim(), body.get("tag"));
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of(
                "job_id", jobId,
                "path", path.trim()));
    }

    @GetMapping("/{jobId}")
    public ResponseEntity<?> getStatus(@PathVariable String jobId) {
        return indexJobService.status(jobId)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElse(ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(Map.of("error", "Job not found: " + jobId)));
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> listJobs() {
        List<JobStatus> jobs = indexJobService.listJobs();
        return ResponseEntity.ok(Map.of("jobs", jobs, "count", jobs.size()));
    }
}
