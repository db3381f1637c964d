package com.visualoom.service;

import com.visualoom.dto.JobStatus;
import com.visualoom.model.IndexJob;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs sweeps in the background and tracks their progress.
 *
 * {@link #submit} registers a job and returns its id straight away; the sweep
 * runs on the {@code indexingExecutor}. Pollers read snapshots through
 * {@link #status}. A job ends in COMPLETED or FAILED; errors never reach the
 * submitting caller.
 */
@Service
public class IndexJobService {

    private static final Logger log = LoggerFactory.getLogger(IndexJobService.class);

    private final ImageIndexerService imageIndexerService;
    private final Executor indexingExecutor;

    private final Map<String, IndexJob> jobs = new ConcurrentHashMap<>();

    public IndexJobService(ImageIndexerService imageIndexerService,
            @Qualifier("indexingExecutor") Executor indexingExecutor) {
        this.imageIndexerService = imageIndexerService;
        this.indexingExecutor = indexingExecutor;
    }

    /**
     * Schedules a sweep of {@code path}.
     *
     * @param path directory to index
     * @param tag  optional tag for every image the sweep adds; may be null
     * @return the new job id
     */
    public String submit(String path, String tag) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Path cannot be empty");
        }
        String jobId = UUID.randomUUID().toString();
        String normalizedTag = (tag == null || tag.isBlank()) ? null : tag.trim();
        IndexJob job = new IndexJob(jobId, path, normalizedTag);
        jobs.put(jobId, job);

        try {
            job.setExecution(CompletableFuture.runAsync(() -> run(job), indexingExecutor));
            log.info("Submitted index job {} for {}", jobId, path);
        } catch (RejectedExecutionException e) {
            job.fail("Indexing queue is full");
            log.warn("Rejected index job {} for {}: queue is full", jobId, path);
        }
        return jobId;
    }

    public Optional<JobStatus> status(String jobId) {
        IndexJob job = jobId == null ? null : jobs.get(jobId);
        return Optional.ofNullable(job).map(IndexJob::snapshot);
    }

    public List<JobStatus> listJobs() {
        return jobs.values().stream().map(IndexJob::snapshot).toList();
    }

    void run(IndexJob job) {
        job.markRunning();
        try {
            Path root = Paths.get(job.getPath());
            List<?> added = imageIndexerService.index(root, job.getTag(), new IndexProgressListener() {
                @Override
                public void onDiscovered(int total) {
                    job.start(total);
                }

                @Override
                public void onProgress(int processed, int written) {
                    job.update(processed, written);
                }
            });
            job.complete(added.size());
            log.info("Index job {} completed: {} new images", job.getJobId(), added.size());
        } catch (Exception e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getName();
            job.fail(message);
            log.error("Index job {} failed: {}", job.getJobId(), message);
        }
    }

    @PreDestroy
    public void shutdown() {
        long running = jobs.values().stream().filter(j -> !j.getState().isTerminal()).count();
        if (running > 0) {
            log.info("Shutting down with {} unfinished index job(s)", running);
        }
        jobs.clear();
    }
}
