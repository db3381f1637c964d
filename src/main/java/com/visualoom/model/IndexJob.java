package com.visualoom.model;

import com.visualoom.dto.JobStatus;

import java.util.concurrent.CompletableFuture;

/**
 * Mutable state of one background sweep.
 *
 * Only the task that owns the job mutates it; pollers read it through
 * {@link #snapshot()}. Every accessor is synchronized on the job itself.
 * A job becomes terminal exactly once.
 */
public class IndexJob {

    private final String jobId;
    private final String path;
    private final String tag;

    private JobState state = JobState.CREATED;
    private int progress;
    private int total;
    private int indexed;
    private String error;

    /** Execution handle, kept for a future cancel operation */
    private volatile CompletableFuture<Void> execution;

    public IndexJob(String jobId, String path, String tag) {
        this.jobId = jobId;
        this.path = path;
        this.tag = tag;
    }

    public synchronized void markRunning() {
        if (state == JobState.CREATED) {
            state = JobState.RUNNING;
        }
    }

    /**
     * Records how many new candidate files the sweep found.
     */
    public synchronized void start(int total) {
        if (state.isTerminal()) {
            return;
        }
        this.total = total;
        this.progress = 0;
    }

    /**
     * Updates progress after a candidate was handled.
     *
     * @param processed candidates handled so far
     * @param written   records persisted so far
     */
    public synchronized void update(int processed, int written) {
        if (state.isTerminal()) {
            return;
        }
        if (total > 0) {
            progress = (int) Math.min(100L, (long) processed * 100L / total);
        }
        indexed = written;
    }

    public synchronized void complete(int written) {
        if (state.isTerminal()) {
            return;
        }
        indexed = written;
        progress = 100;
        state = JobState.COMPLETED;
    }

    /**
     * Marks the job failed. Progress stays where the sweep left it.
     */
    public synchronized void fail(String message) {
        if (state.isTerminal()) {
            return;
        }
        error = message;
        state = JobState.FAILED;
    }

    public synchronized JobStatus snapshot() {
        return new JobStatus(jobId, path, tag, state, progress, total, indexed, error);
    }

    public String getJobId() {
        return jobId;
    }

    public String getPath() {
        return path;
    }

    public String getTag() {
        return tag;
    }

    public synchronized JobState getState() {
        return state;
    }

    public CompletableFuture<Void> getExecution() {
        return execution;
    }

    public void setExecution(CompletableFuture<Void> execution) {
        this.execution = execution;
    }
}
