package com.visualoom.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.visualoom.model.JobState;

/**
 * Immutable view of an {@link com.visualoom.model.IndexJob} handed to pollers.
 */
public class JobStatus {

    private final String jobId;
    private final String path;
    private final String tag;
    private final JobState state;
    private final int progress;
    private final int total;
    private final int indexed;
    private final String error;

    public JobStatus(String jobId, String path, String tag, JobState state,
            int progress, int total, int indexed, String error) {
        this.jobId = jobId;
        this.path = path;
        this.tag = tag;
        this.state = state;
        this.progress = progress;
        this.total = total;
        this.indexed = indexed;
        this.error = error;
    }

    @JsonProperty("job_id")
    public String getJobId() {
        return jobId;
    }

    public String getPath() {
        return path;
    }

    public String getTag() {
        return tag;
    }

    public JobState getState() {
        return state;
    }

    public int getProgress() {
        return progress;
    }

    public int getTotal() {
        return total;
    }

    public int getIndexed() {
        return indexed;
    }

    public boolean isDone() {
        return state.isTerminal();
    }

    public String getError() {
        return error;
    }
}
