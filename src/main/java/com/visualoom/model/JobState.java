package com.visualoom.model;

/**
 * Lifecycle of an indexing job. COMPLETED and FAILED are terminal.
 */
public enum JobState {
    CREATED, RUNNING, COMPLETED, FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
