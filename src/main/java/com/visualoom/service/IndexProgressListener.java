package com.visualoom.service;

/**
 * Receives progress callbacks from a sweep. Callbacks run on the sweeping
 * thread.
 */
public interface IndexProgressListener {

    IndexProgressListener NONE = new IndexProgressListener() {
    };

    /**
     * Called once the walk is complete.
     *
     * @param total number of candidate files not yet in the catalog
     */
    default void onDiscovered(int total) {
    }

    /**
     * Called after each candidate file has been handled.
     *
     * @param processed candidates handled so far, including skipped ones
     * @param written   new records persisted so far
     */
    default void onProgress(int processed, int written) {
    }
}
