package com.hotel.reconciliation.bulk;

/**
 * Callback interface for tracking progress of listing imports.
 */
@FunctionalInterface
public interface ProgressCallback {

    /**
     * Called to report progress.
     *
     * @param processed the number of records read so far
     * @param total     the total number of records (-1 if unknown)
     * @param message   progress message
     */
    void onProgress(long processed, long total, String message);

    /**
     * A no-op progress callback.
     */
    ProgressCallback NOOP = (processed, total, message) -> {};
}
