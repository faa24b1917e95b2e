package com.place.conflation.bulk;

/**
 * Callback interface for tracking progress of long-running batch work.
 * Progress is observability only; callbacks must not affect results.
 */
@FunctionalInterface
public interface ProgressCallback {

    /**
     * Called to report progress.
     *
     * @param processed the number of units processed so far
     * @param total     the total number of units (may be -1 if unknown)
     * @param message   optional progress message
     */
    void onProgress(long processed, long total, String message);

    /**
     * A no-op progress callback.
     */
    ProgressCallback NOOP = (processed, total, message) -> {};
}
