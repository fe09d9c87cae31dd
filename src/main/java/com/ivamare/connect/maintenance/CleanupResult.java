package com.ivamare.connect.maintenance;

/**
 * Counts of one cleanup run.
 *
 * @param deleted Old entries purged
 * @param reenqueued Stale productions handed back to the job scheduler
 * @param skipped Stale entries whose key was completed by a later attempt
 * @param failed Stale entries marked Failed
 */
public record CleanupResult(int deleted, int reenqueued, int skipped, int failed) {}
