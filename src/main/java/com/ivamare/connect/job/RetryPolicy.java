package com.ivamare.connect.job;

import java.util.List;

/**
 * Retry policy for background jobs.
 *
 * @param maxAttempts Maximum number of attempts before giving up
 * @param backoffSchedule Delay in seconds before each retry
 */
public record RetryPolicy(
    int maxAttempts,
    List<Integer> backoffSchedule
) {
    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        backoffSchedule = List.copyOf(backoffSchedule);
    }

    /**
     * Default retry policy: 3 attempts with backoff [10, 60, 300].
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(3, List.of(10, 60, 300));
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, List.of());
    }

    /**
     * Delay before retrying after a failed attempt.
     *
     * @param attempt the attempt that just failed (1-based)
     * @return delay in seconds, or 0 when no retry follows
     */
    public int getBackoff(int attempt) {
        if (attempt >= maxAttempts) {
            return 0;
        }
        if (backoffSchedule.isEmpty()) {
            return 30;
        }

        int index = Math.max(attempt - 1, 0);
        if (index < backoffSchedule.size()) {
            return backoffSchedule.get(index);
        }
        return backoffSchedule.get(backoffSchedule.size() - 1);
    }

    public boolean shouldRetry(int attempt) {
        return attempt < maxAttempts;
    }
}
