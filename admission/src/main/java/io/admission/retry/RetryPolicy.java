package io.admission.retry;

/**
 * Decides whether a failed task execution runs again, and after how long.
 */
public interface RetryPolicy {
    /**
     * @param attempt the 1-based number of the execution that just failed
     */
    boolean shouldRetry(int attempt, Exception e);

    long backoffMillis(int attempt);

    static RetryPolicy never() {
        return new RetryPolicy() {
            @Override public boolean shouldRetry(int attempt, Exception e) { return false; }
            @Override public long backoffMillis(int attempt) { return 0L; }
        };
    }
}
