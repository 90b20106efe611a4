package taskqueue.retry;

/**
 * Strategy for computing the delay before a failed task is retried.
 *
 * @see ExponentialBackoffRetryPolicy
 * @see LinearBackoffRetryPolicy
 * @see FixedDelayRetryPolicy
 */
public interface RetryPolicy {

    /**
     * Computes the delay in milliseconds before the next attempt.
     *
     * @param retryCount the task's retry count after the failure (1 for the first retry)
     * @return delay in milliseconds (non-negative)
     */
    long computeDelayMs(int retryCount);
}
