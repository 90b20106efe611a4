package taskqueue.retry;

/**
 * Retry policy whose delay grows by {@code baseDelay} per retry: {@code baseDelay * retryCount},
 * capped at {@code maxDelay}.
 */
public final class LinearBackoffRetryPolicy implements RetryPolicy {
  private final long baseDelayMs;
  private final long maxDelayMs;

  public LinearBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
    if (baseDelayMs < 0) {
      throw new IllegalArgumentException("baseDelayMs must be >= 0, got: " + baseDelayMs);
    }
    if (maxDelayMs < 0) {
      throw new IllegalArgumentException("maxDelayMs must be >= 0, got: " + maxDelayMs);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
  }

  @Override
  public long computeDelayMs(int retryCount) {
    if (retryCount <= 0 || baseDelayMs == 0) {
      return 0L;
    }
    if (retryCount > maxDelayMs / baseDelayMs) {
      return maxDelayMs;
    }
    return Math.min(maxDelayMs, baseDelayMs * retryCount);
  }
}
