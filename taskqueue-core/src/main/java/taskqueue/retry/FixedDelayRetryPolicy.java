package taskqueue.retry;

/**
 * Retry policy that waits the same delay before every retry.
 */
public final class FixedDelayRetryPolicy implements RetryPolicy {
  private final long delayMs;

  public FixedDelayRetryPolicy(long delayMs) {
    if (delayMs < 0) {
      throw new IllegalArgumentException("delayMs must be >= 0, got: " + delayMs);
    }
    this.delayMs = delayMs;
  }

  @Override
  public long computeDelayMs(int retryCount) {
    return retryCount <= 0 ? 0L : delayMs;
  }
}
