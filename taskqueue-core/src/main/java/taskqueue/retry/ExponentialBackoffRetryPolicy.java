package taskqueue.retry;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Retry policy using exponential backoff.
 *
 * <p>Delay formula: {@code baseDelay * 2^(retryCount-1)}, capped at {@code maxDelay}.
 * With {@code base = 1s} and {@code max = 300s} this yields 1s, 2s, 4s, 8s ... 256s, 300s.
 * Jitter is off unless requested; when on, the capped delay is scaled by a random factor
 * in [0.5, 1.5) and capped again.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  public static final long DEFAULT_BASE_DELAY_MS = 1_000L;
  public static final long DEFAULT_MAX_DELAY_MS = 300_000L;

  private final long baseDelayMs;
  private final long maxDelayMs;
  private final boolean jitter;

  /**
   * Creates a policy with the defaults: 1 second base, 300 seconds cap, no jitter.
   */
  public ExponentialBackoffRetryPolicy() {
    this(DEFAULT_BASE_DELAY_MS, DEFAULT_MAX_DELAY_MS, false);
  }

  /**
   * @param baseDelayMs delay before the first retry (milliseconds)
   * @param maxDelayMs  maximum delay cap (milliseconds)
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
    this(baseDelayMs, maxDelayMs, false);
  }

  /**
   * @param baseDelayMs delay before the first retry (milliseconds)
   * @param maxDelayMs  maximum delay cap (milliseconds)
   * @param jitter      whether to randomize each delay
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs, boolean jitter) {
    if (baseDelayMs < 0) {
      throw new IllegalArgumentException("baseDelayMs must be >= 0, got: " + baseDelayMs);
    }
    if (maxDelayMs < 0) {
      throw new IllegalArgumentException("maxDelayMs must be >= 0, got: " + maxDelayMs);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
    this.jitter = jitter;
  }

  public static ExponentialBackoffRetryPolicy of(Duration baseDelay, Duration maxDelay) {
    return new ExponentialBackoffRetryPolicy(baseDelay.toMillis(), maxDelay.toMillis());
  }

  @Override
  public long computeDelayMs(int retryCount) {
    if (retryCount <= 0 || baseDelayMs == 0) {
      return 0L;
    }
    long expDelay;
    if (retryCount >= 63) {
      expDelay = Long.MAX_VALUE;
    } else {
      long shift = 1L << (retryCount - 1);
      // cap before multiplying so large counts cannot overflow
      expDelay = shift > maxDelayMs / baseDelayMs ? Long.MAX_VALUE : baseDelayMs * shift;
    }
    long capped = Math.min(maxDelayMs, expDelay);
    if (!jitter) {
      return capped;
    }
    double factor = ThreadLocalRandom.current().nextDouble(0.5, 1.5);
    return Math.min(maxDelayMs, Math.max(0L, (long) (capped * factor)));
  }

  public long baseDelayMs() {
    return baseDelayMs;
  }

  public long maxDelayMs() {
    return maxDelayMs;
  }
}
