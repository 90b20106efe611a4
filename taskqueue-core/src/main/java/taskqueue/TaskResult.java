package taskqueue;

import java.util.Objects;

/**
 * Result returned by {@link TaskHandler#handle(Object)} to control what happens
 * to the task after execution.
 *
 * <ul>
 *   <li>{@link Success}: the task is done and leaves the queue.</li>
 *   <li>{@link RetryableFailure}: the attempt failed; the task is retried with backoff
 *       until its retry budget is spent, then dead-lettered.</li>
 *   <li>{@link PermanentFailure}: the task can never succeed (for example an invalid
 *       payload); it is dead-lettered without further attempts.</li>
 * </ul>
 *
 * <p>A handler that throws is treated like {@link RetryableFailure}.
 */
public sealed interface TaskResult
    permits TaskResult.Success, TaskResult.RetryableFailure, TaskResult.PermanentFailure {

  /**
   * Singleton indicating successful processing.
   */
  Success SUCCESS = new Success();

  static Success success() {
    return SUCCESS;
  }

  /**
   * Creates a retryable failure.
   *
   * @param reason why the attempt failed
   * @return a retryable failure
   */
  static RetryableFailure retry(String reason) {
    return new RetryableFailure(reason);
  }

  /**
   * Creates a permanent failure that bypasses the retry budget.
   *
   * @param reason why the task can never succeed
   * @return a permanent failure
   */
  static PermanentFailure fail(String reason) {
    return new PermanentFailure(reason);
  }

  /**
   * Returns whether this result is a success.
   *
   * @return {@code true} for {@link Success}
   */
  default boolean isSuccess() {
    return this instanceof Success;
  }

  /** Task processed successfully. */
  record Success() implements TaskResult {
  }

  /**
   * Attempt failed; retry if the budget allows.
   *
   * @param reason failure reason (never null)
   */
  record RetryableFailure(String reason) implements TaskResult {
    public RetryableFailure {
      Objects.requireNonNull(reason, "reason must not be null");
    }
  }

  /**
   * Task failed for good; dead-letter immediately.
   *
   * @param reason failure reason (never null)
   */
  record PermanentFailure(String reason) implements TaskResult {
    public PermanentFailure {
      Objects.requireNonNull(reason, "reason must not be null");
    }
  }
}
