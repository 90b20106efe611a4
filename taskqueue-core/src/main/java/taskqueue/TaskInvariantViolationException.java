package taskqueue;

/**
 * Signals corrupted queue bookkeeping: a task found in two places, a hand-off from an
 * unexpected location, or a lane size outside its capacity.
 *
 * <p>This is never a task failure. The {@link TaskQueue} aborts when it sees one.
 */
public final class TaskInvariantViolationException extends IllegalStateException {

  public TaskInvariantViolationException(String message) {
    super(message);
  }

  public TaskInvariantViolationException(String message, Throwable cause) {
    super(message, cause);
  }
}
