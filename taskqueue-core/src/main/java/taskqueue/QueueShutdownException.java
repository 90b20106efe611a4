package taskqueue;

/**
 * Thrown when a task is offered to a queue that has been shut down, including a
 * producer that was blocked on a full lane when shutdown began.
 *
 * <p>If the queue stopped because of an internal invariant violation, the violation
 * is attached as the cause.
 */
public class QueueShutdownException extends IllegalStateException {

  public QueueShutdownException(String message) {
    super(message);
  }

  public QueueShutdownException(String message, Throwable cause) {
    super(message, cause);
  }
}
