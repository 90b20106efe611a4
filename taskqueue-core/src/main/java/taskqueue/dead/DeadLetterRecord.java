package taskqueue.dead;

import taskqueue.Task;

import java.time.Instant;
import java.util.Objects;

/**
 * A permanently failed task together with the reason and the time it was dead-lettered.
 * The retry count and last error are copied from the task when the record is created,
 * so later changes to the task do not show through.
 *
 * @param task           the failed task
 * @param reason         terminal failure reason
 * @param deadLetteredAt when the task entered the sink
 * @param retryCount     failed attempts at dead-letter time
 * @param lastError      the last attempt's failure reason at dead-letter time, or {@code null}
 */
public record DeadLetterRecord(
    Task task, String reason, Instant deadLetteredAt, int retryCount, String lastError) {
  public static final String MAX_RETRIES_EXCEEDED = "max retries exceeded";

  public DeadLetterRecord {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(reason, "reason");
    Objects.requireNonNull(deadLetteredAt, "deadLetteredAt");
  }

  /**
   * Creates a record from the task's current retry count and last error.
   *
   * @param task           the failed task
   * @param reason         terminal failure reason
   * @param deadLetteredAt when the task entered the sink
   * @return the new record
   */
  public static DeadLetterRecord of(Task task, String reason, Instant deadLetteredAt) {
    Objects.requireNonNull(task, "task");
    return new DeadLetterRecord(task, reason, deadLetteredAt, task.retryCount(), task.lastError());
  }

  public String taskId() {
    return task.id();
  }

  public String taskType() {
    return task.taskType();
  }
}
