package taskqueue.worker;

import java.time.Instant;

/**
 * Snapshot of one worker thread's activity.
 *
 * @param workerId      stable worker name, for example {@code worker-1}
 * @param processed     attempts that ended in success
 * @param failed        attempts that ended in failure of any kind
 * @param currentTaskId id of the task being executed, or {@code null} when idle
 * @param lastActivity  when the worker last started or finished a task, or {@code null}
 */
public record WorkerStats(
    String workerId,
    long processed,
    long failed,
    String currentTaskId,
    Instant lastActivity) {

  public boolean isBusy() {
    return currentTaskId != null;
  }
}
