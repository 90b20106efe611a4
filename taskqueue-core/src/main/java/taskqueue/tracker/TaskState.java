package taskqueue.tracker;

/**
 * Where a live task currently sits. A task is in exactly one state at a time.
 */
public enum TaskState {
  /** Waiting in a priority lane. */
  QUEUED,
  /** Owned by a worker. */
  RUNNING,
  /** Waiting in the retry scheduler, either for a retry or a delayed first run. */
  RETRY_SCHEDULED,
  /** Terminal; held by the dead-letter sink. */
  DEAD_LETTERED
}
