package taskqueue.dead;

import taskqueue.Task;
import taskqueue.tracker.TaskState;
import taskqueue.tracker.TaskTracker;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Append-only, in-memory store for tasks that exhausted their retries or failed
 * permanently. Records stay until an operator drains or resubmits them.
 *
 * <p>Nothing leaves the sink automatically. Resubmission is an explicit caller action
 * (see {@link taskqueue.TaskQueue#resubmit(String)}) that creates a brand-new task.
 *
 * <p>Listing methods return immutable snapshots, oldest first, so iteration can be
 * restarted freely. This class is thread-safe.
 */
public final class DeadLetterSink {
  private static final Logger logger = Logger.getLogger(DeadLetterSink.class.getName());

  private final Map<String, DeadLetterRecord> records = new LinkedHashMap<>();
  private final TaskTracker tracker;
  private final Clock clock;

  public DeadLetterSink(TaskTracker tracker) {
    this(tracker, Clock.systemUTC());
  }

  public DeadLetterSink(TaskTracker tracker, Clock clock) {
    this.tracker = Objects.requireNonNull(tracker, "tracker");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Takes ownership of a failed task from the worker that ran it.
   *
   * @param task   the task, currently tracked as {@link TaskState#RUNNING}
   * @param reason terminal failure reason
   * @return the new record
   * @throws taskqueue.TaskInvariantViolationException if the task is not running
   *     or already dead-lettered
   */
  public DeadLetterRecord add(Task task, String reason) {
    DeadLetterRecord record = DeadLetterRecord.of(task, reason, clock.instant());
    synchronized (records) {
      tracker.transition(task.id(), TaskState.RUNNING, TaskState.DEAD_LETTERED);
      records.put(task.id(), record);
    }
    logger.log(Level.SEVERE, "Task {0} ({1}) dead-lettered after {2} retries: {3}",
        new Object[]{task.id(), task.taskType(), record.retryCount(), reason});
    return record;
  }

  /**
   * Lists every dead-letter record.
   *
   * @return immutable snapshot, oldest first
   */
  public List<DeadLetterRecord> list() {
    synchronized (records) {
      return List.copyOf(records.values());
    }
  }

  /**
   * Lists dead-letter records with an optional task type filter.
   *
   * @param taskType optional task type filter ({@code null} for all)
   * @param limit    maximum number of records to return
   * @return immutable snapshot, oldest first
   */
  public List<DeadLetterRecord> list(String taskType, int limit) {
    if (limit < 0) {
      throw new IllegalArgumentException("limit must be >= 0, got: " + limit);
    }
    List<DeadLetterRecord> result = new ArrayList<>();
    synchronized (records) {
      for (DeadLetterRecord record : records.values()) {
        if (result.size() >= limit) {
          break;
        }
        if (taskType == null || taskType.equals(record.taskType())) {
          result.add(record);
        }
      }
    }
    return List.copyOf(result);
  }

  public Optional<DeadLetterRecord> find(String taskId) {
    synchronized (records) {
      return Optional.ofNullable(records.get(taskId));
    }
  }

  public int count() {
    synchronized (records) {
      return records.size();
    }
  }

  /**
   * Removes a single record, for example before resubmitting its task.
   *
   * @param taskId the task id
   * @return the removed record, or empty if none matched
   */
  public Optional<DeadLetterRecord> remove(String taskId) {
    synchronized (records) {
      DeadLetterRecord removed = records.remove(taskId);
      if (removed != null) {
        tracker.forgetDeadLettered(taskId);
      }
      return Optional.ofNullable(removed);
    }
  }

  /**
   * Removes and returns every record.
   *
   * @return the drained records, oldest first
   */
  public List<DeadLetterRecord> drain() {
    synchronized (records) {
      List<DeadLetterRecord> drained = new ArrayList<>(records.size());
      Iterator<DeadLetterRecord> it = records.values().iterator();
      while (it.hasNext()) {
        DeadLetterRecord record = it.next();
        it.remove();
        tracker.forgetDeadLettered(record.taskId());
        drained.add(record);
      }
      return drained;
    }
  }
}
