package taskqueue.retry;

import taskqueue.Priority;
import taskqueue.QueueCounters;
import taskqueue.QueueShutdownException;
import taskqueue.Task;
import taskqueue.TaskInvariantViolationException;
import taskqueue.dead.DeadLetterRecord;
import taskqueue.dead.DeadLetterSink;
import taskqueue.queue.PriorityLanes;
import taskqueue.tracker.TaskState;
import taskqueue.tracker.TaskTracker;
import taskqueue.util.DaemonThreadFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Decides what happens to a failed task and holds tasks until their retry time.
 *
 * <p>On {@link #onFailure failure} the task's retry count is advanced. While it stays within
 * {@code maxRetries}, the task is parked in a min-heap keyed by {@code readyAt = now + delay},
 * where the delay comes from the {@link RetryPolicy}. Once the count exceeds
 * {@code maxRetries}, or the handler reported a permanent failure, the task goes to the
 * {@link DeadLetterSink}.
 *
 * <p>A single daemon thread releases due entries back into their original lane. It sleeps
 * on a condition until the earliest deadline and is woken early when a new entry arrives.
 * This is the only way a failed task re-enters the lanes. Releasing never waits for space:
 * a due entry whose lane is full stays in the heap, still cancellable and counted as
 * retry-pending, while due entries for other lanes go ahead. The blocked lane is retried
 * as soon as the lanes report a free slot in it.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class RetryScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(RetryScheduler.class.getName());

  private static final Duration MAX_WAIT = Duration.ofHours(1);

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition changed = lock.newCondition();
  private final PriorityQueue<RetryEntry> heap = new PriorityQueue<>();
  private final EnumSet<Priority> blocked = EnumSet.noneOf(Priority.class);
  private final AtomicLong sequence = new AtomicLong();

  private final PriorityLanes lanes;
  private final TaskTracker tracker;
  private final DeadLetterSink deadLetters;
  private final RetryPolicy retryPolicy;
  private final QueueCounters counters;
  private final Consumer<TaskInvariantViolationException> onViolation;

  private ExecutorService releaser;
  private boolean closed;

  private RetryScheduler(Builder builder) {
    this.lanes = Objects.requireNonNull(builder.lanes, "lanes");
    this.tracker = Objects.requireNonNull(builder.tracker, "tracker");
    this.deadLetters = Objects.requireNonNull(builder.deadLetters, "deadLetters");
    this.retryPolicy = builder.retryPolicy != null
        ? builder.retryPolicy : new ExponentialBackoffRetryPolicy();
    this.counters = builder.counters != null ? builder.counters : new QueueCounters();
    this.onViolation = builder.onViolation != null ? builder.onViolation : e -> { };
    lanes.onSpaceFreed(this::laneFreed);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the release thread. Subsequent calls are no-ops if already started.
   *
   * @throws IllegalStateException if the scheduler has been closed
   */
  public void start() {
    lock.lock();
    try {
      if (closed) {
        throw new IllegalStateException("RetryScheduler has been closed");
      }
      if (releaser != null) {
        return;
      }
      releaser = Executors.newSingleThreadExecutor(new DaemonThreadFactory("taskqueue-retry-"));
      releaser.submit(this::releaseLoop);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Applies the retry decision to a task whose attempt just failed.
   *
   * @param task      the task, currently {@link TaskState#RUNNING}
   * @param reason    why the attempt failed
   * @param permanent {@code true} to dead-letter regardless of the retry budget
   * @return {@code true} if the task was scheduled for retry, {@code false} if dead-lettered
   */
  public boolean onFailure(Task task, String reason, boolean permanent) {
    counters.recordFailed();
    int retryCount = task.recordFailure(reason);
    if (permanent) {
      deadLetter(task, reason);
      return false;
    }
    if (retryCount > task.maxRetries()) {
      deadLetter(task, DeadLetterRecord.MAX_RETRIES_EXCEEDED);
      return false;
    }
    long delayMs = retryPolicy.computeDelayMs(retryCount);
    insert(task, TaskState.RUNNING, Instant.now().plusMillis(delayMs));
    counters.recordRetried();
    logger.log(Level.FINE, "Task {0} failed ({1}); retry {2}/{3} in {4} ms",
        new Object[]{task.id(), reason, retryCount, task.maxRetries(), delayMs});
    return true;
  }

  private void deadLetter(Task task, String reason) {
    deadLetters.add(task, reason);
    counters.recordDeadLettered();
  }

  /**
   * Holds a new task until {@code readyAt}, then releases it into its lane.
   *
   * @param task    a task that is not tracked yet
   * @param readyAt earliest time the task may run
   * @throws QueueShutdownException if the scheduler has been closed
   */
  public void schedule(Task task, Instant readyAt) {
    Objects.requireNonNull(readyAt, "readyAt");
    insert(task, null, readyAt);
  }

  private void insert(Task task, TaskState from, Instant readyAt) {
    RetryEntry entry = new RetryEntry(task, readyAt, sequence.getAndIncrement());
    lock.lock();
    try {
      // failed tasks are always accepted so they count as remaining after shutdown
      if (from == null) {
        if (closed) {
          throw new QueueShutdownException("Queue is shut down");
        }
        tracker.register(task.id(), TaskState.RETRY_SCHEDULED);
      } else {
        tracker.transition(task.id(), from, TaskState.RETRY_SCHEDULED);
      }
      heap.add(entry);
      changed.signal();
      counters.metrics().recordRetryPending(heap.size());
    } finally {
      lock.unlock();
    }
  }

  private void releaseLoop() {
    try {
      lock.lockInterruptibly();
      try {
        while (!closed) {
          Instant now = Instant.now();
          Instant next = releaseDue(now);
          if (next == null) {
            changed.await();
          } else {
            Duration wait = Duration.between(now, next);
            changed.awaitNanos(wait.compareTo(MAX_WAIT) > 0 ? MAX_WAIT.toNanos() : wait.toNanos());
          }
        }
      } finally {
        lock.unlock();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } catch (QueueShutdownException e) {
      // lanes only close on shutdown; entries stay counted as remaining
      logger.log(Level.FINE, "Lanes closed; retry release thread exiting");
    } catch (TaskInvariantViolationException e) {
      onViolation.accept(e);
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Retry release loop error", t);
    }
  }

  /**
   * Moves every due entry whose lane has room into the lanes. Entries for full lanes are
   * put back. Runs with the lock held.
   *
   * @return the earliest deadline still in the future, or {@code null} if none
   * @throws QueueShutdownException if the lanes were closed; the head entry stays here
   */
  private Instant releaseDue(Instant now) {
    blocked.clear();
    List<RetryEntry> deferred = new ArrayList<>();
    try {
      RetryEntry head;
      while ((head = heap.peek()) != null && head.isDue(now)) {
        Priority priority = head.task().priority();
        if (!blocked.contains(priority) && lanes.requeue(head.task())) {
          heap.poll();
        } else {
          blocked.add(priority);
          deferred.add(heap.poll());
        }
      }
    } finally {
      heap.addAll(deferred);
      counters.metrics().recordRetryPending(heap.size());
    }
    Instant next = null;
    for (RetryEntry entry : heap) {
      if (!entry.isDue(now) && (next == null || entry.readyAt().isBefore(next))) {
        next = entry.readyAt();
      }
    }
    return next;
  }

  private void laneFreed(Priority priority) {
    lock.lock();
    try {
      if (blocked.contains(priority)) {
        changed.signal();
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Removes a waiting task, for example when it is cancelled.
   *
   * @param taskId the task id
   * @return the removed task, or empty if it is not waiting here
   */
  public Optional<Task> remove(String taskId) {
    lock.lock();
    try {
      Iterator<RetryEntry> it = heap.iterator();
      while (it.hasNext()) {
        RetryEntry entry = it.next();
        if (entry.task().id().equals(taskId)) {
          it.remove();
          tracker.complete(taskId, TaskState.RETRY_SCHEDULED);
          changed.signal();
          counters.metrics().recordRetryPending(heap.size());
          return Optional.of(entry.task());
        }
      }
      return Optional.empty();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Removes every waiting task and stops tracking it. Intended for persisting leftovers
   * after shutdown.
   *
   * @param sink receives the removed tasks in deadline order
   * @return the number of tasks removed
   */
  public int drainTo(List<Task> sink) {
    lock.lock();
    try {
      int drained = 0;
      RetryEntry entry;
      while ((entry = heap.poll()) != null) {
        tracker.complete(entry.task().id(), TaskState.RETRY_SCHEDULED);
        sink.add(entry.task());
        drained++;
      }
      counters.metrics().recordRetryPending(0);
      return drained;
    } finally {
      lock.unlock();
    }
  }

  public int size() {
    lock.lock();
    try {
      return heap.size();
    } finally {
      lock.unlock();
    }
  }

  public RetryPolicy retryPolicy() {
    return retryPolicy;
  }

  /**
   * Stops the release thread. Entries still waiting stay in the heap. Idempotent.
   */
  @Override
  public void close() {
    ExecutorService toStop = stop();
    if (toStop == null) {
      return;
    }
    toStop.shutdown();
    try {
      if (!toStop.awaitTermination(5, TimeUnit.SECONDS)) {
        logger.log(Level.WARNING, "Retry release thread did not stop in time; interrupting");
        toStop.shutdownNow();
      }
    } catch (InterruptedException e) {
      toStop.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  /**
   * Asks the release thread to exit without waiting for it. Safe to call from the
   * release thread itself. New delayed tasks are rejected afterwards.
   *
   * @return the release executor, or {@code null} if never started
   */
  private ExecutorService stop() {
    lock.lock();
    try {
      closed = true;
      changed.signalAll();
      return releaser;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Stops the release thread without waiting. Used when the queue aborts.
   */
  public void abort() {
    stop();
  }

  /** Builder for {@link RetryScheduler}. */
  public static final class Builder {
    private PriorityLanes lanes;
    private TaskTracker tracker;
    private DeadLetterSink deadLetters;
    private RetryPolicy retryPolicy;
    private QueueCounters counters;
    private Consumer<TaskInvariantViolationException> onViolation;

    private Builder() {}

    /**
     * Sets the lanes that due tasks are released into.
     *
     * <p><b>Required.</b>
     *
     * @param lanes the priority lanes
     * @return this builder
     */
    public Builder lanes(PriorityLanes lanes) {
      this.lanes = lanes;
      return this;
    }

    /**
     * Sets the location tracker shared with the lanes and the sink.
     *
     * <p><b>Required.</b>
     *
     * @param tracker the tracker
     * @return this builder
     */
    public Builder tracker(TaskTracker tracker) {
      this.tracker = tracker;
      return this;
    }

    /**
     * Sets where exhausted tasks go.
     *
     * <p><b>Required.</b>
     *
     * @param deadLetters the dead-letter sink
     * @return this builder
     */
    public Builder deadLetters(DeadLetterSink deadLetters) {
      this.deadLetters = deadLetters;
      return this;
    }

    /**
     * Sets the backoff policy.
     *
     * <p>Optional. Defaults to {@link ExponentialBackoffRetryPolicy} with a 1 second base
     * and a 300 second cap.
     *
     * @param retryPolicy the retry policy
     * @return this builder
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Sets the shared outcome counters.
     *
     * <p>Optional. Defaults to a private instance.
     *
     * @param counters the counters
     * @return this builder
     */
    public Builder counters(QueueCounters counters) {
      this.counters = counters;
      return this;
    }

    /**
     * Sets the callback invoked when the release thread hits corrupted bookkeeping.
     *
     * <p>Optional. The release thread stops in either case.
     *
     * @param onViolation the callback
     * @return this builder
     */
    public Builder onViolation(Consumer<TaskInvariantViolationException> onViolation) {
      this.onViolation = onViolation;
      return this;
    }

    /**
     * Builds the scheduler. Call {@link RetryScheduler#start()} to begin releasing.
     *
     * @return a new {@link RetryScheduler}
     * @throws NullPointerException if {@code lanes}, {@code tracker} or {@code deadLetters} is null
     */
    public RetryScheduler build() {
      return new RetryScheduler(this);
    }
  }
}
