package taskqueue.queue;

import taskqueue.Priority;
import taskqueue.QueueShutdownException;
import taskqueue.Task;
import taskqueue.TaskInvariantViolationException;
import taskqueue.spi.MetricsExporter;
import taskqueue.tracker.TaskState;
import taskqueue.tracker.TaskTracker;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Bounded priority queue made of one FIFO lane per {@link Priority}.
 *
 * <p>{@link #dequeueNext()} and {@link #poll(long, TimeUnit)} always serve the head of the
 * highest-priority non-empty lane: every HIGH task goes before any MEDIUM task, and every
 * MEDIUM task before any LOW task. Inside a lane, arrival order is kept exactly. There is
 * no anti-starvation rule, so LOW tasks wait for as long as higher lanes stay busy.
 *
 * <p>A lane may be given a capacity. {@link #enqueue(Task)} blocks while the task's lane is
 * full and wakes as soon as a slot frees or the lanes are {@linkplain #close closed};
 * tasks are never dropped. A capacity of {@code 0} means unbounded.
 *
 * <p>All mutations happen under one lock. Insertions and removals also move the task
 * in the {@link TaskTracker} while that lock is held, so a task is never visible in a
 * lane and somewhere else at the same time. Every mutation also pushes the new lane
 * depths to the {@link MetricsExporter}.
 *
 * <p>This class is thread-safe.
 */
public final class PriorityLanes {
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition notEmpty = lock.newCondition();
  private final Map<Priority, ArrayDeque<Task>> lanes = new EnumMap<>(Priority.class);
  private final Map<Priority, Condition> notFull = new EnumMap<>(Priority.class);
  private final Map<Priority, Integer> capacities = new EnumMap<>(Priority.class);
  private final TaskTracker tracker;
  private final MetricsExporter metrics;

  private volatile Consumer<Priority> spaceListener = priority -> { };
  private boolean closed;
  private Throwable closeCause;

  /**
   * Creates unbounded lanes.
   *
   * @param tracker the location tracker shared with the rest of the queue
   */
  public PriorityLanes(TaskTracker tracker) {
    this(Collections.emptyMap(), tracker);
  }

  /**
   * Creates lanes with per-priority capacities. Missing entries are unbounded.
   *
   * @param capacities capacity per priority; {@code 0} means unbounded
   * @param tracker    the location tracker shared with the rest of the queue
   * @throws IllegalArgumentException if a capacity is negative
   */
  public PriorityLanes(Map<Priority, Integer> capacities, TaskTracker tracker) {
    this(capacities, tracker, MetricsExporter.NOOP);
  }

  /**
   * Creates lanes with per-priority capacities that report their depths.
   *
   * @param capacities capacity per priority; {@code 0} means unbounded
   * @param tracker    the location tracker shared with the rest of the queue
   * @param metrics    receives the lane depths after every change
   * @throws IllegalArgumentException if a capacity is negative
   */
  public PriorityLanes(Map<Priority, Integer> capacities, TaskTracker tracker, MetricsExporter metrics) {
    this.tracker = Objects.requireNonNull(tracker, "tracker");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    Objects.requireNonNull(capacities, "capacities");
    for (Priority priority : Priority.values()) {
      int capacity = capacities.getOrDefault(priority, 0);
      if (capacity < 0) {
        throw new IllegalArgumentException("capacity for " + priority + " must be >= 0, got: " + capacity);
      }
      this.capacities.put(priority, capacity);
      this.lanes.put(priority, new ArrayDeque<>());
      this.notFull.put(priority, lock.newCondition());
    }
  }

  /**
   * Appends a new task to the tail of its lane, blocking while the lane is full.
   *
   * @param task the task; must not be tracked yet
   * @throws QueueShutdownException  if the lanes are closed before or while waiting
   * @throws InterruptedException    if the caller is interrupted while waiting
   */
  public void enqueue(Task task) throws InterruptedException {
    insert(task, -1L);
  }

  /**
   * Appends a new task, waiting at most {@code timeout} for space in its lane.
   *
   * @return {@code true} if the task was added, {@code false} if the wait timed out
   * @throws QueueShutdownException if the lanes are closed before or while waiting
   * @throws InterruptedException   if the caller is interrupted while waiting
   */
  public boolean offer(Task task, long timeout, TimeUnit unit) throws InterruptedException {
    return insert(task, Math.max(0L, unit.toNanos(timeout)));
  }

  /**
   * Puts a task released by the retry scheduler back at the tail of its original lane.
   * Never waits: a full lane leaves the task where it is.
   *
   * @param task the task, currently tracked as {@link TaskState#RETRY_SCHEDULED}
   * @return {@code true} if the task was added, {@code false} if its lane is full
   * @throws QueueShutdownException if the lanes are closed
   */
  public boolean requeue(Task task) {
    Objects.requireNonNull(task, "task");
    Priority priority = task.priority();
    ArrayDeque<Task> lane = lanes.get(priority);
    lock.lock();
    try {
      if (closed) {
        throw shutdownException();
      }
      if (isFull(priority, lane)) {
        return false;
      }
      tracker.transition(task.id(), TaskState.RETRY_SCHEDULED, TaskState.QUEUED);
      append(priority, lane, task);
      return true;
    } finally {
      lock.unlock();
    }
  }

  private boolean insert(Task task, long timeoutNanos) throws InterruptedException {
    Objects.requireNonNull(task, "task");
    Priority priority = task.priority();
    ArrayDeque<Task> lane = lanes.get(priority);
    long nanos = timeoutNanos;

    lock.lockInterruptibly();
    try {
      while (!closed && isFull(priority, lane)) {
        if (timeoutNanos < 0) {
          notFull.get(priority).await();
        } else {
          if (nanos <= 0L) {
            return false;
          }
          nanos = notFull.get(priority).awaitNanos(nanos);
        }
      }
      if (closed) {
        throw shutdownException();
      }
      tracker.register(task.id(), TaskState.QUEUED);
      append(priority, lane, task);
      return true;
    } finally {
      lock.unlock();
    }
  }

  private boolean isFull(Priority priority, ArrayDeque<Task> lane) {
    int capacity = capacities.get(priority);
    return capacity > 0 && lane.size() >= capacity;
  }

  private void append(Priority priority, ArrayDeque<Task> lane, Task task) {
    lane.addLast(task);
    verifyCapacity(priority, lane);
    notEmpty.signal();
    recordDepths();
  }

  private QueueShutdownException shutdownException() {
    return closeCause == null
        ? new QueueShutdownException("Queue is shut down")
        : new QueueShutdownException("Queue aborted", closeCause);
  }

  /**
   * Registers the callback run after a task leaves a bounded lane. It is called on the
   * removing thread once the lock is released, so it may call back into these lanes.
   *
   * @param listener receives the priority of the lane that gained a free slot
   */
  public void onSpaceFreed(Consumer<Priority> listener) {
    this.spaceListener = Objects.requireNonNull(listener, "listener");
  }

  private void spaceFreed(Priority priority) {
    if (capacities.get(priority) > 0) {
      spaceListener.accept(priority);
    }
  }

  /**
   * Removes and returns the head of the highest-priority non-empty lane without waiting.
   * The task is handed to the caller as {@link TaskState#RUNNING}.
   *
   * @return the next task, or {@code null} if all lanes are empty
   */
  public Task dequeueNext() {
    Task task;
    lock.lock();
    try {
      task = takeHead();
    } finally {
      lock.unlock();
    }
    if (task != null) {
      spaceFreed(task.priority());
    }
    return task;
  }

  /**
   * Waits up to {@code timeout} for a task. Returns {@code null} right away once the
   * lanes are closed; tasks still queued then stay where they are.
   *
   * @return the next task, or {@code null} on timeout or close
   * @throws InterruptedException if interrupted while waiting
   */
  public Task poll(long timeout, TimeUnit unit) throws InterruptedException {
    long nanos = unit.toNanos(timeout);
    Task task = null;
    lock.lockInterruptibly();
    try {
      while (!closed) {
        task = takeHead();
        if (task != null || nanos <= 0L) {
          break;
        }
        nanos = notEmpty.awaitNanos(nanos);
      }
    } finally {
      lock.unlock();
    }
    if (task != null) {
      spaceFreed(task.priority());
    }
    return task;
  }

  private Task takeHead() {
    for (Priority priority : Priority.values()) {
      ArrayDeque<Task> lane = lanes.get(priority);
      Task task = lane.pollFirst();
      if (task != null) {
        tracker.transition(task.id(), TaskState.QUEUED, TaskState.RUNNING);
        notFull.get(priority).signal();
        recordDepths();
        return task;
      }
    }
    return null;
  }

  /**
   * Removes a pending task from whichever lane holds it.
   *
   * @param taskId the task id
   * @return the removed task, or empty if no lane holds it
   */
  public Optional<Task> remove(String taskId) {
    Task removed = null;
    lock.lock();
    try {
      for (Priority priority : Priority.values()) {
        Iterator<Task> it = lanes.get(priority).iterator();
        while (removed == null && it.hasNext()) {
          Task task = it.next();
          if (task.id().equals(taskId)) {
            it.remove();
            tracker.complete(taskId, TaskState.QUEUED);
            notFull.get(priority).signal();
            recordDepths();
            removed = task;
          }
        }
      }
    } finally {
      lock.unlock();
    }
    if (removed == null) {
      return Optional.empty();
    }
    spaceFreed(removed.priority());
    return Optional.of(removed);
  }

  /**
   * Removes every queued task, highest priority first, and stops tracking them.
   * Intended for persisting leftovers after shutdown.
   *
   * @param sink receives the removed tasks
   * @return the number of tasks removed
   */
  public int drainTo(List<Task> sink) {
    lock.lock();
    try {
      int drained = 0;
      for (Priority priority : Priority.values()) {
        ArrayDeque<Task> lane = lanes.get(priority);
        Task task;
        while ((task = lane.pollFirst()) != null) {
          tracker.complete(task.id(), TaskState.QUEUED);
          sink.add(task);
          drained++;
        }
        notFull.get(priority).signalAll();
      }
      recordDepths();
      return drained;
    } finally {
      lock.unlock();
    }
  }

  public int size(Priority priority) {
    lock.lock();
    try {
      return lanes.get(priority).size();
    } finally {
      lock.unlock();
    }
  }

  public int size() {
    lock.lock();
    try {
      int total = 0;
      for (ArrayDeque<Task> lane : lanes.values()) {
        total += lane.size();
      }
      return total;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns a consistent snapshot of all lane sizes.
   *
   * @return size per priority
   */
  public Map<Priority, Integer> sizes() {
    lock.lock();
    try {
      Map<Priority, Integer> sizes = new EnumMap<>(Priority.class);
      lanes.forEach((priority, lane) -> sizes.put(priority, lane.size()));
      return sizes;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the configured capacity of a lane.
   *
   * @return the capacity, {@code 0} if unbounded
   */
  public int capacity(Priority priority) {
    return capacities.get(priority);
  }

  public boolean isClosed() {
    lock.lock();
    try {
      return closed;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Closes the lanes. Blocked producers fail with {@link QueueShutdownException}, idle
   * consumers return {@code null}. Queued tasks stay in place. Idempotent.
   */
  public void close() {
    close(null);
  }

  /**
   * Closes the lanes, recording the reason reported to producers.
   *
   * @param cause the abort cause, or {@code null} for a regular shutdown
   */
  public void close(Throwable cause) {
    lock.lock();
    try {
      if (!closed) {
        closed = true;
        closeCause = cause;
      }
      notEmpty.signalAll();
      notFull.values().forEach(Condition::signalAll);
    } finally {
      lock.unlock();
    }
  }

  private void recordDepths() {
    metrics.recordLaneDepths(
        lanes.get(Priority.HIGH).size(),
        lanes.get(Priority.MEDIUM).size(),
        lanes.get(Priority.LOW).size());
  }

  private void verifyCapacity(Priority priority, ArrayDeque<Task> lane) {
    int capacity = capacities.get(priority);
    if (capacity > 0 && lane.size() > capacity) {
      throw new TaskInvariantViolationException(
          priority + " lane holds " + lane.size() + " tasks, capacity " + capacity);
    }
  }
}
