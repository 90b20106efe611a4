package taskqueue;

import taskqueue.classify.PriorityClassifier;
import taskqueue.dead.DeadLetterRecord;
import taskqueue.dead.DeadLetterSink;
import taskqueue.queue.PriorityLanes;
import taskqueue.registry.HandlerRegistry;
import taskqueue.retry.ExponentialBackoffRetryPolicy;
import taskqueue.retry.RetryPolicy;
import taskqueue.retry.RetryScheduler;
import taskqueue.spi.MetricsExporter;
import taskqueue.tracker.TaskState;
import taskqueue.tracker.TaskTracker;
import taskqueue.worker.TaskInterceptor;
import taskqueue.worker.WorkerPool;
import taskqueue.worker.WorkerStats;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point that wires the {@link PriorityLanes}, {@link WorkerPool},
 * {@link RetryScheduler} and {@link DeadLetterSink} into a single {@link AutoCloseable} unit.
 *
 * <p>Producers call {@link #enqueue(String, Object, Priority, int) enqueue}; the call may
 * block while the task's lane is full. Workers run tasks in strict priority order. Failed
 * tasks come back after an exponential backoff until their retry budget is spent, then
 * land in the dead-letter sink, where an operator can list or {@link #resubmit resubmit}
 * them.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * DefaultHandlerRegistry handlers = new DefaultHandlerRegistry()
 *     .register("charge", payload -> billing.charge((Charge) payload));
 *
 * try (TaskQueue queue = TaskQueue.builder()
 *     .handlerRegistry(handlers)
 *     .workerCount(8)
 *     .capacity(Priority.LOW, 10_000)
 *     .build()) {
 *   queue.start();
 *   queue.enqueue("charge", charge, Priority.HIGH, 5);
 * }
 * }</pre>
 *
 * <p>If any component detects corrupted bookkeeping (a task found in two places, a lane
 * over capacity) the queue aborts: it stops accepting tasks and every later enqueue fails
 * with a {@link QueueShutdownException} carrying the cause.
 *
 * @see TaskQueue.Builder
 */
public final class TaskQueue implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(TaskQueue.class.getName());

  private final TaskTracker tracker;
  private final PriorityLanes lanes;
  private final DeadLetterSink deadLetters;
  private final RetryScheduler retryScheduler;
  private final WorkerPool workerPool;
  private final QueueCounters counters;
  private final PriorityClassifier classifier;
  private final int defaultMaxRetries;
  private final Duration drainTimeout;

  private final AtomicBoolean started = new AtomicBoolean();
  private final AtomicBoolean shutdown = new AtomicBoolean();
  private final AtomicBoolean terminated = new AtomicBoolean();
  private final AtomicReference<Throwable> abortCause = new AtomicReference<>();

  private TaskQueue(Builder builder) {
    Objects.requireNonNull(builder.handlerRegistry, "handlerRegistry");
    if (builder.defaultMaxRetries < 0) {
      throw new IllegalArgumentException("defaultMaxRetries must be >= 0");
    }
    if (builder.drainTimeout.isNegative()) {
      throw new IllegalArgumentException("drainTimeout must be >= 0");
    }
    this.defaultMaxRetries = builder.defaultMaxRetries;
    this.drainTimeout = builder.drainTimeout;
    this.classifier = builder.classifier;
    this.counters = new QueueCounters(builder.metrics != null ? builder.metrics : MetricsExporter.NOOP);
    this.tracker = new TaskTracker();
    this.lanes = new PriorityLanes(builder.capacities, tracker, counters.metrics());
    this.deadLetters = new DeadLetterSink(tracker);
    this.retryScheduler = RetryScheduler.builder()
        .lanes(lanes)
        .tracker(tracker)
        .deadLetters(deadLetters)
        .retryPolicy(builder.retryPolicy != null
            ? builder.retryPolicy : new ExponentialBackoffRetryPolicy())
        .counters(counters)
        .onViolation(this::abort)
        .build();
    this.workerPool = WorkerPool.builder()
        .lanes(lanes)
        .handlerRegistry(builder.handlerRegistry)
        .retryScheduler(retryScheduler)
        .tracker(tracker)
        .counters(counters)
        .interceptors(builder.interceptors)
        .onViolation(this::abort)
        .workerCount(builder.workerCount)
        .handlerTimeout(builder.handlerTimeout)
        .idleWait(builder.idleWait)
        .build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the workers and the retry release thread. Subsequent calls are no-ops.
   *
   * @throws QueueShutdownException if the queue has been shut down
   */
  public void start() {
    if (shutdown.get()) {
      throw shutdownException();
    }
    if (!started.compareAndSet(false, true)) {
      return;
    }
    retryScheduler.start();
    workerPool.start();
    logger.log(Level.INFO, "Task queue started with {0} worker(s)", workerPool.workerCount());
  }

  /**
   * Enqueues a task. Blocks while the task's lane is full.
   *
   * @param taskType   selects the handler
   * @param payload    handler input, may be null
   * @param priority   the lane
   * @param maxRetries retries allowed after the first failed attempt, &ge; 0
   * @return the new task id
   * @throws QueueShutdownException if the queue is shut down or aborted
   * @throws InterruptedException   if interrupted while waiting for lane space
   */
  public String enqueue(String taskType, Object payload, Priority priority, int maxRetries)
      throws InterruptedException {
    ensureAccepting();
    Task task = Task.builder(taskType)
        .payload(payload)
        .priority(priority)
        .maxRetries(maxRetries)
        .build();
    submit(task);
    return task.id();
  }

  /**
   * Enqueues a task with the default retry budget.
   *
   * @see #enqueue(String, Object, Priority, int)
   */
  public String enqueue(String taskType, Object payload, Priority priority)
      throws InterruptedException {
    return enqueue(taskType, payload, priority, defaultMaxRetries);
  }

  /**
   * Enqueues a task whose priority is picked by the configured {@link PriorityClassifier}.
   *
   * @param attributes input to the classifier
   * @return the new task id
   * @throws IllegalStateException if no classifier is configured
   * @see #enqueue(String, Object, Priority, int)
   */
  public String enqueue(String taskType, Object payload, Map<String, ?> attributes)
      throws InterruptedException {
    if (classifier == null) {
      throw new IllegalStateException("No PriorityClassifier configured; pass a priority explicitly");
    }
    Priority priority = Objects.requireNonNull(
        classifier.classify(Objects.requireNonNull(attributes, "attributes")),
        "classifier returned null priority");
    return enqueue(taskType, payload, priority, defaultMaxRetries);
  }

  private void submit(Task task) throws InterruptedException {
    lanes.enqueue(task);
    counters.metrics().incrementEnqueued(task.priority());
  }

  /**
   * Enqueues a task that becomes eligible only after {@code delay}. Until then it waits in
   * the retry scheduler and counts as retry-pending.
   *
   * @param delay how long to hold the task, &ge; 0
   * @return the new task id
   * @throws QueueShutdownException if the queue is shut down or aborted
   * @throws InterruptedException   if {@code delay} is zero and the lane wait is interrupted
   */
  public String enqueueDelayed(String taskType, Object payload, Priority priority, Duration delay)
      throws InterruptedException {
    Objects.requireNonNull(delay, "delay");
    if (delay.isNegative()) {
      throw new IllegalArgumentException("delay must be >= 0");
    }
    if (delay.isZero()) {
      return enqueue(taskType, payload, priority);
    }
    ensureAccepting();
    Task task = Task.builder(taskType)
        .payload(payload)
        .priority(priority)
        .maxRetries(defaultMaxRetries)
        .build();
    retryScheduler.schedule(task, Instant.now().plus(delay));
    counters.metrics().incrementEnqueued(task.priority());
    return task.id();
  }

  /**
   * Removes a task that has not started yet. Running tasks cannot be cancelled.
   *
   * @param taskId the task id
   * @return {@code true} if the task was waiting in a lane or for a retry and is now gone
   */
  public boolean cancel(String taskId) {
    // retry entries only ever move into the lanes, so look there second
    Optional<Task> removed = retryScheduler.remove(taskId);
    if (removed.isEmpty()) {
      removed = lanes.remove(taskId);
    }
    removed.ifPresent(task -> logger.log(Level.FINE, "Cancelled task {0}", task.id()));
    return removed.isPresent();
  }

  /**
   * Returns where a task currently is.
   *
   * @param taskId the task id
   * @return the location, or empty if the task completed, was cancelled or is unknown
   */
  public Optional<TaskState> taskState(String taskId) {
    return tracker.stateOf(taskId);
  }

  /**
   * Returns a snapshot of lane sizes, pending counts and outcome counters.
   *
   * @return current statistics
   */
  public QueueStats stats() {
    return new QueueStats(
        lanes.sizes(),
        retryScheduler.size(),
        tracker.count(TaskState.RUNNING),
        deadLetters.count(),
        counters.processed(),
        counters.failed(),
        counters.retried(),
        counters.deadLettered());
  }

  /**
   * Returns every dead-letter record, oldest first.
   *
   * @return immutable snapshot
   */
  public List<DeadLetterRecord> listDeadLetters() {
    return deadLetters.list();
  }

  public DeadLetterSink deadLetters() {
    return deadLetters;
  }

  /**
   * Moves a dead-lettered task back into its lane as a brand-new task with a fresh id and
   * a reset retry count.
   *
   * @param taskId id of the dead-lettered task
   * @return the new task id, or empty if no record exists for {@code taskId}
   * @throws QueueShutdownException if the queue is shut down or aborted
   * @throws InterruptedException   if interrupted while waiting for lane space
   */
  public Optional<String> resubmit(String taskId) throws InterruptedException {
    ensureAccepting();
    Optional<DeadLetterRecord> record = deadLetters.remove(taskId);
    if (record.isEmpty()) {
      return Optional.empty();
    }
    Task copy = record.get().task().copyForResubmission();
    submit(copy);
    logger.log(Level.INFO, "Resubmitted dead-lettered task {0} as {1}",
        new Object[]{taskId, copy.id()});
    return Optional.of(copy.id());
  }

  public List<WorkerStats> workerStats() {
    return workerPool.stats();
  }

  /**
   * Reports whether the queue is running and how many workers are alive.
   *
   * @return health summary
   */
  public QueueHealth healthCheck() {
    return new QueueHealth(
        started.get() && !shutdown.get(),
        workerPool.liveWorkers(),
        workerPool.workerCount(),
        abortCause.get());
  }

  public boolean isShutdown() {
    return shutdown.get();
  }

  /**
   * Stops the queue and reports what was left undone.
   *
   * <p>The first call stops accepting tasks, wakes blocked producers, waits up to
   * {@code timeout} for workers to finish their current task and stops the retry release
   * thread. Queued and retry-pending tasks are not drained. Later calls only recount.
   *
   * @param timeout how long to wait for in-flight tasks
   * @return tasks still queued, waiting for a retry, or in flight
   */
  public int shutdown(Duration timeout) {
    Objects.requireNonNull(timeout, "timeout");
    shutdown.set(true);
    if (terminated.compareAndSet(false, true)) {
      lanes.close();
      boolean clean = workerPool.awaitTermination(timeout);
      retryScheduler.close();
      int remaining = remaining();
      logger.log(clean ? Level.INFO : Level.WARNING,
          "Task queue shut down; {0} task(s) left unprocessed", remaining);
      return remaining;
    }
    return remaining();
  }

  private int remaining() {
    Map<TaskState, Integer> counts = tracker.counts();
    return counts.get(TaskState.QUEUED)
        + counts.get(TaskState.RUNNING)
        + counts.get(TaskState.RETRY_SCHEDULED);
  }

  /**
   * Removes every task left in the lanes and the retry scheduler after shutdown, for
   * example to persist them elsewhere.
   *
   * @return the removed tasks, lanes first in priority order, then retry-pending tasks
   * @throws IllegalStateException if the queue is still running
   */
  public List<Task> drainPending() {
    if (!shutdown.get()) {
      throw new IllegalStateException("drainPending() requires a shut down queue");
    }
    List<Task> drained = new ArrayList<>();
    lanes.drainTo(drained);
    retryScheduler.drainTo(drained);
    return drained;
  }

  private void abort(TaskInvariantViolationException cause) {
    if (!abortCause.compareAndSet(null, cause)) {
      return;
    }
    logger.log(Level.SEVERE, "Task queue aborted on invariant violation", cause);
    shutdown.set(true);
    lanes.close(cause);
    workerPool.stop();
    retryScheduler.abort();
  }

  private void ensureAccepting() {
    if (shutdown.get()) {
      throw shutdownException();
    }
  }

  private QueueShutdownException shutdownException() {
    Throwable cause = abortCause.get();
    return cause == null
        ? new QueueShutdownException("Queue is shut down")
        : new QueueShutdownException("Queue aborted", cause);
  }

  /**
   * Shuts down with the configured drain timeout, then closes the metrics exporter if it
   * is {@link AutoCloseable}.
   */
  @Override
  public void close() {
    shutdown(drainTimeout);
    if (counters.metrics() instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        throw (e instanceof RuntimeException r) ? r : new RuntimeException(e);
      }
    }
  }

  /** Builder for {@link TaskQueue}. */
  public static final class Builder {
    private HandlerRegistry handlerRegistry;
    private final Map<Priority, Integer> capacities = new EnumMap<>(Priority.class);
    private RetryPolicy retryPolicy;
    private PriorityClassifier classifier;
    private MetricsExporter metrics;
    private final List<TaskInterceptor> interceptors = new ArrayList<>();
    private int workerCount = 4;
    private int defaultMaxRetries = Task.DEFAULT_MAX_RETRIES;
    private Duration handlerTimeout = Duration.ofSeconds(30);
    private Duration idleWait = Duration.ofMillis(100);
    private Duration drainTimeout = Duration.ofSeconds(5);
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {}

    /**
     * Sets the registry that maps task types to handlers.
     *
     * <p><b>Required.</b>
     *
     * @param handlerRegistry the handler registry
     * @return this builder
     */
    public Builder handlerRegistry(HandlerRegistry handlerRegistry) {
      this.handlerRegistry = handlerRegistry;
      return this;
    }

    /**
     * Sets the number of worker threads.
     *
     * <p>Optional. Defaults to {@code 4}. Must be &ge; 1.
     *
     * @param workerCount number of workers
     * @return this builder
     */
    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    /**
     * Bounds one lane. A full lane blocks producers until a worker takes a task from it.
     *
     * <p>Optional. Lanes are unbounded by default; {@code 0} also means unbounded.
     *
     * @param priority the lane
     * @param capacity maximum pending tasks, &ge; 0
     * @return this builder
     */
    public Builder capacity(Priority priority, int capacity) {
      this.capacities.put(Objects.requireNonNull(priority, "priority"), capacity);
      return this;
    }

    /**
     * Sets the backoff policy between attempts.
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
     * Sets the retry budget for enqueue calls that do not pass one.
     *
     * <p>Optional. Defaults to {@value Task#DEFAULT_MAX_RETRIES}.
     *
     * @param defaultMaxRetries retries after the first failed attempt
     * @return this builder
     */
    public Builder defaultMaxRetries(int defaultMaxRetries) {
      this.defaultMaxRetries = defaultMaxRetries;
      return this;
    }

    /**
     * Sets the maximum duration of a single handler call.
     *
     * <p>Optional. Defaults to 30 seconds.
     *
     * @param handlerTimeout the handler timeout
     * @return this builder
     */
    public Builder handlerTimeout(Duration handlerTimeout) {
      this.handlerTimeout = handlerTimeout;
      return this;
    }

    public Builder idleWait(Duration idleWait) {
      this.idleWait = idleWait;
      return this;
    }

    /**
     * Sets how long {@link TaskQueue#close()} waits for in-flight tasks.
     *
     * <p>Optional. Defaults to 5 seconds.
     *
     * @param drainTimeout the timeout
     * @return this builder
     */
    public Builder drainTimeout(Duration drainTimeout) {
      this.drainTimeout = Objects.requireNonNull(drainTimeout, "drainTimeout");
      return this;
    }

    /**
     * Sets the classifier used by {@link TaskQueue#enqueue(String, Object, Map)}.
     *
     * <p>Optional. Without one, producers must pass a priority.
     *
     * @param classifier the classifier
     * @return this builder
     */
    public Builder classifier(PriorityClassifier classifier) {
      this.classifier = classifier;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder interceptor(TaskInterceptor interceptor) {
      this.interceptors.add(Objects.requireNonNull(interceptor, "interceptor"));
      return this;
    }

    public Builder interceptors(List<TaskInterceptor> interceptors) {
      interceptors.forEach(this::interceptor);
      return this;
    }

    /**
     * Builds the queue. Call {@link TaskQueue#start()} to begin processing.
     *
     * @return a new {@link TaskQueue}
     * @throws NullPointerException     if {@code handlerRegistry} is null
     * @throws IllegalArgumentException if a numeric setting is out of range
     * @throws IllegalStateException    if this builder was already used
     */
    public TaskQueue build() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      return new TaskQueue(this);
    }
  }
}
