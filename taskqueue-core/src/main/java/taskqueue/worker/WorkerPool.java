package taskqueue.worker;

import taskqueue.QueueCounters;
import taskqueue.Task;
import taskqueue.TaskHandler;
import taskqueue.TaskInvariantViolationException;
import taskqueue.TaskResult;
import taskqueue.queue.PriorityLanes;
import taskqueue.registry.HandlerRegistry;
import taskqueue.retry.RetryScheduler;
import taskqueue.tracker.TaskState;
import taskqueue.tracker.TaskTracker;
import taskqueue.util.DaemonThreadFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fixed set of worker threads that take tasks from the {@link PriorityLanes} and run them.
 *
 * <p>Each worker waits on the lanes for at most {@code idleWait}, runs the
 * {@link TaskInterceptor interceptors} and the handler for the task's type, then reports
 * the outcome: success completes the task, any failure is handed to the
 * {@link RetryScheduler}. The handler itself runs on a separate executor so that
 * {@code handlerTimeout} can be enforced; a handler that overruns is interrupted and the
 * attempt counts as a retryable failure.
 *
 * <p>Shutdown is cooperative. After {@link #stop()} workers finish their in-flight task
 * and exit; queued tasks are not drained. {@link #awaitTermination(Duration)} falls back to
 * interrupting workers and handlers when the timeout expires.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class WorkerPool {
  private static final Logger logger = Logger.getLogger(WorkerPool.class.getName());

  private final PriorityLanes lanes;
  private final HandlerRegistry handlerRegistry;
  private final RetryScheduler retryScheduler;
  private final TaskTracker tracker;
  private final QueueCounters counters;
  private final List<TaskInterceptor> interceptors;
  private final Consumer<TaskInvariantViolationException> onViolation;
  private final int workerCount;
  private final Duration handlerTimeout;
  private final Duration idleWait;

  private final AtomicBoolean started = new AtomicBoolean();
  private final AtomicBoolean running = new AtomicBoolean(true);
  private final AtomicInteger liveWorkers = new AtomicInteger();
  private final List<WorkerState> workerStates;
  private final ExecutorService workers;
  private final ExecutorService handlers;

  private WorkerPool(Builder builder) {
    this.lanes = Objects.requireNonNull(builder.lanes, "lanes");
    this.handlerRegistry = Objects.requireNonNull(builder.handlerRegistry, "handlerRegistry");
    this.retryScheduler = Objects.requireNonNull(builder.retryScheduler, "retryScheduler");
    this.tracker = Objects.requireNonNull(builder.tracker, "tracker");
    this.counters = builder.counters != null ? builder.counters : new QueueCounters();
    this.interceptors = Collections.unmodifiableList(new ArrayList<>(builder.interceptors));
    this.onViolation = builder.onViolation != null ? builder.onViolation : e -> { };
    this.handlerTimeout = Objects.requireNonNull(builder.handlerTimeout, "handlerTimeout");
    this.idleWait = Objects.requireNonNull(builder.idleWait, "idleWait");

    if (builder.workerCount < 1) {
      throw new IllegalArgumentException("workerCount must be >= 1");
    }
    if (handlerTimeout.isNegative() || handlerTimeout.isZero()) {
      throw new IllegalArgumentException("handlerTimeout must be > 0");
    }
    if (idleWait.isNegative() || idleWait.isZero()) {
      throw new IllegalArgumentException("idleWait must be > 0");
    }
    this.workerCount = builder.workerCount;

    List<WorkerState> states = new ArrayList<>(workerCount);
    for (int i = 1; i <= workerCount; i++) {
      states.add(new WorkerState("worker-" + i));
    }
    this.workerStates = Collections.unmodifiableList(states);
    this.workers = Executors.newFixedThreadPool(workerCount, new DaemonThreadFactory("taskqueue-worker-"));
    this.handlers = Executors.newCachedThreadPool(new DaemonThreadFactory("taskqueue-handler-"));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts all worker threads. Subsequent calls are no-ops.
   *
   * @throws IllegalStateException if the pool has been stopped
   */
  public void start() {
    if (!running.get()) {
      throw new IllegalStateException("WorkerPool has been stopped");
    }
    if (!started.compareAndSet(false, true)) {
      return;
    }
    for (WorkerState state : workerStates) {
      workers.submit(() -> workerLoop(state));
    }
  }

  private void workerLoop(WorkerState state) {
    liveWorkers.incrementAndGet();
    try {
      while (running.get() && !Thread.currentThread().isInterrupted()) {
        try {
          Task task = lanes.poll(idleWait.toNanos(), TimeUnit.NANOSECONDS);
          if (task == null) {
            continue;
          }
          execute(state, task);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        } catch (TaskInvariantViolationException e) {
          onViolation.accept(e);
          return;
        } catch (Throwable t) {
          logger.log(Level.SEVERE, "Worker loop error", t);
        }
      }
    } finally {
      liveWorkers.decrementAndGet();
    }
  }

  private void execute(WorkerState state, Task task) throws InterruptedException {
    state.begin(task.id());
    boolean success = false;
    try {
      success = handOff(task, attempt(task));
    } finally {
      state.end(success);
    }
  }

  /**
   * Passes a finished task on to its next owner. A task whose hand-off breaks part way
   * would stay {@link TaskState#RUNNING} forever, so any failure here is an invariant
   * violation.
   */
  private boolean handOff(Task task, TaskResult result) {
    try {
      if (result instanceof TaskResult.RetryableFailure retryable) {
        retryScheduler.onFailure(task, retryable.reason(), false);
        return false;
      }
      if (result instanceof TaskResult.PermanentFailure permanent) {
        retryScheduler.onFailure(task, permanent.reason(), true);
        return false;
      }
      tracker.complete(task.id(), TaskState.RUNNING);
      counters.recordProcessed();
      return true;
    } catch (TaskInvariantViolationException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new TaskInvariantViolationException("Hand-off of task " + task.id() + " failed", e);
    }
  }

  private TaskResult attempt(Task task) throws InterruptedException {
    int completedBefore = 0;
    TaskResult result;
    try {
      for (int i = 0; i < interceptors.size(); i++) {
        interceptors.get(i).beforeExecute(task);
        completedBefore = i + 1;
      }
      TaskHandler handler = handlerRegistry.handlerFor(task.taskType());
      if (handler == null) {
        result = TaskResult.retry("no handler registered for task type '" + task.taskType() + "'");
      } else {
        result = invoke(handler, task);
      }
    } catch (InterruptedException e) {
      throw e;
    } catch (Exception e) {
      result = TaskResult.retry(reasonOf(e));
    }
    runAfterExecute(task, result, completedBefore);
    return result;
  }

  private TaskResult invoke(TaskHandler handler, Task task) throws InterruptedException {
    long start = System.nanoTime();
    Future<TaskResult> future = handlers.submit(() -> handler.handle(task.payload()));
    try {
      TaskResult result = future.get(handlerTimeout.toNanos(), TimeUnit.NANOSECONDS);
      return result == null ? TaskResult.success() : result;
    } catch (TimeoutException e) {
      future.cancel(true);
      return TaskResult.retry("handler timed out after " + handlerTimeout);
    } catch (ExecutionException e) {
      return TaskResult.retry(reasonOf(e.getCause()));
    } catch (InterruptedException e) {
      future.cancel(true);
      throw e;
    } finally {
      counters.metrics().recordHandlerDurationMs(
          TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
    }
  }

  private void runAfterExecute(Task task, TaskResult result, int count) {
    for (int i = count - 1; i >= 0; i--) {
      try {
        interceptors.get(i).afterExecute(task, result);
      } catch (Exception ex) {
        logger.log(Level.WARNING, "Interceptor afterExecute failed", ex);
      }
    }
  }

  private static String reasonOf(Throwable error) {
    String message = error.getMessage();
    return message == null || message.isEmpty() ? error.getClass().getName() : message;
  }

  /**
   * Asks workers to exit after their current task. Does not wait.
   */
  public void stop() {
    running.set(false);
  }

  /**
   * Stops the workers and waits for them to exit.
   *
   * <p>If the timeout expires, remaining workers and their handlers are interrupted. A task
   * interrupted that way is left in flight.
   *
   * @param timeout how long to wait for a cooperative exit
   * @return {@code true} if all workers exited within the timeout
   */
  public boolean awaitTermination(Duration timeout) {
    stop();
    workers.shutdown();
    try {
      if (workers.awaitTermination(timeout.toNanos(), TimeUnit.NANOSECONDS)) {
        handlers.shutdown();
        return true;
      }
      logger.log(Level.WARNING, "Worker shutdown timeout exceeded; interrupting "
          + inFlight() + " in-flight task(s)");
      workers.shutdownNow();
      handlers.shutdownNow();
      workers.awaitTermination(5, TimeUnit.SECONDS);
      return false;
    } catch (InterruptedException e) {
      workers.shutdownNow();
      handlers.shutdownNow();
      Thread.currentThread().interrupt();
      return false;
    }
  }

  public boolean isRunning() {
    return started.get() && running.get();
  }

  public int workerCount() {
    return workerCount;
  }

  public int liveWorkers() {
    return liveWorkers.get();
  }

  /**
   * Returns the number of tasks currently executing.
   *
   * @return busy worker count
   */
  public int inFlight() {
    int busy = 0;
    for (WorkerState state : workerStates) {
      if (state.currentTaskId != null) {
        busy++;
      }
    }
    return busy;
  }

  /**
   * Returns a snapshot of every worker, in worker id order.
   *
   * @return per-worker statistics
   */
  public List<WorkerStats> stats() {
    List<WorkerStats> result = new ArrayList<>(workerStates.size());
    for (WorkerState state : workerStates) {
      result.add(state.snapshot());
    }
    return Collections.unmodifiableList(result);
  }

  private static final class WorkerState {
    private final String workerId;
    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private volatile String currentTaskId;
    private volatile Instant lastActivity;

    private WorkerState(String workerId) {
      this.workerId = workerId;
    }

    void begin(String taskId) {
      currentTaskId = taskId;
      lastActivity = Instant.now();
    }

    void end(boolean success) {
      if (success) {
        processed.incrementAndGet();
      } else {
        failed.incrementAndGet();
      }
      currentTaskId = null;
      lastActivity = Instant.now();
    }

    WorkerStats snapshot() {
      return new WorkerStats(workerId, processed.get(), failed.get(), currentTaskId, lastActivity);
    }
  }

  /** Builder for {@link WorkerPool}. */
  public static final class Builder {
    private PriorityLanes lanes;
    private HandlerRegistry handlerRegistry;
    private RetryScheduler retryScheduler;
    private TaskTracker tracker;
    private QueueCounters counters;
    private final List<TaskInterceptor> interceptors = new ArrayList<>();
    private Consumer<TaskInvariantViolationException> onViolation;
    private int workerCount = 4;
    private Duration handlerTimeout = Duration.ofSeconds(30);
    private Duration idleWait = Duration.ofMillis(100);

    private Builder() {}

    /**
     * Sets the lanes workers take tasks from.
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
     * Sets the scheduler that receives failed tasks.
     *
     * <p><b>Required.</b>
     *
     * @param retryScheduler the retry scheduler
     * @return this builder
     */
    public Builder retryScheduler(RetryScheduler retryScheduler) {
      this.retryScheduler = retryScheduler;
      return this;
    }

    /**
     * Sets the location tracker.
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
     * Adds an interceptor. Interceptors run in the order added.
     *
     * @param interceptor the interceptor
     * @return this builder
     */
    public Builder interceptor(TaskInterceptor interceptor) {
      this.interceptors.add(Objects.requireNonNull(interceptor, "interceptor"));
      return this;
    }

    public Builder interceptors(List<TaskInterceptor> interceptors) {
      interceptors.forEach(this::interceptor);
      return this;
    }

    /**
     * Sets the callback invoked when a worker detects corrupted bookkeeping.
     *
     * <p>Optional. The reporting worker exits in either case.
     *
     * @param onViolation the callback
     * @return this builder
     */
    public Builder onViolation(Consumer<TaskInvariantViolationException> onViolation) {
      this.onViolation = onViolation;
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
     * Sets the maximum time a single handler call may take.
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

    /**
     * Sets how long an idle worker waits for a task before re-checking for shutdown.
     *
     * <p>Optional. Defaults to 100 milliseconds.
     *
     * @param idleWait the idle wait
     * @return this builder
     */
    public Builder idleWait(Duration idleWait) {
      this.idleWait = idleWait;
      return this;
    }

    /**
     * Builds the pool. Call {@link WorkerPool#start()} to start the workers.
     *
     * @return a new {@link WorkerPool}
     * @throws NullPointerException     if a required collaborator is missing
     * @throws IllegalArgumentException if a numeric setting is out of range
     */
    public WorkerPool build() {
      return new WorkerPool(this);
    }
  }
}
