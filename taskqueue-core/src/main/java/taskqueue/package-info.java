/**
 * In-memory priority task queue with a worker pool, backoff retries and a dead-letter sink.
 *
 * <h2>Core Design</h2>
 * <p>Producers {@linkplain taskqueue.TaskQueue#enqueue(String, Object, taskqueue.Priority, int)
 * enqueue} tasks into one of three FIFO {@linkplain taskqueue.queue.PriorityLanes lanes}.
 * Workers always take from the highest non-empty lane. A failed attempt goes to the
 * {@linkplain taskqueue.retry.RetryScheduler retry scheduler}, which puts the task back
 * into its lane after an exponential backoff, or into the
 * {@linkplain taskqueue.dead.DeadLetterSink dead-letter sink} once its retry budget is spent.
 *
 * <p>Every live task is in exactly one place at a time. The
 * {@linkplain taskqueue.tracker.TaskTracker tracker} records that place and rejects any
 * hand-off that starts from the wrong one; such a violation aborts the queue.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>taskqueue-core</b>: lanes, workers, retries, dead letters (only dependency: ULID ids)</li>
 *   <li><b>taskqueue-micrometer</b>: Micrometer bridge for {@link taskqueue.spi.MetricsExporter}</li>
 *   <li><b>taskqueue-spring-boot-starter</b>: auto-configuration and {@code @TaskHandlerBean}
 *       scanning</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * var handlers = new DefaultHandlerRegistry()
 *     .register("email", payload -> {
 *         mailer.send((Email) payload);
 *         return TaskResult.success();
 *     });
 *
 * try (TaskQueue queue = TaskQueue.builder()
 *     .handlerRegistry(handlers)
 *     .build()) {
 *     queue.start();
 *     queue.enqueue("email", new Email("ops@example.com"), Priority.HIGH);
 * }
 * }</pre>
 *
 * @see taskqueue.TaskQueue
 * @see taskqueue.Task
 * @see taskqueue.TaskHandler
 * @see taskqueue.TaskResult
 */
package taskqueue;
