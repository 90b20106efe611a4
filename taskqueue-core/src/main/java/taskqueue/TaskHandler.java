package taskqueue;

/**
 * Executor for one task type, registered in a {@link taskqueue.registry.HandlerRegistry}.
 *
 * <h2>Execution Model</h2>
 * <p>Handlers run on a handler thread on behalf of a worker, bounded by the queue's
 * handler timeout. A handler that exceeds the timeout is interrupted and the attempt
 * counts as a retryable failure.
 *
 * <h2>Error Handling</h2>
 * <ul>
 *   <li>Return {@link TaskResult#success()} (or {@code null}) when done</li>
 *   <li>Return {@link TaskResult#retry(String)} or throw to retry with backoff</li>
 *   <li>Return {@link TaskResult#fail(String)} to dead-letter without retrying</li>
 * </ul>
 *
 * <h2>Idempotency</h2>
 * <p>A task may be executed several times. The payload must not be retained after the
 * call returns.
 *
 * <pre>{@code
 * registry.register("charge_card", payload -> {
 *   ChargeRequest req = (ChargeRequest) payload;
 *   if (req.amount() <= 0) {
 *     return TaskResult.fail("invalid amount");
 *   }
 *   gateway.charge(req);
 *   return TaskResult.success();
 * });
 * }</pre>
 *
 * @see taskqueue.registry.DefaultHandlerRegistry
 */
@FunctionalInterface
public interface TaskHandler {

  /**
   * Processes a task payload.
   *
   * @param payload the task payload, possibly null
   * @return the outcome; {@code null} is treated as success
   * @throws Exception if processing fails; triggers retry or dead-letter handling
   */
  TaskResult handle(Object payload) throws Exception;
}
