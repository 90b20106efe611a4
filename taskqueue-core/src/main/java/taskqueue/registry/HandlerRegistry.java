package taskqueue.registry;

import taskqueue.TaskHandler;

/**
 * Lookup of task handlers by task type.
 *
 * <p>Workers consult the registry for every task they pick up, so handlers registered
 * after the queue started are seen by the next attempt.
 *
 * @see DefaultHandlerRegistry
 */
public interface HandlerRegistry {

  /**
   * Returns the handler for the given task type.
   *
   * @param taskType the task type
   * @return the handler, or {@code null} if none is registered
   */
  TaskHandler handlerFor(String taskType);
}
