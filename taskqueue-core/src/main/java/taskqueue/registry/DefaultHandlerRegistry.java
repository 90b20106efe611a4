package taskqueue.registry;

import taskqueue.TaskHandler;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe registry mapping each task type to exactly one handler.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * HandlerRegistry registry = new DefaultHandlerRegistry()
 *     .register("send-email", payload -> mailer.send((Email) payload))
 *     .register("charge", payload -> billing.charge((Charge) payload));
 * }</pre>
 *
 * <p>Registering a second handler for the same type fails fast.
 */
public final class DefaultHandlerRegistry implements HandlerRegistry {
  private final Map<String, TaskHandler> handlers = new ConcurrentHashMap<>();

  /**
   * Registers the handler for a task type.
   *
   * @param taskType the task type
   * @param handler  the handler
   * @return this registry for chaining
   * @throws IllegalStateException if a handler is already registered for {@code taskType}
   */
  public DefaultHandlerRegistry register(String taskType, TaskHandler handler) {
    Objects.requireNonNull(taskType, "taskType");
    Objects.requireNonNull(handler, "handler");
    if (taskType.isEmpty()) {
      throw new IllegalArgumentException("taskType cannot be empty");
    }
    TaskHandler existing = handlers.putIfAbsent(taskType, handler);
    if (existing != null) {
      throw new IllegalStateException("Duplicate handler for taskType=" + taskType);
    }
    return this;
  }

  /**
   * Removes the handler for a task type.
   *
   * @param taskType the task type
   * @return {@code true} if a handler was removed
   */
  public boolean unregister(String taskType) {
    return handlers.remove(taskType) != null;
  }

  @Override
  public TaskHandler handlerFor(String taskType) {
    return handlers.get(taskType);
  }

  public Set<String> taskTypes() {
    return Collections.unmodifiableSet(new TreeSet<>(handlers.keySet()));
  }
}
