package taskqueue.worker;

import taskqueue.Task;
import taskqueue.TaskResult;

/**
 * Cross-cutting hook for observing task execution.
 *
 * <p>Interceptors run around handler invocation:
 * <ol>
 *   <li>{@link #beforeExecute} in registration order</li>
 *   <li>Handler execution</li>
 *   <li>{@link #afterExecute} in reverse registration order</li>
 * </ol>
 *
 * <p>If {@code beforeExecute} throws, the handler is skipped and the attempt counts as a
 * retryable failure. {@code afterExecute} exceptions are logged but swallowed.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * TaskQueue.builder()
 *     .interceptor(TaskInterceptor.before(task ->
 *         audit.log(task.taskType(), task.id())))
 *     .interceptor(TaskInterceptor.after((task, result) -> {
 *         if (!result.isSuccess()) alerts.notify(task.id());
 *     }))
 *     .build();
 * }</pre>
 */
public interface TaskInterceptor {

    /**
     * Called before the handler is invoked.
     *
     * @param task the task about to run
     * @throws Exception to skip the handler and fail the attempt
     */
    default void beforeExecute(Task task) throws Exception {
    }

    /**
     * Called after the attempt, whatever its outcome.
     *
     * @param task   the task that ran
     * @param result the outcome of the attempt, never null
     */
    default void afterExecute(Task task, TaskResult result) {
    }

    /**
     * Creates an interceptor with only a beforeExecute hook.
     */
    static TaskInterceptor before(BeforeHook hook) {
        return new TaskInterceptor() {
            @Override
            public void beforeExecute(Task task) throws Exception {
                hook.accept(task);
            }
        };
    }

    /**
     * Creates an interceptor with only an afterExecute hook.
     */
    static TaskInterceptor after(AfterHook hook) {
        return new TaskInterceptor() {
            @Override
            public void afterExecute(Task task, TaskResult result) {
                hook.accept(task, result);
            }
        };
    }

    @FunctionalInterface
    interface BeforeHook {
        void accept(Task task) throws Exception;
    }

    @FunctionalInterface
    interface AfterHook {
        void accept(Task task, TaskResult result);
    }
}
