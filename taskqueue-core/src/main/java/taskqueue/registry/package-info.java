/**
 * Handler routing by task type.
 *
 * <p>Each task type maps to a single {@link taskqueue.TaskHandler}. Tasks whose type has
 * no handler fail with a retryable error, so a late registration can still pick them up.
 *
 * @see taskqueue.registry.HandlerRegistry
 * @see taskqueue.registry.DefaultHandlerRegistry
 */
package taskqueue.registry;
