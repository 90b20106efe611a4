/**
 * Terminal storage for tasks that can no longer be retried.
 *
 * <p>{@link taskqueue.dead.DeadLetterSink} keeps {@link taskqueue.dead.DeadLetterRecord}s for the
 * lifetime of the queue. Operators list them, drain them, or resubmit a task through
 * {@link taskqueue.TaskQueue#resubmit(String)}.
 */
package taskqueue.dead;
