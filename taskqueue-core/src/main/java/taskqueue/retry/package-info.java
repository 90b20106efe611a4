/**
 * Retry decision, backoff policies and the time-ordered holding area for failed tasks.
 *
 * <p>{@link taskqueue.retry.RetryScheduler} is the only path by which a failed task
 * returns to a lane. It parks tasks in a min-heap of {@link taskqueue.retry.RetryEntry}
 * and releases them from a single thread that sleeps until the earliest deadline.
 *
 * @see taskqueue.retry.RetryScheduler
 * @see taskqueue.retry.RetryPolicy
 * @see taskqueue.retry.ExponentialBackoffRetryPolicy
 */
package taskqueue.retry;
