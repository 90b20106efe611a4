/**
 * Strict-priority FIFO lanes with per-lane capacity and blocking backpressure.
 *
 * @see taskqueue.queue.PriorityLanes
 */
package taskqueue.queue;
