/**
 * Location bookkeeping that enforces "one task, one place".
 *
 * @see taskqueue.tracker.TaskTracker
 */
package taskqueue.tracker;
