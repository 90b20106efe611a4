/**
 * Worker threads, handler execution with a timeout, and execution interceptors.
 *
 * @see taskqueue.worker.WorkerPool
 * @see taskqueue.worker.TaskInterceptor
 */
package taskqueue.worker;
