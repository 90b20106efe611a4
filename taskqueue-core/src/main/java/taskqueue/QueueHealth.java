package taskqueue;

/**
 * Liveness summary returned by {@link TaskQueue#healthCheck()}.
 *
 * @param running      {@code true} between start and shutdown
 * @param liveWorkers  worker threads currently looping
 * @param workerCount  configured worker threads
 * @param abortCause   the failure that aborted the queue, or {@code null}
 */
public record QueueHealth(boolean running, int liveWorkers, int workerCount, Throwable abortCause) {

  /**
   * Returns whether the queue is running with every worker alive.
   *
   * @return {@code true} if healthy
   */
  public boolean isHealthy() {
    return running && abortCause == null && liveWorkers == workerCount;
  }
}
