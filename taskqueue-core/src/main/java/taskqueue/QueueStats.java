package taskqueue;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Point-in-time snapshot returned by {@link TaskQueue#stats()}.
 *
 * <p>Lane sizes, retry and in-flight counts are gauges taken one after another, so under
 * concurrent activity they need not add up to an exact total. The four outcome counters
 * are monotonic.
 *
 * @param laneSizes      pending tasks per priority
 * @param retryPending   tasks waiting in the retry scheduler
 * @param inFlight       tasks currently being executed
 * @param deadLetters    records currently held by the dead-letter sink
 * @param processed      successful attempts
 * @param failed         failed attempts of any kind
 * @param retried        failed attempts scheduled for another try
 * @param deadLettered   tasks moved to the dead-letter sink
 */
public record QueueStats(
    Map<Priority, Integer> laneSizes,
    int retryPending,
    int inFlight,
    int deadLetters,
    long processed,
    long failed,
    long retried,
    long deadLettered) {

  public QueueStats {
    Map<Priority, Integer> copy = new EnumMap<>(Priority.class);
    for (Priority priority : Priority.values()) {
      copy.put(priority, laneSizes.getOrDefault(priority, 0));
    }
    laneSizes = Collections.unmodifiableMap(copy);
  }

  public int laneSize(Priority priority) {
    return laneSizes.get(priority);
  }

  /**
   * Returns the number of tasks waiting in lanes, all priorities together.
   *
   * @return total queued tasks
   */
  public int queued() {
    int total = 0;
    for (int size : laneSizes.values()) {
      total += size;
    }
    return total;
  }
}
