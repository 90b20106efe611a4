package taskqueue.retry;

import taskqueue.Task;

import java.time.Instant;

/**
 * A task waiting in the {@link RetryScheduler} until {@code readyAt}.
 * Entries with the same deadline keep insertion order through {@code sequence}.
 */
public record RetryEntry(Task task, Instant readyAt, long sequence) implements Comparable<RetryEntry> {

  @Override
  public int compareTo(RetryEntry other) {
    int byTime = readyAt.compareTo(other.readyAt);
    return byTime != 0 ? byTime : Long.compare(sequence, other.sequence);
  }

  public boolean isDue(Instant now) {
    return !readyAt.isAfter(now);
  }
}
