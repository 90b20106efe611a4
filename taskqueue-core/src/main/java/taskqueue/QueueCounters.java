package taskqueue;

import taskqueue.spi.MetricsExporter;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Monotonic outcome counters shared by the workers and the retry scheduler.
 * Each increment is mirrored to the configured {@link MetricsExporter}.
 */
public final class QueueCounters {
  private final AtomicLong processed = new AtomicLong();
  private final AtomicLong failed = new AtomicLong();
  private final AtomicLong retried = new AtomicLong();
  private final AtomicLong deadLettered = new AtomicLong();
  private final MetricsExporter metrics;

  public QueueCounters() {
    this(MetricsExporter.NOOP);
  }

  public QueueCounters(MetricsExporter metrics) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  public void recordProcessed() {
    processed.incrementAndGet();
    metrics.incrementProcessed();
  }

  public void recordFailed() {
    failed.incrementAndGet();
    metrics.incrementFailed();
  }

  public void recordRetried() {
    retried.incrementAndGet();
    metrics.incrementRetried();
  }

  public void recordDeadLettered() {
    deadLettered.incrementAndGet();
    metrics.incrementDeadLettered();
  }

  public long processed() {
    return processed.get();
  }

  public long failed() {
    return failed.get();
  }

  public long retried() {
    return retried.get();
  }

  public long deadLettered() {
    return deadLettered.get();
  }

  public MetricsExporter metrics() {
    return metrics;
  }
}
