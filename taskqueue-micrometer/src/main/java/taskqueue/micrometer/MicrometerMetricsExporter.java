package taskqueue.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import taskqueue.Priority;
import taskqueue.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters, gauges and a timer with a {@link MeterRegistry} for export to
 * Prometheus, Grafana, Datadog, and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code taskqueue.enqueued}: tasks accepted, tagged {@code priority=high|medium|low}</li>
 *   <li>{@code taskqueue.processed}: attempts that succeeded</li>
 *   <li>{@code taskqueue.failed}: attempts that failed</li>
 *   <li>{@code taskqueue.retried}: failures scheduled for another attempt</li>
 *   <li>{@code taskqueue.dead_lettered}: tasks moved to the dead-letter sink</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code taskqueue.lane.high.depth}, {@code .medium.depth}, {@code .low.depth}: lane sizes</li>
 *   <li>{@code taskqueue.retry.pending}: tasks waiting for their retry time</li>
 * </ul>
 *
 * <h3>Timers</h3>
 * <ul>
 *   <li>{@code taskqueue.handler.duration}: time spent in handler calls</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Map<Priority, Counter> enqueued = new EnumMap<>(Priority.class);
  private final Counter processed;
  private final Counter failed;
  private final Counter retried;
  private final Counter deadLettered;
  private final Timer handlerDuration;
  private final List<Meter> meters = new ArrayList<>();

  private final Map<Priority, AtomicInteger> laneDepths = new EnumMap<>(Priority.class);
  private final AtomicInteger retryPending = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "taskqueue"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "taskqueue");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "billing.taskqueue"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    for (Priority priority : Priority.values()) {
      String lane = priority.name().toLowerCase(Locale.ROOT);
      Counter counter = Counter.builder(namePrefix + ".enqueued")
          .description("Tasks accepted into a lane")
          .tag("priority", lane)
          .register(registry);
      enqueued.put(priority, counter);
      meters.add(counter);

      AtomicInteger depth = new AtomicInteger();
      laneDepths.put(priority, depth);
      meters.add(Gauge.builder(namePrefix + ".lane." + lane + ".depth", depth, AtomicInteger::get)
          .description("Tasks waiting in the " + lane + " lane")
          .register(registry));
    }
    this.processed = register(Counter.builder(namePrefix + ".processed")
        .description("Task attempts that succeeded")
        .register(registry));
    this.failed = register(Counter.builder(namePrefix + ".failed")
        .description("Task attempts that failed")
        .register(registry));
    this.retried = register(Counter.builder(namePrefix + ".retried")
        .description("Failed tasks scheduled for retry")
        .register(registry));
    this.deadLettered = register(Counter.builder(namePrefix + ".dead_lettered")
        .description("Tasks moved to the dead-letter sink")
        .register(registry));
    this.handlerDuration = register(Timer.builder(namePrefix + ".handler.duration")
        .description("Time spent executing task handlers")
        .register(registry));
    meters.add(Gauge.builder(namePrefix + ".retry.pending", retryPending, AtomicInteger::get)
        .description("Tasks waiting for their retry time")
        .register(registry));
  }

  private <M extends Meter> M register(M meter) {
    meters.add(meter);
    return meter;
  }

  @Override
  public void incrementEnqueued(Priority priority) {
    if (closed) return;
    enqueued.get(priority).increment();
  }

  @Override
  public void incrementProcessed() {
    if (closed) return;
    processed.increment();
  }

  @Override
  public void incrementFailed() {
    if (closed) return;
    failed.increment();
  }

  @Override
  public void incrementRetried() {
    if (closed) return;
    retried.increment();
  }

  @Override
  public void incrementDeadLettered() {
    if (closed) return;
    deadLettered.increment();
  }

  @Override
  public void recordLaneDepths(int high, int medium, int low) {
    if (closed) return;
    laneDepths.get(Priority.HIGH).set(high);
    laneDepths.get(Priority.MEDIUM).set(medium);
    laneDepths.get(Priority.LOW).set(low);
  }

  @Override
  public void recordRetryPending(int pending) {
    if (closed) return;
    retryPending.set(pending);
  }

  @Override
  public void recordHandlerDurationMs(long durationMs) {
    if (closed) return;
    handlerDuration.record(durationMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Called by {@link taskqueue.TaskQueue#close()} to prevent stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
