/**
 * Micrometer bridge for exporting task queue metrics to Prometheus, Grafana, and other backends.
 *
 * <p>{@link taskqueue.micrometer.MicrometerMetricsExporter} implements the
 * {@link taskqueue.spi.MetricsExporter} SPI using Micrometer counters, gauges and a timer.
 *
 * @see taskqueue.micrometer.MicrometerMetricsExporter
 */
package taskqueue.micrometer;
