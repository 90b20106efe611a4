/**
 * Service provider interfaces for plugging the queue into monitoring backends.
 *
 * @see taskqueue.spi.MetricsExporter
 */
package taskqueue.spi;
