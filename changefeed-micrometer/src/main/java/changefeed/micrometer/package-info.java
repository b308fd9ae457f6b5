/**
 * Micrometer bridge for exporting change-feed metrics to Prometheus, Grafana, and other backends.
 *
 * <p>{@link changefeed.micrometer.MicrometerMetricsExporter} implements the
 * {@link changefeed.spi.MetricsExporter} SPI using Micrometer counters and gauges.
 */
package changefeed.micrometer;
