/**
 * Micrometer binding for {@link emitter.spi.MetricsExporter}.
 *
 * @see emitter.micrometer.MicrometerMetricsExporter
 */
package emitter.micrometer;
