/**
 * Service provider interfaces for plugging backends into the emitter.
 *
 * @see emitter.spi.MetricsExporter
 */
package emitter.spi;
