/**
 * Micrometer bridge for the {@link io.eventcore.spi.MetricsExporter} SPI.
 *
 * @see io.eventcore.micrometer.MicrometerMetricsExporter
 */
package io.eventcore.micrometer;
