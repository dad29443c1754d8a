/**
 * Service provider interfaces: transaction participation ({@link io.eventcore.spi.TxContext}),
 * connection acquisition ({@link io.eventcore.spi.ConnectionProvider}) and metrics export
 * ({@link io.eventcore.spi.MetricsExporter}).
 */
package io.eventcore.spi;
