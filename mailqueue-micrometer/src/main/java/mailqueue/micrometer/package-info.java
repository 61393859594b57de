/**
 * Micrometer bridge for {@link mailqueue.spi.MetricsExporter}.
 */
package mailqueue.micrometer;
