/**
 * Service provider interfaces: the durable {@link mailqueue.spi.JobStore}, JDBC
 * {@link mailqueue.spi.ConnectionProvider}, and the {@link mailqueue.spi.MetricsExporter} hook.
 */
package mailqueue.spi;
