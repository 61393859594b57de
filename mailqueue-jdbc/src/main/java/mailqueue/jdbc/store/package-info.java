/**
 * Database-specific {@link mailqueue.spi.JobStore} implementations.
 *
 * <ul>
 *   <li>{@link mailqueue.jdbc.store.PostgresJobStore}: {@code FOR UPDATE SKIP LOCKED} with
 *       {@code RETURNING}</li>
 *   <li>{@link mailqueue.jdbc.store.MySqlJobStore}: locking select and update in one
 *       transaction</li>
 *   <li>{@link mailqueue.jdbc.store.H2JobStore}: per-row compare-and-swap</li>
 * </ul>
 *
 * <p>Table definitions ship on the classpath as {@code schema/h2.sql},
 * {@code schema/postgresql.sql} and {@code schema/mysql.sql}.
 */
package mailqueue.jdbc.store;
