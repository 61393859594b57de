/**
 * JDBC support shared by the job stores: statement helper, table name validation and a
 * {@link javax.sql.DataSource}-backed {@link mailqueue.spi.ConnectionProvider}.
 *
 * @see mailqueue.jdbc.store
 */
package mailqueue.jdbc;
