package mailqueue.jdbc.store;

import mailqueue.jdbc.JdbcTemplate;
import mailqueue.model.Job;
import mailqueue.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;

/**
 * PostgreSQL job store.
 *
 * <p>Claims with a single {@code UPDATE ... WHERE id IN (SELECT ... FOR UPDATE SKIP LOCKED)
 * RETURNING} statement: rows locked by a concurrent claimer are skipped, and selection and
 * status change happen in one round trip.
 */
public final class PostgresJobStore extends AbstractJdbcJobStore {

  public PostgresJobStore() {
    super();
  }

  public PostgresJobStore(ConnectionProvider connectionProvider) {
    this(connectionProvider, JdbcStoreConfig.defaults());
  }

  public PostgresJobStore(ConnectionProvider connectionProvider, JdbcStoreConfig config) {
    super(connectionProvider, config);
  }

  @Override
  public AbstractJdbcJobStore bind(ConnectionProvider connectionProvider, JdbcStoreConfig config) {
    return new PostgresJobStore(connectionProvider, config);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  protected String nextUpdatedAt() {
    return "GREATEST(CAST(? AS TIMESTAMP(3)), updated_at + INTERVAL '1 millisecond')";
  }

  @Override
  protected List<Job> claim(Connection conn, Instant now, int limit) throws SQLException {
    String sql = "UPDATE " + tableName()
        + " SET status=" + PROCESSING + ", updated_at=" + nextUpdatedAt()
        + " WHERE id IN ("
        + "SELECT id FROM " + tableName()
        + " WHERE status IN " + CLAIMABLE_STATUS_IN + " AND scheduled_for <= ?"
        + CLAIM_ORDER + " LIMIT ?"
        + " FOR UPDATE SKIP LOCKED"
        + ") RETURNING " + COLUMNS;
    return JdbcTemplate.query(conn, sql, this::mapJob, now, now, limit);
  }
}
