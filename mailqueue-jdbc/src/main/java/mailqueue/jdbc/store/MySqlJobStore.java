package mailqueue.jdbc.store;

import mailqueue.jdbc.JdbcTemplate;
import mailqueue.model.Job;
import mailqueue.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * MySQL 8 job store. Also compatible with TiDB.
 *
 * <p>MySQL cannot lock rows in a subquery of an {@code UPDATE} on the same table, so the
 * claim runs as {@code SELECT ... FOR UPDATE SKIP LOCKED} followed by an {@code UPDATE} of
 * the locked ids inside one transaction. The row locks keep concurrent claimers off the
 * selected rows until the transaction commits.
 */
public final class MySqlJobStore extends AbstractJdbcJobStore {

  public MySqlJobStore() {
    super();
  }

  public MySqlJobStore(ConnectionProvider connectionProvider) {
    this(connectionProvider, JdbcStoreConfig.defaults());
  }

  public MySqlJobStore(ConnectionProvider connectionProvider, JdbcStoreConfig config) {
    super(connectionProvider, config);
  }

  @Override
  public AbstractJdbcJobStore bind(ConnectionProvider connectionProvider, JdbcStoreConfig config) {
    return new MySqlJobStore(connectionProvider, config);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:");
  }

  @Override
  protected String nextUpdatedAt() {
    return "GREATEST(CAST(? AS DATETIME(3)), updated_at + INTERVAL 1000 MICROSECOND)";
  }

  @Override
  protected boolean claimInTransaction() {
    return true;
  }

  @Override
  protected List<Job> claim(Connection conn, Instant now, int limit) throws SQLException {
    String lockSql = "SELECT id FROM " + tableName()
        + " WHERE status IN " + CLAIMABLE_STATUS_IN + " AND scheduled_for <= ?"
        + CLAIM_ORDER + " LIMIT ? FOR UPDATE SKIP LOCKED";
    List<Long> ids = JdbcTemplate.query(conn, lockSql, rs -> rs.getLong(1), now, limit);
    if (ids.isEmpty()) {
      return List.of();
    }
    String updateSql = "UPDATE " + tableName()
        + " SET status=" + PROCESSING + ", updated_at=" + nextUpdatedAt()
        + " WHERE id IN (" + JdbcTemplate.placeholders(ids.size()) + ")";
    List<Object> params = new ArrayList<>(ids.size() + 1);
    params.add(now);
    params.addAll(ids);
    JdbcTemplate.update(conn, updateSql, params.toArray());
    return selectByIds(conn, ids);
  }
}
