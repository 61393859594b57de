package mailqueue.jdbc.store;

import mailqueue.StoreException;
import mailqueue.jdbc.JdbcTemplate;
import mailqueue.model.HealthStatus;
import mailqueue.model.Job;
import mailqueue.model.JobStatus;
import mailqueue.model.MessageContent;
import mailqueue.model.NewJob;
import mailqueue.model.QueueStats;
import mailqueue.model.Recipients;
import mailqueue.spi.ConnectionProvider;
import mailqueue.spi.JobStore;
import mailqueue.util.JsonCodec;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Base JDBC job store with standard SQL implementations.
 *
 * <p>Each operation borrows a connection from the {@link ConnectionProvider} and returns it
 * before the call completes. Connectivity failures (SQLState class {@code 08},
 * {@link SQLTransientException}, {@link SQLRecoverableException}) are retried up to
 * {@link JdbcStoreConfig#maxAttempts()} times, rolling back partial transactions in between;
 * anything else fails at once. Failures surface as {@link StoreException}.
 *
 * <p>The default claim is an optimistic compare-and-swap per candidate row, which any
 * database supports. Subclasses override {@link #claim} with a skip-locked statement where
 * the database has one, and {@link #nextUpdatedAt()} with their interval arithmetic.
 *
 * <p>Instances created through the no-arg constructor are unbound prototypes used for
 * discovery; {@link #bind} returns a usable store. Register custom implementations via
 * {@code META-INF/services/mailqueue.jdbc.store.AbstractJdbcJobStore}.
 *
 * @see JdbcJobStores
 */
public abstract class AbstractJdbcJobStore implements JobStore {
  private static final Logger logger = Logger.getLogger(AbstractJdbcJobStore.class.getName());

  private static final int MAX_ERROR_LENGTH = 4000;

  protected static final String COLUMNS = "id, message_id, message_type, "
      + "to_addresses, cc_addresses, bcc_addresses, subject, body_html, body_text, "
      + "template_id, template_vars, metadata, priority, status, retry_count, max_retries, "
      + "last_error, scheduled_for, next_retry_at, sent_at, created_at, updated_at";

  protected static final String CLAIMABLE_STATUS_IN =
      "('" + JobStatus.PENDING.dbValue() + "','" + JobStatus.SCHEDULED.dbValue() + "')";
  protected static final String PROCESSING = "'" + JobStatus.PROCESSING.dbValue() + "'";

  protected static final String CLAIM_ORDER = " ORDER BY priority, created_at, id";

  private static final Comparator<Job> CLAIM_ORDER_COMPARATOR = Comparator
      .comparingInt(Job::priority)
      .thenComparing(Job::createdAt)
      .thenComparingLong(Job::id);

  private final ConnectionProvider connectionProvider;
  private final JdbcStoreConfig config;

  /** Creates an unbound prototype for {@link java.util.ServiceLoader} discovery. */
  protected AbstractJdbcJobStore() {
    this.connectionProvider = null;
    this.config = JdbcStoreConfig.defaults();
  }

  protected AbstractJdbcJobStore(ConnectionProvider connectionProvider, JdbcStoreConfig config) {
    if (connectionProvider == null) {
      throw new NullPointerException("connectionProvider");
    }
    if (config == null) {
      throw new NullPointerException("config");
    }
    this.connectionProvider = connectionProvider;
    this.config = config;
  }

  /**
   * Unique identifier for this store (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this store handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a store of the same kind that uses the given connections and settings.
   */
  public abstract AbstractJdbcJobStore bind(ConnectionProvider connectionProvider, JdbcStoreConfig config);

  public boolean isBound() {
    return connectionProvider != null;
  }

  protected String tableName() {
    return config.tableName();
  }

  protected JdbcStoreConfig config() {
    return config;
  }

  protected JsonCodec jsonCodec() {
    return config.jsonCodec();
  }

  /** Current time at the precision every supported database stores. */
  protected Instant now() {
    return config.clock().instant().truncatedTo(ChronoUnit.MILLIS);
  }

  /**
   * SQL expression for a new {@code updated_at} value with exactly one {@code ?} placeholder
   * bound to the current time. The result must be strictly later than the row's previous
   * value even when the clock has not advanced.
   */
  protected String nextUpdatedAt() {
    return "GREATEST(CAST(? AS TIMESTAMP(3)), DATEADD(MILLISECOND, 1, updated_at))";
  }

  /** Whether {@link #claim} must run inside a single transaction. */
  protected boolean claimInTransaction() {
    return false;
  }

  // ── operations ──────────────────────────────────────────────────

  @Override
  public long enqueue(NewJob job) {
    if (job == null) {
      throw new NullPointerException("job");
    }
    if (job.recipients().isEmpty()) {
      throw new StoreException("Job " + job.messageId() + " has no 'to' recipients");
    }
    Instant now = now();
    Instant scheduledFor = job.scheduledFor() == null
        ? now : job.scheduledFor().truncatedTo(ChronoUnit.MILLIS);
    int maxRetries = job.maxRetries() != null ? job.maxRetries() : config.defaultMaxRetries();
    MessageContent content = job.content();
    JsonCodec codec = jsonCodec();

    String sql = "INSERT INTO " + tableName() + " ("
        + "message_id, message_type, to_addresses, cc_addresses, bcc_addresses, "
        + "subject, body_html, body_text, template_id, template_vars, metadata, "
        + "priority, status, retry_count, max_retries, scheduled_for, created_at, updated_at"
        + ") VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,0,?,?,?,?)";

    return execute("enqueue job " + job.messageId(), null, false, conn -> {
      try {
        return JdbcTemplate.insertReturningKey(conn, sql,
            job.messageId(), job.messageType(),
            codec.toJsonArray(job.recipients().to()),
            codec.toJsonArray(job.recipients().cc()),
            codec.toJsonArray(job.recipients().bcc()),
            content.subject(), content.bodyHtml(), content.bodyText(),
            content.templateId(), codec.toJson(content.templateVars()),
            codec.toJson(job.metadata()),
            job.priority(), JobStatus.PENDING.dbValue(), maxRetries,
            scheduledFor, now, now);
      } catch (SQLException e) {
        if (job.hasCallerSuppliedId() && isConstraintViolation(e)) {
          Optional<Long> existing = findIdByMessageId(conn, job.messageId());
          if (existing.isPresent()) {
            logger.log(Level.FINE, "Message {0} already queued as job {1}",
                new Object[]{job.messageId(), existing.get()});
            return existing.get();
          }
        }
        throw e;
      }
    });
  }

  @Override
  public List<Job> claimBatch(int limit) {
    int clamped = Math.max(1, Math.min(limit, MAX_CLAIM_BATCH));
    List<Job> claimed = execute("claim jobs", null, claimInTransaction(),
        conn -> claim(conn, now(), clamped));
    if (claimed.size() <= 1) {
      return claimed;
    }
    List<Job> sorted = new ArrayList<>(claimed);
    sorted.sort(CLAIM_ORDER_COMPARATOR);
    return sorted;
  }

  /**
   * Claims up to {@code limit} due jobs. Must never return a row that a concurrent claimer
   * also returns. The connection is in auto-commit mode unless {@link #claimInTransaction()}.
   *
   * <p>The default selects candidates, then moves each one with a conditional
   * {@code UPDATE ... WHERE status IN (pending, scheduled)}. A zero update count or a lock
   * conflict means another claimer won the row.
   */
  protected List<Job> claim(Connection conn, Instant now, int limit) throws SQLException {
    String candidateSql = "SELECT id FROM " + tableName()
        + " WHERE status IN " + CLAIMABLE_STATUS_IN + " AND scheduled_for <= ?"
        + CLAIM_ORDER + " LIMIT ?";
    List<Long> candidates = JdbcTemplate.query(conn, candidateSql, rs -> rs.getLong(1), now, limit);
    if (candidates.isEmpty()) {
      return List.of();
    }
    String casSql = "UPDATE " + tableName()
        + " SET status=" + PROCESSING + ", updated_at=" + nextUpdatedAt()
        + " WHERE id=? AND status IN " + CLAIMABLE_STATUS_IN + " AND scheduled_for <= ?";
    List<Long> won = new ArrayList<>(candidates.size());
    for (Long id : candidates) {
      int updated;
      try {
        updated = JdbcTemplate.update(conn, casSql, now, id, now);
      } catch (SQLException e) {
        if (!isLockConflict(e)) {
          throw e;
        }
        logger.log(Level.FINE, "Skipping job {0} locked by another claimer", id);
        continue;
      }
      if (updated == 1) {
        won.add(id);
      }
    }
    return won.isEmpty() ? List.of() : selectByIds(conn, won);
  }

  @Override
  public boolean markSent(long id, Instant sentAt) {
    if (sentAt == null) {
      throw new NullPointerException("sentAt");
    }
    String sql = "UPDATE " + tableName()
        + " SET status='" + JobStatus.SENT.dbValue() + "', sent_at=?, updated_at=" + nextUpdatedAt()
        + " WHERE id=? AND status=" + PROCESSING;
    return execute("mark SENT", id, false,
        conn -> JdbcTemplate.update(conn, sql, sentAt.truncatedTo(ChronoUnit.MILLIS), now(), id) == 1);
  }

  @Override
  public boolean markScheduled(long id, String error, Instant nextRetryAt, int retryCount) {
    if (nextRetryAt == null) {
      throw new NullPointerException("nextRetryAt");
    }
    if (retryCount < 0) {
      throw new IllegalArgumentException("retryCount must be >= 0, got: " + retryCount);
    }
    Instant next = nextRetryAt.truncatedTo(ChronoUnit.MILLIS);
    String sql = "UPDATE " + tableName()
        + " SET status='" + JobStatus.SCHEDULED.dbValue() + "', retry_count=?, next_retry_at=?,"
        + " scheduled_for=?, last_error=?, updated_at=" + nextUpdatedAt()
        + " WHERE id=? AND status=" + PROCESSING + " AND max_retries >= ?";
    return execute("mark SCHEDULED", id, false,
        conn -> JdbcTemplate.update(conn, sql,
            retryCount, next, next, truncateError(error), now(), id, retryCount) == 1);
  }

  @Override
  public boolean markFailed(long id, String error) {
    String sql = "UPDATE " + tableName()
        + " SET status='" + JobStatus.FAILED.dbValue() + "', last_error=?, updated_at=" + nextUpdatedAt()
        + " WHERE id=? AND status=" + PROCESSING;
    return execute("mark FAILED", id, false,
        conn -> JdbcTemplate.update(conn, sql, truncateError(error), now(), id) == 1);
  }

  @Override
  public Optional<Job> findById(long id) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE id=?";
    List<Job> rows = execute("find job", id, false,
        conn -> JdbcTemplate.query(conn, sql, this::mapJob, id));
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  @Override
  public QueueStats stats() {
    String sql = "SELECT status, COUNT(*) FROM " + tableName() + " GROUP BY status";
    List<Map.Entry<String, Long>> rows = execute("read queue stats", null, false,
        conn -> JdbcTemplate.query(conn, sql, rs -> Map.entry(rs.getString(1), rs.getLong(2))));
    Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
    for (Map.Entry<String, Long> row : rows) {
      try {
        counts.merge(JobStatus.fromDbValue(row.getKey()), row.getValue(), Long::sum);
      } catch (IllegalArgumentException e) {
        logger.log(Level.WARNING, "Ignoring {0} rows with unknown status {1}",
            new Object[]{row.getValue(), row.getKey()});
      }
    }
    return new QueueStats(counts);
  }

  @Override
  public HealthStatus health() {
    if (!isBound()) {
      return HealthStatus.down("store is not bound to a connection provider");
    }
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      List<Integer> result = JdbcTemplate.query(conn, "SELECT 1", rs -> rs.getInt(1));
      return result.size() == 1 && result.get(0) == 1
          ? HealthStatus.up() : HealthStatus.down("unexpected probe result " + result);
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.WARNING, "Health probe failed", e);
      return HealthStatus.down(e.getClass().getSimpleName() + ": " + e.getMessage());
    }
  }

  /**
   * Closes the connection provider when it is {@link AutoCloseable}.
   */
  @Override
  public void close() {
    if (connectionProvider instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        logger.log(Level.WARNING, "Failed to close connection provider", e);
      }
    }
  }

  // ── helpers for subclasses ──────────────────────────────────────

  protected List<Job> selectByIds(Connection conn, List<Long> ids) throws SQLException {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName()
        + " WHERE id IN (" + JdbcTemplate.placeholders(ids.size()) + ")" + CLAIM_ORDER;
    return JdbcTemplate.query(conn, sql, this::mapJob, ids.toArray());
  }

  protected Job mapJob(ResultSet rs) throws SQLException {
    JsonCodec codec = jsonCodec();
    Recipients recipients = new Recipients(
        codec.parseArray(rs.getString("to_addresses")),
        codec.parseArray(rs.getString("cc_addresses")),
        codec.parseArray(rs.getString("bcc_addresses")));
    MessageContent content = new MessageContent(
        rs.getString("subject"),
        rs.getString("body_html"),
        rs.getString("body_text"),
        rs.getString("template_id"),
        codec.parseObject(rs.getString("template_vars")));
    return new Job(
        rs.getLong("id"),
        rs.getString("message_id"),
        rs.getString("message_type"),
        recipients,
        content,
        codec.parseObject(rs.getString("metadata")),
        rs.getInt("priority"),
        JobStatus.fromDbValue(rs.getString("status")),
        rs.getInt("retry_count"),
        rs.getInt("max_retries"),
        rs.getString("last_error"),
        JdbcTemplate.toInstant(rs.getTimestamp("scheduled_for")),
        JdbcTemplate.toInstant(rs.getTimestamp("next_retry_at")),
        JdbcTemplate.toInstant(rs.getTimestamp("sent_at")),
        JdbcTemplate.toInstant(rs.getTimestamp("created_at")),
        JdbcTemplate.toInstant(rs.getTimestamp("updated_at")));
  }

  private Optional<Long> findIdByMessageId(Connection conn, String messageId) throws SQLException {
    String sql = "SELECT id FROM " + tableName() + " WHERE message_id=?";
    List<Long> ids = JdbcTemplate.query(conn, sql, rs -> rs.getLong(1), messageId);
    return ids.isEmpty() ? Optional.empty() : Optional.of(ids.get(0));
  }

  /**
   * Runs {@code op} on a fresh connection, retrying connectivity failures.
   *
   * @param action        description for log and exception messages
   * @param jobId         affected job, or {@code null}
   * @param transactional run with auto-commit off and commit on success
   */
  protected <T> T execute(String action, Long jobId, boolean transactional, SqlFunction<T> op) {
    if (!isBound()) {
      throw new IllegalStateException(name() + " store is not bound; use bind(...) or JdbcJobStores.create(...)");
    }
    int maxAttempts = config.maxAttempts();
    SQLException last = null;
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      try (Connection conn = connectionProvider.getConnection()) {
        conn.setAutoCommit(!transactional);
        try {
          T result = op.apply(conn);
          if (transactional) {
            conn.commit();
          }
          return result;
        } catch (SQLException | RuntimeException e) {
          if (transactional) {
            rollback(conn, e);
          }
          throw e;
        }
      } catch (SQLException e) {
        last = e;
        if (!isTransient(e) || attempt == maxAttempts) {
          break;
        }
        logger.log(Level.WARNING, "Transient failure to " + action
            + (jobId == null ? "" : " for jobId=" + jobId)
            + " (attempt " + attempt + "/" + maxAttempts + "); retrying", e);
      }
    }
    throw new StoreException("Failed to " + action, jobId, isTransient(last), last);
  }

  @FunctionalInterface
  protected interface SqlFunction<T> {
    T apply(Connection conn) throws SQLException;
  }

  private static void rollback(Connection conn, Exception failure) {
    try {
      conn.rollback();
    } catch (SQLException e) {
      failure.addSuppressed(e);
    }
  }

  /** Connectivity problems worth another attempt on a fresh connection. */
  static boolean isTransient(SQLException error) {
    for (Throwable t = error; t != null; t = t.getCause()) {
      if (t instanceof SQLTransientException || t instanceof SQLRecoverableException) {
        return true;
      }
      if (t instanceof SQLException sql && sql.getSQLState() != null && sql.getSQLState().startsWith("08")) {
        return true;
      }
    }
    return false;
  }

  /** Integrity constraint violation (unique key, check constraint, not-null). */
  static boolean isConstraintViolation(SQLException error) {
    String state = error.getSQLState();
    return state != null && state.startsWith("23");
  }

  /** Row lock held by a concurrent transaction: serialization failure, lock timeout or deadlock. */
  static boolean isLockConflict(SQLException error) {
    String state = error.getSQLState();
    if (state == null) {
      return false;
    }
    switch (state) {
      case "40001": // serialization failure
      case "40P01": // deadlock (PostgreSQL)
      case "55P03": // lock not available (PostgreSQL)
      case "HYT00": // lock timeout (H2)
        return true;
      default:
        return error.getErrorCode() == 90131; // H2 concurrent update
    }
  }

  private static String truncateError(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH - 3) + "...";
  }
}
