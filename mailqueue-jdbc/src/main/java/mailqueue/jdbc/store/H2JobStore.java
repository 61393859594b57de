package mailqueue.jdbc.store;

import mailqueue.spi.ConnectionProvider;

import java.util.List;

/**
 * H2 job store. Primarily for testing and embedded use.
 *
 * <p>Uses the compare-and-swap claim from {@link AbstractJdbcJobStore}.
 */
public final class H2JobStore extends AbstractJdbcJobStore {

  public H2JobStore() {
    super();
  }

  public H2JobStore(ConnectionProvider connectionProvider) {
    this(connectionProvider, JdbcStoreConfig.defaults());
  }

  public H2JobStore(ConnectionProvider connectionProvider, JdbcStoreConfig config) {
    super(connectionProvider, config);
  }

  @Override
  public AbstractJdbcJobStore bind(ConnectionProvider connectionProvider, JdbcStoreConfig config) {
    return new H2JobStore(connectionProvider, config);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }
}
