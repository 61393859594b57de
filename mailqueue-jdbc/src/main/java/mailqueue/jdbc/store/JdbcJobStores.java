package mailqueue.jdbc.store;

import mailqueue.jdbc.DataSourceConnectionProvider;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC job stores with auto-detection support.
 *
 * <p>Stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/mailqueue.jdbc.store.AbstractJdbcJobStore}. Registered instances
 * are unbound prototypes; {@link #create} binds one to a data source.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Detect the database and bind in one step
 * AbstractJdbcJobStore store = JdbcJobStores.create(dataSource, JdbcStoreConfig.defaults());
 *
 * // Detect from a JDBC URL, bind later
 * AbstractJdbcJobStore prototype = JdbcJobStores.detect("jdbc:postgresql://localhost/mail");
 *
 * // Get by name
 * AbstractJdbcJobStore h2 = JdbcJobStores.get("h2");
 * }</pre>
 */
public final class JdbcJobStores {

  private static final List<AbstractJdbcJobStore> STORES;
  private static final Map<String, AbstractJdbcJobStore> BY_NAME = new ConcurrentHashMap<>();

  static {
    STORES = ServiceLoader.load(AbstractJdbcJobStore.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();

    for (AbstractJdbcJobStore store : STORES) {
      BY_NAME.put(store.name().toLowerCase(Locale.ROOT), store);
    }
  }

  private JdbcJobStores() {
  }

  /**
   * Returns all registered store prototypes.
   */
  public static List<AbstractJdbcJobStore> all() {
    return STORES;
  }

  /**
   * Gets a store prototype by name.
   *
   * @param name store name (case-insensitive)
   * @throws IllegalArgumentException if no store is registered under that name
   */
  public static AbstractJdbcJobStore get(String name) {
    AbstractJdbcJobStore store = BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (store == null) {
      throw new IllegalArgumentException("Unknown job store: " + name +
          ". Available: " + BY_NAME.keySet());
    }
    return store;
  }

  /**
   * Detects the store from the URL of a connection obtained from {@code dataSource}.
   *
   * @throws IllegalStateException if the data source cannot be reached
   * @throws IllegalArgumentException if no store matches the URL
   */
  public static AbstractJdbcJobStore detect(DataSource dataSource) {
    try (Connection conn = dataSource.getConnection()) {
      String url = conn.getMetaData().getURL();
      return detect(url);
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect job store from DataSource", e);
    }
  }

  /**
   * Detects the store from a JDBC URL.
   *
   * @throws IllegalArgumentException if no store matches the URL
   */
  public static AbstractJdbcJobStore detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    String lower = jdbcUrl.toLowerCase(Locale.ROOT);
    for (AbstractJdbcJobStore store : STORES) {
      for (String prefix : store.jdbcUrlPrefixes()) {
        if (lower.startsWith(prefix.toLowerCase(Locale.ROOT))) {
          return store;
        }
      }
    }
    throw new IllegalArgumentException("No job store found for JDBC URL: " + jdbcUrl +
        ". Supported prefixes: " + allPrefixes());
  }

  /**
   * Detects the store for {@code dataSource} and binds it. The returned store does not close
   * the data source.
   */
  public static AbstractJdbcJobStore create(DataSource dataSource, JdbcStoreConfig config) {
    return detect(dataSource).bind(new DataSourceConnectionProvider(dataSource), config);
  }

  private static List<String> allPrefixes() {
    return STORES.stream()
        .flatMap(s -> s.jdbcUrlPrefixes().stream())
        .toList();
  }
}
