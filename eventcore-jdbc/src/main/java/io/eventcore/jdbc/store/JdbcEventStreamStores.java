package io.eventcore.jdbc.store;

import io.eventcore.util.JsonCodec;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of JDBC event stream stores with auto-detection support.
 *
 * <p>Stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/io.eventcore.jdbc.store.AbstractJdbcEventStreamStore}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * AbstractJdbcEventStreamStore store = JdbcEventStreamStores.detect(dataSource);
 * AbstractJdbcEventStreamStore pg = JdbcEventStreamStores.get("postgresql");
 * }</pre>
 */
public final class JdbcEventStreamStores {

  private static final List<AbstractJdbcEventStreamStore> STORES;
  private static final Map<String, AbstractJdbcEventStreamStore> BY_NAME = new ConcurrentHashMap<>();

  static {
    STORES = ServiceLoader.load(AbstractJdbcEventStreamStore.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();
    for (AbstractJdbcEventStreamStore store : STORES) {
      BY_NAME.put(store.name().toLowerCase(Locale.ROOT), store);
    }
  }

  private JdbcEventStreamStores() {
  }

  /**
   * Returns all registered stores, in service file order.
   */
  public static List<AbstractJdbcEventStreamStore> all() {
    return STORES;
  }

  /**
   * Gets a store by name.
   *
   * @param name store name (case-insensitive)
   * @return the store
   * @throws IllegalArgumentException if no store has this name
   */
  public static AbstractJdbcEventStreamStore get(String name) {
    Objects.requireNonNull(name, "name");
    AbstractJdbcEventStreamStore store = BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (store == null) {
      throw new IllegalArgumentException("Unknown event stream store: " + name
          + ". Available: " + BY_NAME.keySet());
    }
    return store;
  }

  /**
   * Auto-detects the store from the URL of a connection obtained from {@code dataSource}.
   *
   * @throws IllegalStateException if the connection or its metadata cannot be read
   * @throws IllegalArgumentException if no store matches the URL
   */
  public static AbstractJdbcEventStreamStore detect(DataSource dataSource) {
    Objects.requireNonNull(dataSource, "dataSource");
    try (Connection conn = dataSource.getConnection()) {
      return detect(conn.getMetaData().getURL());
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect event stream store from DataSource", e);
    }
  }

  /**
   * Auto-detects the store from a JDBC URL.
   *
   * @throws IllegalArgumentException if the URL is empty or no store matches it
   */
  public static AbstractJdbcEventStreamStore detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    String url = jdbcUrl.toLowerCase(Locale.ROOT);
    for (AbstractJdbcEventStreamStore store : STORES) {
      for (String prefix : store.jdbcUrlPrefixes()) {
        if (url.startsWith(prefix.toLowerCase(Locale.ROOT))) {
          return store;
        }
      }
    }
    throw new IllegalArgumentException("No event stream store found for JDBC URL: " + jdbcUrl
        + ". Supported prefixes: " + allPrefixes());
  }

  /**
   * Auto-detects the store from a JDBC URL and configures it with {@code jsonCodec}.
   */
  public static AbstractJdbcEventStreamStore detect(String jdbcUrl, JsonCodec jsonCodec) {
    Objects.requireNonNull(jsonCodec, "jsonCodec");
    return detect(jdbcUrl).withJsonCodec(jsonCodec);
  }

  private static List<String> allPrefixes() {
    return STORES.stream()
        .flatMap(s -> s.jdbcUrlPrefixes().stream())
        .toList();
  }
}
