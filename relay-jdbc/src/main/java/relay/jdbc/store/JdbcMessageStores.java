package relay.jdbc.store;

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
 * Registry for JDBC message stores with auto-detection support.
 *
 * <p>Message stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/relay.jdbc.store.AbstractJdbcMessageStore}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Auto-detect from DataSource
 * AbstractJdbcMessageStore store = JdbcMessageStores.detect(dataSource);
 *
 * // Auto-detect from JDBC URL
 * AbstractJdbcMessageStore store = JdbcMessageStores.detect("jdbc:mysql://localhost/relay");
 *
 * // Get by name
 * AbstractJdbcMessageStore store = JdbcMessageStores.get("postgresql");
 * }</pre>
 */
public final class JdbcMessageStores {

    private static final List<AbstractJdbcMessageStore> STORES;
    private static final Map<String, AbstractJdbcMessageStore> BY_NAME = new ConcurrentHashMap<>();

    static {
        STORES = ServiceLoader.load(AbstractJdbcMessageStore.class)
                .stream()
                .map(ServiceLoader.Provider::get)
                .toList();

        for (AbstractJdbcMessageStore store : STORES) {
            BY_NAME.put(store.name().toLowerCase(Locale.ROOT), store);
        }
    }

    private JdbcMessageStores() {
    }

    /**
     * Returns all registered message stores.
     */
    public static List<AbstractJdbcMessageStore> all() {
        return STORES;
    }

    /**
     * Gets a message store by name.
     *
     * @param name message store name (case-insensitive)
     * @throws IllegalArgumentException if no message store has that name
     */
    public static AbstractJdbcMessageStore get(String name) {
        Objects.requireNonNull(name, "name");
        AbstractJdbcMessageStore store = BY_NAME.get(name.toLowerCase(Locale.ROOT));
        if (store == null) {
            throw new IllegalArgumentException("Unknown message store: " + name +
                    ". Available: " + BY_NAME.keySet());
        }
        return store;
    }

    /**
     * Auto-detects the message store from a DataSource.
     *
     * @throws IllegalStateException if the connection metadata cannot be read or no store matches
     */
    public static AbstractJdbcMessageStore detect(DataSource dataSource) {
        try (Connection conn = dataSource.getConnection()) {
            String url = conn.getMetaData().getURL();
            return detect(url);
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to detect message store from DataSource", e);
        }
    }

    /**
     * Auto-detects the message store from a JDBC URL.
     *
     * @throws IllegalArgumentException if no matching message store is found
     */
    public static AbstractJdbcMessageStore detect(String jdbcUrl) {
        if (jdbcUrl == null || jdbcUrl.isEmpty()) {
            throw new IllegalArgumentException("JDBC URL cannot be null or empty");
        }

        String lower = jdbcUrl.toLowerCase(Locale.ROOT);
        for (AbstractJdbcMessageStore store : STORES) {
            for (String prefix : store.jdbcUrlPrefixes()) {
                if (lower.startsWith(prefix.toLowerCase(Locale.ROOT))) {
                    return store;
                }
            }
        }

        throw new IllegalArgumentException("No message store found for JDBC URL: " + jdbcUrl +
                ". Supported prefixes: " + allPrefixes());
    }

    private static List<String> allPrefixes() {
        return STORES.stream()
                .flatMap(s -> s.jdbcUrlPrefixes().stream())
                .toList();
    }
}
