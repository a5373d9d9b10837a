package relay.jdbc;

import relay.spi.ConnectionProvider;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Hands out connections from a {@link DataSource}, pooled or not.
 *
 * <p>The account manager and its tailers close every connection they take and set
 * auto-commit and isolation themselves, so the provider adds no wrapping of its own.
 */
public final class DataSourceConnectionProvider implements ConnectionProvider {
  private final DataSource source;

  public DataSourceConnectionProvider(DataSource source) {
    this.source = Objects.requireNonNull(source, "dataSource");
  }

  /** The backing data source, e.g. for {@link relay.jdbc.store.JdbcMessageStores#detect}. */
  public DataSource dataSource() {
    return source;
  }

  @Override
  public Connection getConnection() throws SQLException {
    Connection conn = source.getConnection();
    if (conn == null) {
      throw new SQLException("DataSource " + source + " returned no connection");
    }
    return conn;
  }
}
