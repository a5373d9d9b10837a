package relay.jdbc.store;

import relay.jdbc.JdbcTemplate;
import relay.model.Lane;
import relay.model.Message;

import java.sql.Connection;
import java.util.List;

/**
 * PostgreSQL message store.
 *
 * <p>Uses {@code ON CONFLICT DO NOTHING} for echo inserts so a replay never aborts the
 * surrounding transaction.
 */
public final class PostgresMessageStore extends AbstractJdbcMessageStore {

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public boolean insertIfAbsent(Connection conn, Message message, Lane lane) {
    String sql = "INSERT INTO message (" + INSERT_COLUMNS + ") VALUES (" + INSERT_PLACEHOLDERS + ")" +
        " ON CONFLICT (nonce, lane) DO NOTHING";
    return JdbcTemplate.update(conn, sql, insertParams(message, lane)) > 0;
  }
}
