package relay.jdbc.store;

import relay.jdbc.JdbcTemplate;
import relay.jdbc.MessageStoreException;
import relay.model.AccountInfo;
import relay.model.ChannelInfo;
import relay.model.Lane;
import relay.model.Message;
import relay.spi.MessageStore;

import java.sql.Connection;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base JDBC message store with standard SQL implementations.
 *
 * <p>Expects the {@code message}, {@code account} and {@code channel} tables from the
 * {@code schema/*.sql} scripts shipped with this module. Subclasses override
 * {@link #insertIfAbsent} where the database has a native conflict clause. Register custom
 * implementations via {@code META-INF/services/relay.jdbc.store.AbstractJdbcMessageStore}.
 *
 * <p>Message parameters are stored in one column using the IRC convention: space
 * separated, with a final parameter that contains spaces (or is empty, or starts with a
 * colon) prefixed by {@code :}.
 *
 * @see JdbcMessageStores
 */
public abstract class AbstractJdbcMessageStore implements MessageStore {

  protected static final String MESSAGE_COLUMNS =
      "id, nonce, lane, created_at, account, channel, nick, user_name, host, command, " +
      "params, text, bot_text, bang, as_nick";

  protected static final String INSERT_COLUMNS =
      "nonce, lane, created_at, account, channel, nick, user_name, host, command, " +
      "params, text, bot_text, bang, as_nick";

  protected static final String INSERT_PLACEHOLDERS = "?,?,?,?,?,?,?,?,?,?,?,?,?,?";

  protected static final JdbcTemplate.RowMapper<Message> MESSAGE_ROW_MAPPER = rs -> Message.builder()
      .id(rs.getLong("id"))
      .nonce(rs.getString("nonce"))
      .lane(Lane.fromCode(rs.getInt("lane")))
      .time(rs.getTimestamp("created_at").toInstant())
      .account(rs.getString("account"))
      .channel(rs.getString("channel"))
      .nick(rs.getString("nick"))
      .user(rs.getString("user_name"))
      .host(rs.getString("host"))
      .command(rs.getString("command"))
      .params(splitParams(rs.getString("params")))
      .text(rs.getString("text"))
      .botText(rs.getString("bot_text"))
      .bang(rs.getString("bang"))
      .asNick(rs.getString("as_nick"))
      .build();

  private static final JdbcTemplate.RowMapper<AccountInfo> ACCOUNT_ROW_MAPPER = rs -> new AccountInfo(
      rs.getString("name"),
      rs.getString("kind"),
      rs.getString("endpoint"),
      rs.getString("host"),
      rs.getBoolean("tls"),
      rs.getBoolean("tls_insecure"),
      rs.getString("nick"),
      rs.getString("identify"),
      rs.getString("password"),
      rs.getLong("last_id"),
      rs.getBoolean("enabled"),
      List.of());

  private static final JdbcTemplate.RowMapper<ChannelInfo> CHANNEL_ROW_MAPPER = rs -> new ChannelInfo(
      rs.getString("account"),
      rs.getString("name"),
      rs.getString("chan_key"));

  /**
   * Unique identifier for this message store (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this message store handles (e.g., "jdbc:mysql:", "jdbc:mariadb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  @Override
  public long insert(Connection conn, Message message, Lane lane) {
    String sql = "INSERT INTO message (" + INSERT_COLUMNS + ") VALUES (" + INSERT_PLACEHOLDERS + ")";
    return JdbcTemplate.insertReturningKey(conn, sql, "id", insertParams(message, lane));
  }

  /**
   * Inserts the message and treats a {@code (nonce, lane)} conflict as "already present".
   * Requires auto-commit, or a database that keeps the transaction usable after a
   * constraint violation.
   */
  @Override
  public boolean insertIfAbsent(Connection conn, Message message, Lane lane) {
    try {
      insert(conn, message, lane);
      return true;
    } catch (MessageStoreException e) {
      if (e.isDuplicateKey()) {
        return false;
      }
      throw e;
    }
  }

  @Override
  public List<Message> queryOutgoing(Connection conn, String account, long afterId, int limit) {
    String sql = "SELECT " + MESSAGE_COLUMNS + " FROM message" +
        " WHERE lane = ? AND account = ? AND id > ? ORDER BY id LIMIT ?";
    return JdbcTemplate.query(conn, sql, MESSAGE_ROW_MAPPER,
        Lane.OUTGOING.code(), account, afterId, limit);
  }

  @Override
  public List<AccountInfo> loadAccounts(Connection conn) {
    List<AccountInfo> accounts = JdbcTemplate.query(conn,
        "SELECT name, kind, endpoint, host, tls, tls_insecure, nick, identify, password, last_id, enabled" +
            " FROM account ORDER BY name",
        ACCOUNT_ROW_MAPPER);
    List<ChannelInfo> channels = JdbcTemplate.query(conn,
        "SELECT account, name, chan_key FROM channel ORDER BY account, name",
        CHANNEL_ROW_MAPPER);

    Map<String, List<ChannelInfo>> byAccount = new LinkedHashMap<>();
    for (ChannelInfo channel : channels) {
      byAccount.computeIfAbsent(channel.account(), k -> new ArrayList<>()).add(channel);
    }
    List<AccountInfo> result = new ArrayList<>(accounts.size());
    for (AccountInfo account : accounts) {
      result.add(account.withChannels(byAccount.getOrDefault(account.name(), List.of())));
    }
    return result;
  }

  @Override
  public int updateCursor(Connection conn, String account, long lastId) {
    return JdbcTemplate.update(conn,
        "UPDATE account SET last_id = ? WHERE name = ? AND last_id < ?",
        lastId, account, lastId);
  }

  @Override
  public long maxMessageId(Connection conn) {
    List<Long> max = JdbcTemplate.query(conn,
        "SELECT COALESCE(MAX(id), 0) AS max_id FROM message",
        rs -> rs.getLong("max_id"));
    return max.isEmpty() ? 0L : max.get(0);
  }

  protected static Object[] insertParams(Message message, Lane lane) {
    return new Object[]{
        message.nonce(), lane.code(), Timestamp.from(message.time()), message.account(),
        message.channel(), message.nick(), message.user(), message.host(), message.command(),
        joinParams(message.params()), message.text(), message.botText(), message.bang(),
        message.asNick()};
  }

  static String joinParams(List<String> params) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < params.size(); i++) {
      String param = params.get(i);
      if (i > 0) {
        sb.append(' ');
      }
      if (i == params.size() - 1
          && (param.isEmpty() || param.indexOf(' ') >= 0 || param.startsWith(":"))) {
        sb.append(':');
      }
      sb.append(param);
    }
    return sb.toString();
  }

  static List<String> splitParams(String joined) {
    List<String> params = new ArrayList<>();
    if (joined == null || joined.isEmpty()) {
      return params;
    }
    int start = 0;
    while (start <= joined.length()) {
      if (start < joined.length() && joined.charAt(start) == ':') {
        params.add(joined.substring(start + 1));
        break;
      }
      int space = joined.indexOf(' ', start);
      if (space < 0) {
        params.add(joined.substring(start));
        break;
      }
      params.add(joined.substring(start, space));
      start = space + 1;
    }
    return params;
  }
}
