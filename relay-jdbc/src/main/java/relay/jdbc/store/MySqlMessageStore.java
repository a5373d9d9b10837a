package relay.jdbc.store;

import java.util.List;

/**
 * MySQL / MariaDB message store.
 *
 * <p>Echo inserts rely on the duplicate-entry error (1062) rather than
 * {@code INSERT IGNORE}, which would also hide truncation and conversion errors.
 */
public final class MySqlMessageStore extends AbstractJdbcMessageStore {

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:mariadb:");
  }
}
