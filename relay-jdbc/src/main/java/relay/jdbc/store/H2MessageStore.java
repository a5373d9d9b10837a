package relay.jdbc.store;

import java.util.List;

/**
 * Message store for H2 2.x, used by the test suites and by embedded single-process setups.
 *
 * <p>H2 reports a {@code (nonce, lane)} conflict with SQLState {@code 23505} and leaves the
 * transaction usable, so the inherited {@link #insertIfAbsent} applies unchanged.
 */
public final class H2MessageStore extends AbstractJdbcMessageStore {
  static final String NAME = "h2";
  private static final List<String> URL_PREFIXES = List.of("jdbc:h2:");

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return URL_PREFIXES;
  }
}
