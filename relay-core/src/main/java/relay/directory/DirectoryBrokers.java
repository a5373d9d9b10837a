package relay.directory;

import relay.broker.ConnectionBroker;

import java.util.List;

/**
 * Factory for brokers that keep a directory connection alive.
 *
 * <pre>{@code
 * ConnectionBroker<Search, List<SearchResult>> ldap = DirectoryBrokers.dial(settings);
 * try (var conn = ldap.acquire()) {
 *   List<SearchResult> people = conn.request(Search.of(
 *       "(mozillaNickname=" + DirectoryFilters.escape(nick) + ")", "cn", "mail"));
 * }
 * }</pre>
 */
public final class DirectoryBrokers {
  public static final String NAME = "LDAP server";

  private DirectoryBrokers() {
  }

  /**
   * Starts a broker with default timings for the given server.
   */
  public static ConnectionBroker<Search, List<SearchResult>> dial(DirectorySettings settings) {
    return builder(settings).build();
  }

  /**
   * Returns a broker builder preconfigured with a JNDI dialer, for callers that want to
   * tune timings before starting it.
   */
  public static ConnectionBroker.Builder<Search, List<SearchResult>> builder(DirectorySettings settings) {
    return ConnectionBroker.builder(new JndiDirectoryDialer(settings)).name(NAME);
  }
}
