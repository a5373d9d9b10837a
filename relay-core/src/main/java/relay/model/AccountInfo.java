package relay.model;

import java.util.List;
import java.util.Objects;

/**
 * Configuration snapshot for one account, as read from the account and channel tables.
 *
 * <p>Everything except {@code lastId} is administered externally. {@code lastId} is the
 * persisted delivery cursor into the outgoing lane and only ever moves forward.
 *
 * @param name        unique account name
 * @param kind        client kind ({@code irc}, {@code telegram}, {@code webhook}, ...); blank means irc
 * @param endpoint    service endpoint for HTTP-style kinds
 * @param host        {@code host:port} for socket-style kinds
 * @param tls         whether to connect with TLS
 * @param tlsInsecure whether to skip TLS certificate verification
 * @param nick        nick or identity to present
 * @param identify    password for nick identification services
 * @param password    server password
 * @param lastId      persisted delivery cursor, 0 if the account was never activated
 * @param enabled     whether the account should be running
 * @param channels    channels to join
 */
public record AccountInfo(
    String name,
    String kind,
    String endpoint,
    String host,
    boolean tls,
    boolean tlsInsecure,
    String nick,
    String identify,
    String password,
    long lastId,
    boolean enabled,
    List<ChannelInfo> channels
) {
  public AccountInfo {
    Objects.requireNonNull(name, "name");
    kind = kind == null ? "" : kind;
    endpoint = endpoint == null ? "" : endpoint;
    host = host == null ? "" : host;
    nick = nick == null ? "" : nick;
    identify = identify == null ? "" : identify;
    password = password == null ? "" : password;
    channels = channels == null ? List.of() : List.copyOf(channels);
  }

  public AccountInfo withChannels(List<ChannelInfo> channels) {
    return new AccountInfo(name, kind, endpoint, host, tls, tlsInsecure, nick, identify,
        password, lastId, enabled, channels);
  }

  public AccountInfo withNick(String nick) {
    return new AccountInfo(name, kind, endpoint, host, tls, tlsInsecure, nick, identify,
        password, lastId, enabled, channels);
  }

  public AccountInfo withLastId(long lastId) {
    return new AccountInfo(name, kind, endpoint, host, tls, tlsInsecure, nick, identify,
        password, lastId, enabled, channels);
  }

  @Override
  public String toString() {
    return "AccountInfo[name=" + name + ", kind=" + kind + ", host=" + host
        + ", endpoint=" + endpoint + ", tls=" + tls + ", nick=" + nick
        + ", lastId=" + lastId + ", enabled=" + enabled + ", channels=" + channels.size() + "]";
  }
}
