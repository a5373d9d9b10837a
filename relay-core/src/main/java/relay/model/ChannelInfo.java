package relay.model;

import java.util.Objects;

/**
 * A channel an account should be joined to, with its optional join key.
 */
public record ChannelInfo(String account, String name, String key) {
  public ChannelInfo {
    Objects.requireNonNull(account, "account");
    Objects.requireNonNull(name, "name");
    key = key == null ? "" : key;
  }
}
