package relay.directory;

import java.util.Objects;

/**
 * Where and how to reach the directory server.
 *
 * @param url          {@code ldap://host:port}, {@code ldaps://host:port} or a bare
 *                     {@code host:port} (plain LDAP)
 * @param baseDn       subtree searched by every query
 * @param bindDn       DN to bind as; blank for anonymous access
 * @param bindPassword password for {@code bindDn}
 */
public record DirectorySettings(String url, String baseDn, String bindDn, String bindPassword) {

  public DirectorySettings {
    Objects.requireNonNull(url, "url");
    if (url.isBlank()) {
      throw new IllegalArgumentException("url must not be blank");
    }
    baseDn = baseDn == null ? "" : baseDn;
    bindDn = bindDn == null ? "" : bindDn;
    bindPassword = bindPassword == null ? "" : bindPassword;
  }

  /** The server URL with an explicit scheme. */
  public String providerUrl() {
    if (url.startsWith("ldap://") || url.startsWith("ldaps://")) {
      return url;
    }
    return "ldap://" + url;
  }

  public boolean tls() {
    return url.startsWith("ldaps://");
  }

  @Override
  public String toString() {
    return "DirectorySettings[url=" + url + ", baseDn=" + baseDn + ", bindDn=" + bindDn
        + ", bindPassword=" + (bindPassword.isEmpty() ? "" : "********") + "]";
  }
}
