package relay.directory;

import relay.broker.Dialer;
import relay.broker.ManagedConnection;

import javax.naming.AuthenticationException;
import javax.naming.Context;
import javax.naming.NamingEnumeration;
import javax.naming.NamingException;
import javax.naming.directory.Attribute;
import javax.naming.directory.SearchControls;
import javax.naming.ldap.InitialLdapContext;
import javax.naming.ldap.LdapContext;
import java.util.ArrayList;
import java.util.Hashtable;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Opens directory connections through the JDK's JNDI LDAP provider. An {@code ldaps://}
 * URL connects over TLS.
 */
public final class JndiDirectoryDialer implements Dialer<Search, List<SearchResult>> {
  private static final Logger logger = Logger.getLogger(JndiDirectoryDialer.class.getName());

  static final String PING_FILTER = "(mozillaNickname=this-query-is-just-a-ping)";
  private static final String CONNECT_TIMEOUT_MS = "5000";
  private static final String READ_TIMEOUT_MS = "10000";

  private final DirectorySettings settings;

  public JndiDirectoryDialer(DirectorySettings settings) {
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  @Override
  public ManagedConnection<Search, List<SearchResult>> dial() throws DirectoryException {
    Hashtable<String, Object> env = new Hashtable<>();
    env.put(Context.INITIAL_CONTEXT_FACTORY, "com.sun.jndi.ldap.LdapCtxFactory");
    env.put(Context.PROVIDER_URL, settings.providerUrl());
    env.put("com.sun.jndi.ldap.connect.timeout", CONNECT_TIMEOUT_MS);
    env.put("com.sun.jndi.ldap.read.timeout", READ_TIMEOUT_MS);
    if (settings.tls()) {
      env.put(Context.SECURITY_PROTOCOL, "ssl");
    }
    if (settings.bindDn().isEmpty()) {
      env.put(Context.SECURITY_AUTHENTICATION, "none");
    } else {
      env.put(Context.SECURITY_AUTHENTICATION, "simple");
      env.put(Context.SECURITY_PRINCIPAL, settings.bindDn());
      env.put(Context.SECURITY_CREDENTIALS, settings.bindPassword());
    }
    try {
      return new JndiConnection(new InitialLdapContext(env, null), settings.baseDn());
    } catch (AuthenticationException e) {
      throw new DirectoryException("cannot bind to directory server: " + mask(e.getMessage()), e);
    } catch (NamingException e) {
      throw new DirectoryException("cannot dial directory server: " + mask(e.getMessage()), e);
    }
  }

  String mask(String message) {
    if (message == null) {
      return "unknown error";
    }
    String password = settings.bindPassword();
    return password.isEmpty() ? message : message.replace(password, "********");
  }

  private static final class JndiConnection implements ManagedConnection<Search, List<SearchResult>> {
    private final LdapContext ctx;
    private final String baseDn;

    JndiConnection(LdapContext ctx, String baseDn) {
      this.ctx = ctx;
      this.baseDn = baseDn;
    }

    @Override
    public List<SearchResult> execute(Search search) throws DirectoryException {
      try {
        return search(search.filter(), search.attributes());
      } catch (NamingException e) {
        throw new DirectoryException("cannot search directory server: " + e.getMessage(), e);
      }
    }

    @Override
    public void ping() throws NamingException {
      search(PING_FILTER, List.of("mozillaNickname"));
    }

    private List<SearchResult> search(String filter, List<String> attributes) throws NamingException {
      SearchControls controls = new SearchControls();
      controls.setSearchScope(SearchControls.SUBTREE_SCOPE);
      controls.setDerefLinkFlag(false);
      if (!attributes.isEmpty()) {
        controls.setReturningAttributes(attributes.toArray(new String[0]));
      }
      List<SearchResult> results = new ArrayList<>();
      NamingEnumeration<javax.naming.directory.SearchResult> entries = ctx.search(baseDn, filter, controls);
      try {
        while (entries.hasMore()) {
          javax.naming.directory.SearchResult entry = entries.next();
          Map<String, List<String>> attrs = new LinkedHashMap<>();
          NamingEnumeration<? extends Attribute> all = entry.getAttributes().getAll();
          while (all.hasMore()) {
            Attribute attr = all.next();
            List<String> values = new ArrayList<>();
            for (int i = 0; i < attr.size(); i++) {
              values.add(String.valueOf(attr.get(i)));
            }
            attrs.put(attr.getID(), values);
          }
          results.add(new SearchResult(entry.getNameInNamespace(), attrs));
        }
      } finally {
        entries.close();
      }
      return results;
    }

    @Override
    public void close() {
      try {
        ctx.close();
      } catch (NamingException e) {
        logger.log(Level.FINE, "Error closing directory connection", e);
      }
    }
  }
}
