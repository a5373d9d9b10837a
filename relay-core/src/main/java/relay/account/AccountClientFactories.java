package relay.account;

import relay.spi.AccountClientFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;

/**
 * Lookup table from account kind to the {@link AccountClientFactory} that starts clients
 * of that kind.
 *
 * <p>Factories are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/relay.spi.AccountClientFactory}, or supplied explicitly.
 * Kinds are matched case-insensitively; an account with a blank kind is treated as
 * {@value #DEFAULT_KIND}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Everything on the classpath
 * AccountClientFactories factories = AccountClientFactories.discover();
 *
 * // Explicit set, e.g. in tests
 * AccountClientFactories factories = AccountClientFactories.of(List.of(new IrcClientFactory()));
 * }</pre>
 */
public final class AccountClientFactories {
  public static final String DEFAULT_KIND = "irc";

  private final Map<String, AccountClientFactory> byKind;

  private AccountClientFactories(Map<String, AccountClientFactory> byKind) {
    this.byKind = Collections.unmodifiableMap(byKind);
  }

  /**
   * Loads every factory registered with {@link ServiceLoader}.
   */
  public static AccountClientFactories discover() {
    return of(ServiceLoader.load(AccountClientFactory.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList());
  }

  /**
   * Builds a table from the given factories. A later factory replaces an earlier one
   * registered for the same kind.
   *
   * @throws NullPointerException     if the collection or an element is null
   * @throws IllegalArgumentException if a factory reports a blank kind
   */
  public static AccountClientFactories of(Collection<? extends AccountClientFactory> factories) {
    Objects.requireNonNull(factories, "factories");
    Map<String, AccountClientFactory> byKind = new LinkedHashMap<>();
    for (AccountClientFactory factory : factories) {
      Objects.requireNonNull(factory, "factory");
      byKind.put(normalize(factory.kind()), factory);
    }
    return new AccountClientFactories(byKind);
  }

  /**
   * Returns a table with the factories of {@code other} added on top of this one.
   */
  public AccountClientFactories with(AccountClientFactories other) {
    Map<String, AccountClientFactory> merged = new LinkedHashMap<>(byKind);
    merged.putAll(other.byKind);
    return new AccountClientFactories(merged);
  }

  /**
   * Finds the factory for an account kind.
   *
   * @param kind the account kind; blank selects {@value #DEFAULT_KIND}
   */
  public Optional<AccountClientFactory> forKind(String kind) {
    String key = kind == null || kind.isBlank() ? DEFAULT_KIND : kind.trim().toLowerCase(Locale.ROOT);
    return Optional.ofNullable(byKind.get(key));
  }

  /** The registered kinds, in registration order. */
  public Set<String> kinds() {
    return byKind.keySet();
  }

  private static String normalize(String kind) {
    if (kind == null || kind.isBlank()) {
      throw new IllegalArgumentException("Account client factory kind must not be blank");
    }
    return kind.trim().toLowerCase(Locale.ROOT);
  }
}
