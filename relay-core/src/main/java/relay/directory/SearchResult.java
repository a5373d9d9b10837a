package relay.directory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One entry returned by a {@link Search}.
 *
 * @param dn         distinguished name of the entry
 * @param attributes attribute values by attribute name, in server order
 */
public record SearchResult(String dn, Map<String, List<String>> attributes) {

  public SearchResult {
    Objects.requireNonNull(dn, "dn");
    Map<String, List<String>> copy = new LinkedHashMap<>();
    if (attributes != null) {
      attributes.forEach((name, values) -> copy.put(name, List.copyOf(values)));
    }
    attributes = Collections.unmodifiableMap(copy);
  }

  /** All values of an attribute, or an empty list when the entry has none. */
  public List<String> values(String name) {
    return attributes.getOrDefault(name, List.of());
  }

  /** The first value of an attribute, or {@code ""} when the entry has none. */
  public String value(String name) {
    List<String> values = values(name);
    return values.isEmpty() ? "" : values.get(0);
  }
}
