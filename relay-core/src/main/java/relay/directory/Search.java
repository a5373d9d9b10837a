package relay.directory;

import java.util.List;
import java.util.Objects;

/**
 * A subtree search below the configured base DN.
 *
 * @param filter     RFC 4515 filter; escape user input with {@link DirectoryFilters#escape}
 * @param attributes attributes to return; empty returns all user attributes
 */
public record Search(String filter, List<String> attributes) {

  public Search {
    Objects.requireNonNull(filter, "filter");
    attributes = attributes == null ? List.of() : List.copyOf(attributes);
  }

  public static Search of(String filter, String... attributes) {
    return new Search(filter, List.of(attributes));
  }
}
