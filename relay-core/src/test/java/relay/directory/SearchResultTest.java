package relay.directory;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SearchResultTest {

  @Test
  void valueReturnsFirstValue() {
    Map<String, List<String>> attrs = new LinkedHashMap<>();
    attrs.put("cn", List.of("Albert Einstein"));
    attrs.put("objectClass", List.of("inetOrgPerson", "organizationalPerson", "person", "top"));
    SearchResult result = new SearchResult("uid=einstein,dc=example,dc=com", attrs);

    assertEquals("Albert Einstein", result.value("cn"));
    assertEquals("inetOrgPerson", result.value("objectClass"));
    assertEquals(4, result.values("objectClass").size());
  }

  @Test
  void missingAttributeIsEmpty() {
    SearchResult result = new SearchResult("uid=tesla,dc=example,dc=com", null);

    assertEquals("", result.value("mail"));
    assertTrue(result.values("mail").isEmpty());
  }

  @Test
  void attributesAreImmutable() {
    SearchResult result = new SearchResult("dn", Map.of("cn", List.of("x")));

    assertThrows(UnsupportedOperationException.class, () -> result.attributes().put("mail", List.of()));
  }
}
