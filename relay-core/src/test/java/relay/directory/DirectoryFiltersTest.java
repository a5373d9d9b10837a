package relay.directory;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class DirectoryFiltersTest {

  @Test
  void escapesFilterMetacharacters() {
    assertEquals("a\\00b\\28c\\29d\\2ae\\5cf", DirectoryFilters.escape("a\u0000b(c)d*e\\f"));
  }

  @Test
  void escapesNonAsciiAsUtf8Bytes() {
    assertEquals("Lu\\c4\\8di\\c4\\87", DirectoryFilters.escape("Lučić"));
  }

  @Test
  void leavesPlainTextAlone() {
    assertEquals("einstein", DirectoryFilters.escape("einstein"));
    assertEquals("", DirectoryFilters.escape(""));
  }
}
