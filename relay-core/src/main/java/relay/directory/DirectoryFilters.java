package relay.directory;

import java.nio.charset.StandardCharsets;

/**
 * Helpers for building search filters from untrusted input.
 */
public final class DirectoryFilters {
  private static final char[] HEX = "0123456789abcdef".toCharArray();

  private DirectoryFilters() {
  }

  /**
   * Escapes a value for inclusion in an RFC 4515 filter. NUL, {@code (}, {@code )},
   * {@code *}, {@code \} and every byte of a non-ASCII character are written as
   * {@code \xx} over the UTF-8 encoding.
   */
  public static String escape(String value) {
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    StringBuilder sb = new StringBuilder(bytes.length);
    for (byte b : bytes) {
      int c = b & 0xff;
      if (c == 0 || c == '(' || c == ')' || c == '*' || c == '\\' || c >= 0x80) {
        sb.append('\\').append(HEX[c >> 4]).append(HEX[c & 0x0f]);
      } else {
        sb.append((char) c);
      }
    }
    return sb.toString();
  }
}
