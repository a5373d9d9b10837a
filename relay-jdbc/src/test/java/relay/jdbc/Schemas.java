package relay.jdbc;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Loads the DDL scripts shipped in {@code schema/} into a test database.
 */
final class Schemas {

  private Schemas() {
  }

  static void create(Connection conn, String dialect) throws SQLException, IOException {
    String schema = load("/schema/" + dialect + ".sql");
    try (Statement st = conn.createStatement()) {
      for (String stmt : schema.split(";")) {
        String trimmed = stmt.trim();
        if (!trimmed.isEmpty()) {
          st.execute(trimmed);
        }
      }
    }
  }

  static void addAccount(Connection conn, String name, String kind, boolean enabled) throws SQLException {
    try (var ps = conn.prepareStatement("INSERT INTO account (name, kind, host, enabled) VALUES (?, ?, ?, ?)")) {
      ps.setString(1, name);
      ps.setString(2, kind);
      ps.setString(3, "irc.example.net:6667");
      ps.setBoolean(4, enabled);
      ps.executeUpdate();
    }
  }

  static void addChannel(Connection conn, String account, String name, String key) throws SQLException {
    try (var ps = conn.prepareStatement("INSERT INTO channel (account, name, chan_key) VALUES (?, ?, ?)")) {
      ps.setString(1, account);
      ps.setString(2, name);
      ps.setString(3, key);
      ps.executeUpdate();
    }
  }

  private static String load(String path) throws IOException {
    try (InputStream in = Schemas.class.getResourceAsStream(path)) {
      if (in == null) {
        throw new IOException("Missing resource " + path);
      }
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }
  }
}
