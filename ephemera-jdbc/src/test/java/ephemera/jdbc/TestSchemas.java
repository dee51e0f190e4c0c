package ephemera.jdbc;

import ephemera.model.ContentItem;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.UUID;

/**
 * Schema and fixture helpers shared by the JDBC tests.
 */
public final class TestSchemas {

  private TestSchemas() {}

  public static void apply(DataSource dataSource, String resource) throws SQLException, IOException {
    String schema;
    try (InputStream in = TestSchemas.class.getResourceAsStream(resource)) {
      if (in == null) {
        throw new IOException("Missing resource " + resource);
      }
      schema = new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }
    try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
      for (String sql : schema.split(";")) {
        String trimmed = sql.trim();
        if (!trimmed.isEmpty()) {
          stmt.execute(trimmed);
        }
      }
    }
  }

  public static void truncate(DataSource dataSource) throws SQLException {
    try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
      stmt.execute("DELETE FROM content_like");
      stmt.execute("DELETE FROM content_comment");
      stmt.execute("DELETE FROM content_item");
    }
  }

  public static ContentItem status(String id, Instant createdAt, Instant expiresAt, String mediaUrl) {
    return new ContentItem(id, "owner-1", "☕ カフェなう", mediaUrl, true, createdAt, expiresAt, 0, 0);
  }

  public static ContentItem durable(String id, Instant createdAt) {
    return new ContentItem(id, "owner-1", "hello", null, false, createdAt, null, 0, 0);
  }

  public static void like(Connection conn, String itemId) throws SQLException {
    try (PreparedStatement ps = conn.prepareStatement(
        "INSERT INTO content_like (id, item_id, user_id, created_at) VALUES (?,?,?,?)")) {
      ps.setString(1, UUID.randomUUID().toString());
      ps.setString(2, itemId);
      ps.setString(3, "fan");
      ps.setTimestamp(4, Timestamp.from(Instant.now()));
      ps.executeUpdate();
    }
  }

  public static void comment(Connection conn, String itemId) throws SQLException {
    try (PreparedStatement ps = conn.prepareStatement(
        "INSERT INTO content_comment (id, item_id, user_id, body, created_at) VALUES (?,?,?,?,?)")) {
      ps.setString(1, UUID.randomUUID().toString());
      ps.setString(2, itemId);
      ps.setString(3, "fan");
      ps.setString(4, "nice");
      ps.setTimestamp(5, Timestamp.from(Instant.now()));
      ps.executeUpdate();
    }
  }

  public static int count(Connection conn, String table, String itemId) throws SQLException {
    try (PreparedStatement ps = conn.prepareStatement(
        "SELECT COUNT(*) FROM " + table + " WHERE " + (table.equals("content_item") ? "id" : "item_id") + "=?")) {
      ps.setString(1, itemId);
      try (ResultSet rs = ps.executeQuery()) {
        rs.next();
        return rs.getInt(1);
      }
    }
  }

  public static int count(Connection conn, String table) throws SQLException {
    try (Statement stmt = conn.createStatement(); ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM " + table)) {
      rs.next();
      return rs.getInt(1);
    }
  }
}
