package ephemera.jdbc.store;

import ephemera.jdbc.JdbcTemplate;
import ephemera.jdbc.TableNames;
import ephemera.model.ContentItem;
import ephemera.spi.ContentRepository;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Base JDBC content repository with standard SQL implementations.
 *
 * <p>Subclasses name the database they serve and may override individual statements. Register
 * custom implementations via
 * {@code META-INF/services/ephemera.jdbc.store.AbstractJdbcContentRepository}.
 *
 * @see JdbcContentRepositories
 */
public abstract class AbstractJdbcContentRepository implements ContentRepository {

  protected static final String COLUMNS =
      "id, owner_id, body, media_url, is_ephemeral, created_at, expires_at, like_count, comment_count";

  protected static final JdbcTemplate.RowMapper<ContentItem> ITEM_ROW_MAPPER = rs -> new ContentItem(
      rs.getString("id"),
      rs.getString("owner_id"),
      rs.getString("body"),
      rs.getString("media_url"),
      rs.getBoolean("is_ephemeral"),
      JdbcTemplate.instant(rs, "created_at"),
      JdbcTemplate.instant(rs, "expires_at"),
      rs.getInt("like_count"),
      rs.getInt("comment_count"));

  private final TableNames tables;

  protected AbstractJdbcContentRepository() {
    this(TableNames.DEFAULT);
  }

  protected AbstractJdbcContentRepository(TableNames tables) {
    this.tables = Objects.requireNonNull(tables, "tables");
  }

  /**
   * Unique identifier for this repository (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this repository handles (e.g., "jdbc:mysql:", "jdbc:mariadb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a repository of the same kind bound to other table names.
   */
  public abstract AbstractJdbcContentRepository withTables(TableNames tables);

  public TableNames tables() {
    return tables;
  }

  @Override
  public void insert(Connection conn, ContentItem item) {
    String sql = "INSERT INTO " + tables.content() + " (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?)";
    JdbcTemplate.update(conn, sql,
        item.id(), item.ownerId(), item.body(), item.mediaUrl(), item.ephemeral(),
        item.createdAt(), item.expiresAt(), item.likeCount(), item.commentCount());
  }

  @Override
  public Optional<ContentItem> findById(Connection conn, String id) {
    String sql = "SELECT " + COLUMNS + " FROM " + tables.content() + " WHERE id=?";
    List<ContentItem> rows = JdbcTemplate.query(conn, sql, ITEM_ROW_MAPPER, id);
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  @Override
  public List<ContentItem> queryExpiredEphemeral(Connection conn, Instant now, int limit) {
    String sql = "SELECT " + COLUMNS + " FROM " + tables.content() +
        " WHERE is_ephemeral=? AND expires_at IS NOT NULL AND expires_at<?" +
        " ORDER BY expires_at LIMIT ?";
    return JdbcTemplate.query(conn, sql, ITEM_ROW_MAPPER, true, now, limit);
  }

  @Override
  public int delete(Connection conn, String id) {
    return JdbcTemplate.update(conn, "DELETE FROM " + tables.content() + " WHERE id=?", id);
  }
}
