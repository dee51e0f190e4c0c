package ephemera.jdbc.store;

import ephemera.jdbc.JdbcTemplate;
import ephemera.jdbc.TableNames;
import ephemera.model.EngagementKind;
import ephemera.spi.EngagementStore;

import java.sql.Connection;
import java.util.Objects;

/**
 * JDBC engagement store for like and comment edge tables.
 *
 * <p>Both edge tables need an {@code id} primary key and the configured parent column. Orphan
 * reconciliation deletes a bounded batch through an {@code id IN (subquery LIMIT n)} statement,
 * which H2 and PostgreSQL accept; MySQL rejects {@code LIMIT} in such subqueries and uses
 * {@link MySqlEngagementStore}.
 */
public class JdbcEngagementStore implements EngagementStore {

  private final TableNames tables;

  public JdbcEngagementStore() {
    this(TableNames.DEFAULT);
  }

  public JdbcEngagementStore(TableNames tables) {
    this.tables = Objects.requireNonNull(tables, "tables");
  }

  protected TableNames tables() {
    return tables;
  }

  protected String tableFor(EngagementKind kind) {
    return switch (kind) {
      case LIKE -> tables.likes();
      case COMMENT -> tables.comments();
    };
  }

  @Override
  public int deleteByParent(Connection conn, String parentId, EngagementKind kind) {
    String sql = "DELETE FROM " + tableFor(kind) + " WHERE " + tables.parentColumn() + "=?";
    return JdbcTemplate.update(conn, sql, parentId);
  }

  @Override
  public int deleteOrphans(Connection conn, EngagementKind kind, int limit) {
    String edges = tableFor(kind);
    String sql = "DELETE FROM " + edges + " WHERE id IN (" +
        "SELECT e.id FROM " + edges + " e WHERE NOT EXISTS (" +
        "SELECT 1 FROM " + tables.content() + " c WHERE c.id = e." + tables.parentColumn() + ")" +
        " LIMIT ?)";
    return JdbcTemplate.update(conn, sql, limit);
  }
}
