package ephemera.jdbc.store;

import ephemera.jdbc.JdbcTemplate;
import ephemera.jdbc.TableNames;
import ephemera.model.EngagementKind;

import java.sql.Connection;

/**
 * MySQL engagement store. Reconciles orphans with a single-table {@code DELETE ... LIMIT}.
 */
public final class MySqlEngagementStore extends JdbcEngagementStore {

  public MySqlEngagementStore() {
    super();
  }

  public MySqlEngagementStore(TableNames tables) {
    super(tables);
  }

  @Override
  public int deleteOrphans(Connection conn, EngagementKind kind, int limit) {
    String edges = tableFor(kind);
    String sql = "DELETE FROM " + edges + " WHERE NOT EXISTS (" +
        "SELECT 1 FROM " + tables().content() + " c WHERE c.id = " + edges + "." + tables().parentColumn() + ")" +
        " LIMIT ?";
    return JdbcTemplate.update(conn, sql, limit);
  }
}
