package ephemera.jdbc.store;

import ephemera.jdbc.JdbcTemplate;
import ephemera.jdbc.TableNames;
import ephemera.model.ContentItem;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;

/**
 * PostgreSQL content repository.
 *
 * <p>The expired-items query uses the bare boolean predicate {@code WHERE is_ephemeral} so the
 * planner can match the partial index {@code ... (expires_at) WHERE is_ephemeral} from
 * {@code schema/postgresql.sql}.
 */
public final class PostgresContentRepository extends AbstractJdbcContentRepository {

  public PostgresContentRepository() {
    super();
  }

  public PostgresContentRepository(TableNames tables) {
    super(tables);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public PostgresContentRepository withTables(TableNames tables) {
    return new PostgresContentRepository(tables);
  }

  @Override
  public List<ContentItem> queryExpiredEphemeral(Connection conn, Instant now, int limit) {
    String sql = "SELECT " + COLUMNS + " FROM " + tables().content() +
        " WHERE is_ephemeral AND expires_at IS NOT NULL AND expires_at<?" +
        " ORDER BY expires_at LIMIT ?";
    return JdbcTemplate.query(conn, sql, ITEM_ROW_MAPPER, now, limit);
  }
}
