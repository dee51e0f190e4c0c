package ephemera.jdbc.store;

import ephemera.jdbc.TableNames;

import java.util.List;

/**
 * MySQL content repository. Also serves MariaDB and TiDB URLs.
 *
 * <p>Pair with {@link MySqlEngagementStore}, which uses MySQL's single-table
 * {@code DELETE ... LIMIT} for orphan reconciliation.
 */
public final class MySqlContentRepository extends AbstractJdbcContentRepository {

  public MySqlContentRepository() {
    super();
  }

  public MySqlContentRepository(TableNames tables) {
    super(tables);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:mariadb:", "jdbc:tidb:");
  }

  @Override
  public MySqlContentRepository withTables(TableNames tables) {
    return new MySqlContentRepository(tables);
  }
}
