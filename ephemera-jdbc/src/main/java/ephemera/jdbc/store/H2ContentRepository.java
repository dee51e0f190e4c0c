package ephemera.jdbc.store;

import ephemera.jdbc.TableNames;

import java.util.List;

/**
 * H2 content repository. Primarily for testing.
 */
public final class H2ContentRepository extends AbstractJdbcContentRepository {

  public H2ContentRepository() {
    super();
  }

  public H2ContentRepository(TableNames tables) {
    super(tables);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  public H2ContentRepository withTables(TableNames tables) {
    return new H2ContentRepository(tables);
  }
}
