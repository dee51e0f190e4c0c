package ephemera.jdbc.store;

import ephemera.jdbc.TableNames;

/**
 * Picks the engagement store matching a content repository's database.
 */
public final class JdbcEngagementStores {

  private JdbcEngagementStores() {
  }

  public static JdbcEngagementStore forRepository(AbstractJdbcContentRepository repository) {
    return forDatabase(repository.name(), repository.tables());
  }

  public static JdbcEngagementStore forDatabase(String name, TableNames tables) {
    if ("mysql".equalsIgnoreCase(name)) {
      return new MySqlEngagementStore(tables);
    }
    return new JdbcEngagementStore(tables);
  }
}
