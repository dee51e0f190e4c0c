package ephemera.jdbc.store;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC content repositories with auto-detection support.
 *
 * <p>Repositories are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/ephemera.jdbc.store.AbstractJdbcContentRepository}.
 *
 * <pre>{@code
 * AbstractJdbcContentRepository repo = JdbcContentRepositories.detect(dataSource);
 * AbstractJdbcContentRepository custom = repo.withTables(tables);
 * EngagementStore edges = JdbcEngagementStores.forRepository(custom);
 * }</pre>
 */
public final class JdbcContentRepositories {

  private static final List<AbstractJdbcContentRepository> REPOSITORIES;
  private static final Map<String, AbstractJdbcContentRepository> BY_NAME = new ConcurrentHashMap<>();

  static {
    REPOSITORIES = ServiceLoader.load(AbstractJdbcContentRepository.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();

    for (AbstractJdbcContentRepository repository : REPOSITORIES) {
      BY_NAME.put(repository.name().toLowerCase(Locale.ROOT), repository);
    }
  }

  private JdbcContentRepositories() {
  }

  /**
   * Returns all registered repositories, bound to the default table names.
   */
  public static List<AbstractJdbcContentRepository> all() {
    return REPOSITORIES;
  }

  /**
   * Gets a repository by name.
   *
   * @param name repository name (case-insensitive)
   * @return the repository
   * @throws IllegalArgumentException if no repository is registered under that name
   */
  public static AbstractJdbcContentRepository get(String name) {
    AbstractJdbcContentRepository repository = BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (repository == null) {
      throw new IllegalArgumentException("Unknown content repository: " + name +
          ". Available: " + BY_NAME.keySet());
    }
    return repository;
  }

  /**
   * Auto-detects the repository from a DataSource's JDBC URL.
   *
   * @throws IllegalStateException if the URL cannot be read
   * @throws IllegalArgumentException if no repository matches the URL
   */
  public static AbstractJdbcContentRepository detect(DataSource dataSource) {
    String url;
    try (Connection conn = dataSource.getConnection()) {
      url = conn.getMetaData().getURL();
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect content repository from DataSource", e);
    }
    return detect(url);
  }

  /**
   * Auto-detects the repository from a JDBC URL.
   *
   * @throws IllegalArgumentException if the URL is empty or no repository matches it
   */
  public static AbstractJdbcContentRepository detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    String lower = jdbcUrl.toLowerCase(Locale.ROOT);
    for (AbstractJdbcContentRepository repository : REPOSITORIES) {
      for (String prefix : repository.jdbcUrlPrefixes()) {
        if (lower.startsWith(prefix.toLowerCase(Locale.ROOT))) {
          return repository;
        }
      }
    }
    throw new IllegalArgumentException("No content repository found for JDBC URL: " + jdbcUrl +
        ". Supported prefixes: " + allPrefixes());
  }

  private static List<String> allPrefixes() {
    return REPOSITORIES.stream()
        .flatMap(r -> r.jdbcUrlPrefixes().stream())
        .toList();
  }
}
