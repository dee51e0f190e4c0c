package ephemera.jdbc;

import ephemera.jdbc.store.MySqlContentRepository;
import ephemera.jdbc.store.MySqlEngagementStore;
import ephemera.model.EngagementKind;
import ephemera.model.SweepOutcome;
import ephemera.model.SweepResult;
import ephemera.sweep.ExpiredContentSweeper;
import ephemera.sweep.ItemCascade;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.MySQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.sql.Connection;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;

import static org.junit.jupiter.api.Assertions.*;

@DockerAvailable
@Testcontainers
class MySqlSweepIntegrationTest {

  @Container
  static final MySQLContainer<?> mysql = new MySQLContainer<>("mysql:8.0")
      .withDatabaseName("ephemera_sweep_test");

  private static SimpleDataSource dataSource;
  private final MySqlContentRepository repository = new MySqlContentRepository();
  private final MySqlEngagementStore engagements = new MySqlEngagementStore();

  @BeforeAll
  static void initSchema() throws Exception {
    dataSource = new SimpleDataSource(mysql.getJdbcUrl(), mysql.getUsername(), mysql.getPassword());
    TestSchemas.apply(dataSource, "/schema/mysql.sql");
  }

  @BeforeEach
  void truncate() throws Exception {
    TestSchemas.truncate(dataSource);
  }

  private ExpiredContentSweeper sweeper(Instant now) {
    DataSourceConnectionProvider provider = new DataSourceConnectionProvider(dataSource);
    ItemCascade cascade = ItemCascade.builder()
        .connectionProvider(provider)
        .contentRepository(repository)
        .engagementStore(engagements)
        .blobStore(path -> { })
        .build();
    return ExpiredContentSweeper.builder()
        .connectionProvider(provider)
        .contentRepository(repository)
        .engagementStore(engagements)
        .cascade(cascade)
        .reconcileOrphans(true)
        .clock(Clock.fixed(now, ZoneOffset.UTC))
        .build();
  }

  @Test
  void sweepsExpiredStatusWithEngagement() throws Exception {
    Instant created = Instant.now().truncatedTo(ChronoUnit.SECONDS).minus(Duration.ofHours(4));
    try (Connection conn = dataSource.getConnection()) {
      repository.insert(conn, TestSchemas.status("s1", created, created.plus(Duration.ofHours(3)), null));
      repository.insert(conn, TestSchemas.status("alive", created, created.plus(Duration.ofHours(5)), null));
      TestSchemas.like(conn, "s1");
      TestSchemas.like(conn, "s1");
      TestSchemas.comment(conn, "s1");
    }

    SweepResult result = sweeper(created.plus(Duration.ofHours(4))).sweep();

    assertEquals(SweepOutcome.SUCCESS, result.outcome());
    assertEquals(1, result.deletedItems());
    assertEquals(2, result.deletedLikeEdges());
    assertEquals(1, result.deletedCommentEdges());
    try (Connection conn = dataSource.getConnection()) {
      assertEquals(0, TestSchemas.count(conn, "content_item", "s1"));
      assertEquals(1, TestSchemas.count(conn, "content_item", "alive"));
    }
  }

  @Test
  void orphanReconciliationIsBounded() throws Exception {
    try (Connection conn = dataSource.getConnection()) {
      for (int i = 0; i < 5; i++) {
        TestSchemas.like(conn, "gone");
      }
      assertEquals(3, engagements.deleteOrphans(conn, EngagementKind.LIKE, 3));
      assertEquals(2, engagements.deleteOrphans(conn, EngagementKind.LIKE, 3));
      assertEquals(0, TestSchemas.count(conn, "content_like"));
    }
  }
}
