package ephemera.spring.boot;

import ephemera.jdbc.DataSourceConnectionProvider;
import ephemera.jdbc.store.H2ContentRepository;
import ephemera.jdbc.store.JdbcEngagementStore;
import ephemera.jdbc.store.JdbcEngagementStores;
import ephemera.model.ContentItem;
import ephemera.spi.BlobStore;
import ephemera.spi.BlobStoreException;
import ephemera.spi.ConnectionProvider;
import ephemera.sweep.ExpiredContentSweeper;
import ephemera.sweep.ItemCascade;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.boot.test.context.runner.WebApplicationContextRunner;
import org.springframework.core.io.ClassPathResource;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class SweepControllerTest {

  private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");
  private static final String MEDIA_URL =
      "https://x.supabase.co/storage/v1/object/public/audio/owner-1/voice.m4a";

  private JdbcDataSource dataSource;
  private H2ContentRepository repository;
  private JdbcEngagementStore engagementStore;

  @BeforeEach
  void setUp() {
    dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:sweep_ctrl_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    new ResourceDatabasePopulator(new ClassPathResource("schema/h2.sql")).execute(dataSource);
    repository = new H2ContentRepository();
    engagementStore = JdbcEngagementStores.forRepository(repository);
  }

  @Test
  void nothingExpiredReturns200() {
    ResponseEntity<Map<String, Object>> response = controller(path -> {}, 1).sweep();

    assertEquals(200, response.getStatusCode().value());
    Map<String, Object> body = response.getBody();
    assertEquals(true, body.get("success"));
    assertEquals("No expired items to delete", body.get("message"));
    assertFalse(body.containsKey("error"));
  }

  @Test
  void expiredItemsDeletedReturns200WithCounts() throws SQLException {
    insertExpired("a", null);
    insertExpired("b", MEDIA_URL);

    ResponseEntity<Map<String, Object>> response = controller(path -> {}, 1).sweep();

    assertEquals(200, response.getStatusCode().value());
    Map<String, Object> body = response.getBody();
    @SuppressWarnings("unchecked")
    Map<String, Object> result = (Map<String, Object>) body.get("result");
    assertEquals(2, result.get("deletedPosts"));
    assertEquals(1, result.get("deletedAudioFiles"));
    assertEquals(List.of(), result.get("errors"));
    assertEquals("Successfully deleted 2 expired items", body.get("message"));
  }

  @Test
  void blobFailureReturns207() throws SQLException {
    insertExpired("a", MEDIA_URL);
    BlobStore failing = path -> {
      throw new BlobStoreException("storage unavailable");
    };

    ResponseEntity<Map<String, Object>> response = controller(failing, 1).sweep();

    assertEquals(207, response.getStatusCode().value());
    Map<String, Object> body = response.getBody();
    assertEquals(false, body.get("success"));
    assertEquals("Completed with 1 errors", body.get("message"));
    @SuppressWarnings("unchecked")
    Map<String, Object> result = (Map<String, Object>) body.get("result");
    assertEquals(1, result.get("deletedPosts"));
    assertEquals(List.of("Failed to delete blob for item a: storage unavailable"), result.get("errors"));
  }

  @Test
  void queryFailureReturns500() {
    ConnectionProvider broken = () -> {
      throw new SQLException("connection refused");
    };
    ItemCascade cascade = cascade(broken, path -> {});
    ExpiredContentSweeper sweeper = ExpiredContentSweeper.builder()
        .connectionProvider(broken)
        .contentRepository(repository)
        .cascade(cascade)
        .clock(Clock.fixed(NOW, ZoneOffset.UTC))
        .build();

    ResponseEntity<Map<String, Object>> response = new SweepController(sweeper).sweep();

    assertEquals(500, response.getStatusCode().value());
    Map<String, Object> body = response.getBody();
    assertEquals(false, body.get("success"));
    assertEquals("Failed to fetch expired items: connection refused", body.get("error"));
    assertEquals("Failed to fetch expired items", body.get("message"));
  }

  @Test
  void sweepThatThrowsReturns500() throws SQLException {
    insertExpired("a", null);
    ExpiredContentSweeper sweeper = sweeper(path -> {}, 2);
    sweeper.close();

    ResponseEntity<Map<String, Object>> response = new SweepController(sweeper).sweep();

    assertEquals(500, response.getStatusCode().value());
    Map<String, Object> body = response.getBody();
    assertEquals(false, body.get("success"));
    assertEquals("Fatal error occurred during sweep", body.get("message"));
    assertTrue(body.containsKey("error"));
  }

  @Test
  void controllerRegisteredInServletApplications() {
    new WebApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(
            DataSourceAutoConfiguration.class,
            EphemeraAutoConfiguration.class,
            EphemeraWebAutoConfiguration.class))
        .withPropertyValues(
            "spring.datasource.url=jdbc:h2:mem:sweep_ctrl_web;DB_CLOSE_DELAY=-1",
            "spring.datasource.driver-class-name=org.h2.Driver")
        .run(ctx -> assertTrue(ctx.containsBean("sweepController")));
  }

  @Test
  void controllerDisabledByProperty() {
    new WebApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(
            DataSourceAutoConfiguration.class,
            EphemeraAutoConfiguration.class,
            EphemeraWebAutoConfiguration.class))
        .withPropertyValues(
            "spring.datasource.url=jdbc:h2:mem:sweep_ctrl_off;DB_CLOSE_DELAY=-1",
            "spring.datasource.driver-class-name=org.h2.Driver",
            "ephemera.endpoint.enabled=false")
        .run(ctx -> assertFalse(ctx.containsBean("sweepController")));
  }

  @Test
  void controllerNotRegisteredOutsideWebApplications() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(
            DataSourceAutoConfiguration.class,
            EphemeraAutoConfiguration.class,
            EphemeraWebAutoConfiguration.class))
        .withPropertyValues(
            "spring.datasource.url=jdbc:h2:mem:sweep_ctrl_plain;DB_CLOSE_DELAY=-1",
            "spring.datasource.driver-class-name=org.h2.Driver")
        .run(ctx -> assertFalse(ctx.containsBean("sweepController")));
  }

  private SweepController controller(BlobStore blobStore, int workers) {
    return new SweepController(sweeper(blobStore, workers));
  }

  private ExpiredContentSweeper sweeper(BlobStore blobStore, int workers) {
    ConnectionProvider connections = new DataSourceConnectionProvider(dataSource);
    return ExpiredContentSweeper.builder()
        .connectionProvider(connections)
        .contentRepository(repository)
        .engagementStore(engagementStore)
        .cascade(cascade(connections, blobStore))
        .clock(Clock.fixed(NOW, ZoneOffset.UTC))
        .workerCount(workers)
        .build();
  }

  private ItemCascade cascade(ConnectionProvider connections, BlobStore blobStore) {
    return ItemCascade.builder()
        .connectionProvider(connections)
        .contentRepository(repository)
        .engagementStore(engagementStore)
        .blobStore(blobStore)
        .build();
  }

  private void insertExpired(String id, String mediaUrl) throws SQLException {
    Instant created = NOW.minusSeconds(4 * 3600);
    try (Connection conn = dataSource.getConnection()) {
      repository.insert(conn, new ContentItem(id, "owner-1", "☕ カフェなう", mediaUrl, true,
          created, created.plusSeconds(3 * 3600), 0, 0));
    }
  }
}
