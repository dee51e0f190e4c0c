package ephemera.spring.boot;

import ephemera.blob.HttpBlobStore;
import ephemera.jdbc.DataSourceConnectionProvider;
import ephemera.jdbc.TableNames;
import ephemera.jdbc.store.AbstractJdbcContentRepository;
import ephemera.jdbc.store.JdbcContentRepositories;
import ephemera.jdbc.store.JdbcEngagementStores;
import ephemera.lifecycle.ContentService;
import ephemera.spi.BlobStore;
import ephemera.spi.BlobStoreException;
import ephemera.spi.ConnectionProvider;
import ephemera.spi.ContentDeletionListener;
import ephemera.spi.ContentRepository;
import ephemera.spi.EngagementStore;
import ephemera.spi.SweepMetrics;
import ephemera.sweep.ExpiredContentSweeper;
import ephemera.sweep.ItemCascade;
import ephemera.sweep.SweepScheduler;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * Auto-configuration for ephemeral-content sweeping.
 *
 * <p>Detects the JDBC stores from the {@link DataSource}, builds the item cascade and the
 * {@link ExpiredContentSweeper}, and schedules sweeps unless {@code ephemera.sweep.enabled} is
 * false. Every bean backs off when the application defines its own.
 *
 * @see EphemeraProperties
 * @see EphemeraMicrometerAutoConfiguration
 * @see EphemeraWebAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(ExpiredContentSweeper.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(EphemeraProperties.class)
public class EphemeraAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(ContentRepository.class)
  public AbstractJdbcContentRepository contentRepository(DataSource dataSource, EphemeraProperties props) {
    AbstractJdbcContentRepository detected = JdbcContentRepositories.detect(dataSource);
    TableNames tables = tableNames(props.getTables());
    return tables.equals(TableNames.DEFAULT) ? detected : detected.withTables(tables);
  }

  @Bean
  @ConditionalOnMissingBean(EngagementStore.class)
  public EngagementStore engagementStore(DataSource dataSource, EphemeraProperties props) {
    String database = JdbcContentRepositories.detect(dataSource).name();
    return JdbcEngagementStores.forDatabase(database, tableNames(props.getTables()));
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(BlobStore.class)
  @ConditionalOnProperty(prefix = "ephemera.blob", name = "endpoint")
  public HttpBlobStore blobStore(EphemeraProperties props) {
    EphemeraProperties.Blob blob = props.getBlob();
    return HttpBlobStore.builder()
        .endpoint(blob.getEndpoint())
        .bucket(blob.getBucket())
        .serviceKey(blob.getServiceKey())
        .requestTimeout(blob.getRequestTimeout())
        .build();
  }

  @Bean
  @ConditionalOnMissingBean
  public Clock ephemeraClock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnMissingBean
  public ItemCascade itemCascade(EphemeraProperties props,
      ConnectionProvider connectionProvider,
      ContentRepository contentRepository,
      EngagementStore engagementStore,
      ObjectProvider<BlobStore> blobStoreProvider,
      ObjectProvider<ContentDeletionListener> listenerProvider) {
    BlobStore blobStore = blobStoreProvider.getIfAvailable(() -> path -> {
      throw new BlobStoreException("No blob store configured (set ephemera.blob.endpoint)");
    });
    return ItemCascade.builder()
        .connectionProvider(connectionProvider)
        .contentRepository(contentRepository)
        .engagementStore(engagementStore)
        .blobStore(blobStore)
        .bucket(props.getBlob().getBucket())
        .deletionListener(listenerProvider.getIfAvailable())
        .build();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public ExpiredContentSweeper expiredContentSweeper(EphemeraProperties props,
      ConnectionProvider connectionProvider,
      ContentRepository contentRepository,
      EngagementStore engagementStore,
      ItemCascade itemCascade,
      Clock clock,
      ObjectProvider<SweepMetrics> metricsProvider) {
    EphemeraProperties.Sweep sweep = props.getSweep();
    return ExpiredContentSweeper.builder()
        .connectionProvider(connectionProvider)
        .contentRepository(contentRepository)
        .engagementStore(engagementStore)
        .cascade(itemCascade)
        .metrics(metricsProvider.getIfAvailable())
        .clock(clock)
        .batchSize(sweep.getBatchSize())
        .workerCount(sweep.getWorkerCount())
        .itemTimeout(sweep.getItemTimeout())
        .reconcileOrphans(sweep.isReconcileOrphans())
        .build();
  }

  @Bean
  @ConditionalOnMissingBean
  public ContentService contentService(ConnectionProvider connectionProvider,
      ContentRepository contentRepository, ItemCascade itemCascade, Clock clock) {
    return new ContentService(connectionProvider, contentRepository, itemCascade, clock);
  }

  @Bean(initMethod = "start", destroyMethod = "close")
  @ConditionalOnMissingBean
  @ConditionalOnProperty(prefix = "ephemera.sweep", name = "enabled", matchIfMissing = true)
  public SweepScheduler sweepScheduler(EphemeraProperties props, ExpiredContentSweeper sweeper) {
    return SweepScheduler.builder()
        .sweeper(sweeper)
        .interval(props.getSweep().getInterval())
        .initialDelay(props.getSweep().getInitialDelay())
        .build();
  }

  private static TableNames tableNames(EphemeraProperties.Tables tables) {
    return new TableNames(tables.getContent(), tables.getLikes(), tables.getComments(),
        tables.getParentColumn());
  }
}
