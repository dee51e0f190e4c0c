package ephemera.spring.boot;

import ephemera.micrometer.MicrometerSweepMetrics;
import ephemera.spi.SweepMetrics;
import io.micrometer.core.instrument.MeterRegistry;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer sweep metrics.
 *
 * <p>Runs before {@link EphemeraAutoConfiguration} so the {@link SweepMetrics} bean is available
 * to the sweeper. Active when Micrometer and a {@link MeterRegistry} are present and
 * {@code ephemera.metrics.enabled} is true (default).
 */
@AutoConfiguration(before = EphemeraAutoConfiguration.class,
    afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass({MicrometerSweepMetrics.class, MeterRegistry.class})
@ConditionalOnBean(MeterRegistry.class)
@ConditionalOnProperty(prefix = "ephemera.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(EphemeraProperties.class)
public class EphemeraMicrometerAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean(SweepMetrics.class)
  public MicrometerSweepMetrics micrometerSweepMetrics(MeterRegistry meterRegistry, EphemeraProperties props) {
    return new MicrometerSweepMetrics(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
