package ephemera.spring.boot;

import ephemera.sweep.ExpiredContentSweeper;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.context.annotation.Bean;

/**
 * Registers {@link SweepController} in servlet web applications unless
 * {@code ephemera.endpoint.enabled} is false.
 */
@AutoConfiguration(after = EphemeraAutoConfiguration.class)
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
@ConditionalOnBean(ExpiredContentSweeper.class)
@ConditionalOnProperty(prefix = "ephemera.endpoint", name = "enabled", matchIfMissing = true)
public class EphemeraWebAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public SweepController sweepController(ExpiredContentSweeper sweeper) {
    return new SweepController(sweeper);
  }
}
