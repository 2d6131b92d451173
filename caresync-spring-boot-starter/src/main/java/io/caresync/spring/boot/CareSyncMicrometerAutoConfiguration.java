package io.caresync.spring.boot;

import io.caresync.micrometer.MicrometerMetricsExporter;
import io.caresync.spi.MetricsExporter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath and
 * {@code caresync.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link CareSyncAutoConfiguration} so the {@link MetricsExporter}
 * bean is available to the scheduler.
 */
@AutoConfiguration(before = CareSyncAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "caresync.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(CareSyncProperties.class)
public class CareSyncMicrometerAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, CareSyncProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
