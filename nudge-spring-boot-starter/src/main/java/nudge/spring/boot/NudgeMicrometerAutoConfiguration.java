package nudge.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import nudge.micrometer.MicrometerMetricsExporter;
import nudge.spi.MetricsExporter;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath and
 * {@code nudge.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link NudgeAutoConfiguration} so the exporter is injected into the
 * composite.
 */
@AutoConfiguration(before = NudgeAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "nudge.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(NudgeProperties.class)
public class NudgeMicrometerAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, NudgeProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
