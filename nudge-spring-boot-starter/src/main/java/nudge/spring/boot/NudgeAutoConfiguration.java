package nudge.spring.boot;

import nudge.Nudge;
import nudge.channel.ChannelProvider;
import nudge.channel.ChannelRegistry;
import nudge.channel.DefaultChannelRegistry;
import nudge.jdbc.DataSourceConnectionProvider;
import nudge.jdbc.JdbcSchema;
import nudge.jdbc.JdbcStores;
import nudge.jdbc.TableNames;
import nudge.lifecycle.JourneyTemplate;
import nudge.spi.ConnectionProvider;
import nudge.spi.MetricsExporter;
import nudge.spi.SegmentResolver;
import nudge.spi.UserDataProvider;
import nudge.trigger.DefaultRules;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Auto-configuration for the notification engine.
 *
 * <p>Wires a started {@link Nudge} composite from a {@link DataSource}, the
 * {@link ChannelProvider} beans in the context and {@link NudgeProperties}. Optional
 * {@link SegmentResolver}, {@link UserDataProvider}, {@link MetricsExporter} and
 * {@link JourneyTemplate} beans are picked up when present.
 *
 * @see NudgeProperties
 * @see NudgeMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(Nudge.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(NudgeProperties.class)
public class NudgeAutoConfiguration {
  private static final Logger logger = Logger.getLogger(NudgeAutoConfiguration.class.getName());

  @Bean
  @ConditionalOnMissingBean
  public JdbcStores nudgeStores(DataSource dataSource, NudgeProperties props) {
    JdbcStores stores = JdbcStores.create(TableNames.withPrefix(props.getTablePrefix()));
    if (props.isInitializeSchema()) {
      try (Connection conn = dataSource.getConnection()) {
        conn.setAutoCommit(true);
        JdbcSchema.create(conn, stores.tables());
      } catch (SQLException e) {
        throw new IllegalStateException("Failed to initialize nudge schema", e);
      }
    }
    return stores;
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider nudgeConnectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(ChannelRegistry.class)
  public DefaultChannelRegistry channelRegistry(ObjectProvider<ChannelProvider> providers) {
    DefaultChannelRegistry registry = new DefaultChannelRegistry();
    providers.orderedStream().forEach(registry::register);
    return registry;
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public Nudge nudge(NudgeProperties props,
      JdbcStores stores,
      ConnectionProvider connectionProvider,
      ChannelRegistry channelRegistry,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<SegmentResolver> segmentResolverProvider,
      ObjectProvider<UserDataProvider> userDataProvider,
      ObjectProvider<JourneyTemplate> journeyTemplateProvider) {

    Nudge.Builder builder = stores.configure(Nudge.builder())
        .connectionProvider(connectionProvider)
        .channelRegistry(channelRegistry)
        .segmentResolver(segmentResolverProvider.getIfAvailable())
        .userDataProvider(userDataProvider.getIfAvailable())
        .batchSize(props.getDelivery().getBatchSize())
        .intervalMs(props.getDelivery().getIntervalMs())
        .workerCount(props.getTrigger().getWorkerCount())
        .sweepIntervalMs(props.getLifecycle().getSweepIntervalMs())
        .lifecycleEnabled(props.getLifecycle().isEnabled());
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    List<JourneyTemplate> journeyTemplates = journeyTemplateProvider.orderedStream().toList();
    if (!journeyTemplates.isEmpty()) {
      builder.journeyTemplates(journeyTemplates);
    }

    Nudge nudge = builder.build();
    if (props.getTrigger().isRegisterDefaultRules()) {
      int inserted = nudge.registerRules(DefaultRules.common());
      logger.log(Level.INFO, "Registered {0} default trigger rules", inserted);
    }
    nudge.start();
    return nudge;
  }
}
