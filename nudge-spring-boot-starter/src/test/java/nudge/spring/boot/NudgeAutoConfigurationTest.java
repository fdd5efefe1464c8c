package nudge.spring.boot;

import nudge.Nudge;
import nudge.channel.ChannelProvider;
import nudge.channel.ChannelRegistry;
import nudge.channel.DefaultChannelRegistry;
import nudge.channel.DeliveryResult;
import nudge.channel.OutboundMessage;
import nudge.delivery.NotificationRequest;
import nudge.delivery.SendResult;
import nudge.jdbc.DataSourceConnectionProvider;
import nudge.jdbc.JdbcStores;
import nudge.lifecycle.JourneyStage;
import nudge.lifecycle.JourneyTemplate;
import nudge.model.Channel;
import nudge.model.NotificationTemplate;
import nudge.model.Priority;
import nudge.spi.ConnectionProvider;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class NudgeAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(
          DataSourceAutoConfiguration.class,
          NudgeAutoConfiguration.class))
      .withPropertyValues(
          "spring.datasource.url=jdbc:h2:mem:nudge_auto_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1",
          "spring.datasource.driver-class-name=org.h2.Driver",
          "nudge.initialize-schema=true",
          "nudge.lifecycle.enabled=false");

  @Test
  void createsAllBeans() {
    runner.withUserConfiguration(EmailConfig.class).run(ctx -> {
      assertTrue(ctx.containsBean("nudgeStores"));
      assertTrue(ctx.containsBean("nudgeConnectionProvider"));
      assertTrue(ctx.containsBean("channelRegistry"));
      assertTrue(ctx.containsBean("nudge"));

      assertInstanceOf(DataSourceConnectionProvider.class, ctx.getBean(ConnectionProvider.class));
      assertTrue(ctx.getBean(ChannelRegistry.class).hasProvider(Channel.EMAIL));
      assertFalse(ctx.getBean(ChannelRegistry.class).hasProvider(Channel.SMS));
    });
  }

  @Test
  void urgentNotificationIsDeliveredThroughProviderBean() {
    runner.withUserConfiguration(EmailConfig.class).run(ctx -> {
      JdbcStores stores = ctx.getBean(JdbcStores.class);
      try (Connection conn = ctx.getBean(DataSource.class).getConnection()) {
        stores.templates().insert(conn, NotificationTemplate.builder()
            .id("t1").slug("password-reset").channel(Channel.EMAIL).body("Reset link").build());
      }

      SendResult result = ctx.getBean(Nudge.class).sendNotification(
          NotificationRequest.builder("password-reset", "u1").priority(Priority.URGENT).build());

      assertEquals(SendResult.Status.DELIVERED, result.status());
      assertEquals(1, ctx.getBean(TestEmailProvider.class).sent);
    });
  }

  @Test
  void registersDefaultRulesWhenEnabled() {
    runner
        .withPropertyValues("nudge.trigger.register-default-rules=true")
        .withUserConfiguration(EmailConfig.class).run(ctx -> {
          JdbcStores stores = ctx.getBean(JdbcStores.class);
          try (Connection conn = ctx.getBean(DataSource.class).getConnection()) {
            assertEquals(4, stores.rules().listActive(conn).size());
          }
        });
  }

  @Test
  void customTablePrefix() {
    runner
        .withPropertyValues("nudge.table-prefix=app_")
        .withUserConfiguration(EmailConfig.class).run(ctx -> {
          JdbcStores stores = ctx.getBean(JdbcStores.class);
          assertEquals("app_queue", stores.tables().queue());
          try (Connection conn = ctx.getBean(DataSource.class).getConnection()) {
            assertTrue(stores.rules().listActive(conn).isEmpty());
          }
        });
  }

  @Test
  void journeyTemplateBeansReplaceCatalog() {
    runner.withUserConfiguration(EmailConfig.class, JourneyConfig.class).run(ctx -> {
      var templates = ctx.getBean(Nudge.class).getJourneyTemplates();
      assertEquals(1, templates.size());
      assertEquals("trial", templates.iterator().next().journeyType());
    });
  }

  @Test
  void startsWithoutSchema() {
    runner
        .withPropertyValues("nudge.initialize-schema=false")
        .withUserConfiguration(EmailConfig.class).run(ctx -> {
          assertNull(ctx.getStartupFailure());
          assertFalse(ctx.getBean(Nudge.class).reloadRules());
        });
  }

  @Test
  void notLoadedWithoutDataSource() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(NudgeAutoConfiguration.class))
        .run(ctx -> {
          assertFalse(ctx.containsBean("nudge"));
        });
  }

  @Test
  void respectsConditionalOnMissingBean() {
    runner.withUserConfiguration(EmailConfig.class, CustomRegistryConfig.class).run(ctx -> {
      assertFalse(ctx.containsBean("channelRegistry"));
      assertFalse(ctx.getBean(ChannelRegistry.class).hasProvider(Channel.EMAIL));
    });
  }

  // ── Test configurations ──────────────────────────────────────

  static class TestEmailProvider implements ChannelProvider {
    volatile int sent;

    @Override
    public Channel channel() {
      return Channel.EMAIL;
    }

    @Override
    public String name() {
      return "test-email";
    }

    @Override
    public DeliveryResult send(OutboundMessage message) {
      sent++;
      return DeliveryResult.success(name(), "m-" + message.entryId());
    }
  }

  @Configuration
  static class EmailConfig {
    @Bean
    TestEmailProvider testEmailProvider() {
      return new TestEmailProvider();
    }
  }

  @Configuration
  static class JourneyConfig {
    @Bean
    JourneyTemplate trialJourney() {
      return new JourneyTemplate("trial_journey", "trial", "Trial", List.of(
          JourneyStage.of("intro", 0, "trial_intro")), Set.of("converted"), true);
    }
  }

  @Configuration
  static class CustomRegistryConfig {
    @Bean
    ChannelRegistry myChannelRegistry() {
      return new DefaultChannelRegistry();
    }
  }
}
