package nudge.jdbc;

import nudge.Nudge;
import nudge.channel.DefaultChannelRegistry;
import nudge.condition.ConditionSet;
import nudge.condition.Operator;
import nudge.condition.TriggerCondition;
import nudge.delivery.NotificationRequest;
import nudge.delivery.SendResult;
import nudge.lifecycle.JourneyCatalog;
import nudge.model.AnalyticsAggregate;
import nudge.model.AnalyticsQuery;
import nudge.model.Channel;
import nudge.model.DeliveryStatus;
import nudge.model.NotificationTemplate;
import nudge.model.Priority;
import nudge.model.QueueEntry;
import nudge.model.RateLimit;
import nudge.model.TriggerRule;
import nudge.model.UserPreferences;
import nudge.trigger.RuleOutcome;
import nudge.trigger.TriggerEvent;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the engine end to end against H2: rule match, queueing, delivery, analytics.
 */
class JdbcNudgeScenarioTest {

  private static final Instant START = Instant.parse("2024-03-04T10:00:00Z");
  private static final Instant FAR_FUTURE = Instant.parse("2100-01-01T00:00:00Z");

  private JdbcDataSource dataSource;
  private JdbcStores stores;
  private TestChannels.SettableClock clock;
  private TestChannels.RecordingEmail email;
  private Nudge nudge;

  @BeforeEach
  void setUp() throws SQLException {
    dataSource = H2Database.create(TableNames.defaults());
    stores = JdbcStores.create(TableNames.defaults());
    clock = new TestChannels.SettableClock(START);
    email = new TestChannels.RecordingEmail();

    try (Connection conn = dataSource.getConnection()) {
      stores.templates().insert(conn, NotificationTemplate.builder()
          .id("t1")
          .slug("quiz-reminder")
          .channel(Channel.EMAIL)
          .type("quiz_abandoned")
          .subject("Finish your quiz")
          .body("You are {{completion_percentage}}% done")
          .build());
      stores.rules().insert(conn, TriggerRule.builder()
          .id("r1")
          .slug("quiz_abandoned")
          .eventName("quiz_abandoned")
          .conditions(ConditionSet.all(TriggerCondition.of("data.completion_percentage", Operator.LESS_THAN, 100)))
          .delayMinutes(60)
          .rateLimit(RateLimit.ofMinutes(1, 1440))
          .channelPriority(List.of(Channel.EMAIL))
          .build());
    }

    nudge = stores.configure(Nudge.builder())
        .connectionProvider(new DataSourceConnectionProvider(dataSource))
        .channelRegistry(new DefaultChannelRegistry().register(email))
        .clock(clock)
        .lifecycleEnabled(false)
        .build();
  }

  @AfterEach
  void tearDown() throws SQLException {
    nudge.close();
    H2Database.drop(dataSource);
  }

  private static TriggerEvent quizAbandoned() {
    return TriggerEvent.builder("quiz_abandoned")
        .userId("u1")
        .data(Map.of("completion_percentage", 40))
        .build();
  }

  private List<QueueEntry> queued() throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      return stores.queue().selectDue(conn, FAR_FUTURE, 100);
    }
  }

  @Test
  void quizAbandonmentQueuesOnceAndDeliversAfterDelay() throws SQLException {
    List<RuleOutcome> first = nudge.processEvent(quizAbandoned());
    List<RuleOutcome> second = nudge.processEvent(quizAbandoned());

    assertTrue(first.get(0).isEnqueued());
    assertEquals(RuleOutcome.Gate.RATE_LIMIT, second.get(0).gate());
    List<QueueEntry> entries = queued();
    assertEquals(1, entries.size());
    QueueEntry entry = entries.get(0);
    assertEquals(START.plus(Duration.ofMinutes(60)), entry.scheduledFor());
    assertEquals("You are 40% done", entry.content());

    assertEquals(0, nudge.deliveryPoller().poll());
    clock.advance(Duration.ofMinutes(60));
    assertEquals(1, nudge.deliveryPoller().poll());

    try (Connection conn = dataSource.getConnection()) {
      QueueEntry sent = stores.queue().find(conn, entry.id()).orElseThrow();
      assertEquals(DeliveryStatus.SENT, sent.status());
      assertEquals("test-email", sent.provider());
      assertEquals("msg-" + entry.id(), sent.providerMessageId());

      List<AnalyticsAggregate> analytics = stores.analytics().query(conn, AnalyticsQuery.forTemplate("t1"));
      assertEquals(1, analytics.size());
      assertEquals(1, analytics.get(0).delivered());
    }
    assertEquals(1, email.sent.size());
  }

  @Test
  void urgentSendIsDeliveredWithoutThePoller() throws SQLException {
    SendResult result = nudge.sendNotification(NotificationRequest.builder("quiz-reminder", "u1")
        .data(Map.of("completion_percentage", 75))
        .priority(Priority.URGENT)
        .scheduledFor(START.plus(Duration.ofMinutes(30)))
        .build());

    assertEquals(SendResult.Status.DELIVERED, result.status());
    assertTrue(queued().isEmpty());
    assertEquals(0, nudge.deliveryPoller().poll());
    try (Connection conn = dataSource.getConnection()) {
      QueueEntry sent = stores.queue().find(conn, result.entryId()).orElseThrow();
      assertEquals(DeliveryStatus.SENT, sent.status());
      assertEquals(START, sent.sentAt());
    }
    assertEquals(1, email.sent.size());
  }

  @Test
  void rateLimitWindowReopensAfterCooldown() throws SQLException {
    nudge.processEvent(quizAbandoned());
    clock.advance(Duration.ofMinutes(1441));

    assertTrue(nudge.processEvent(quizAbandoned()).get(0).isEnqueued());
    assertEquals(2, queued().size());
  }

  @Test
  void optedOutUserGetsNothing() throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      stores.preferences().save(conn, UserPreferences.defaults("u1").withChannel(Channel.EMAIL, false));
    }

    RuleOutcome outcome = nudge.processEvent(quizAbandoned()).get(0);

    assertEquals(RuleOutcome.Status.REJECTED, outcome.status());
    assertEquals(RuleOutcome.Gate.DELIVERY, outcome.gate());
    assertTrue(queued().isEmpty());
  }

  @Test
  void journeyStageEventsReachTheQueue() throws SQLException {
    assertTrue(nudge.startJourney("u1", JourneyCatalog.RE_ENGAGEMENT, Map.of("completion_percentage", 10)));

    List<QueueEntry> entries = queued();
    assertEquals(1, entries.size());
    assertEquals("r1", entries.get(0).triggerId());
  }
}
