package nudge;

import nudge.delivery.NotificationRequest;
import nudge.delivery.SendResult;
import nudge.lifecycle.JourneyCatalog;
import nudge.model.Channel;
import nudge.model.DeliveryStatus;
import nudge.model.Priority;
import nudge.model.QueueEntry;
import nudge.model.TriggerRule;
import nudge.testing.CoreFixture;
import nudge.testing.RecordingChannelProvider;
import nudge.testing.RecordingMetrics;
import nudge.trigger.DefaultRules;
import nudge.trigger.RuleOutcome;
import nudge.trigger.TriggerEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class NudgeTest {

  private CoreFixture fx;
  private RecordingChannelProvider email;
  private Nudge nudge;

  @BeforeEach
  void setUp() {
    fx = new CoreFixture();
    fx.template("quiz-reminder", Channel.EMAIL, "quiz_abandoned");
    email = fx.provider(Channel.EMAIL);
    fx.rules.add(TriggerRule.builder()
        .id("r-quiz")
        .slug("quiz_abandoned")
        .eventName("quiz_abandoned")
        .channelPriority(List.of(Channel.EMAIL))
        .build());
    nudge = builder().build();
  }

  @AfterEach
  void tearDown() {
    nudge.close();
  }

  private Nudge.Builder builder() {
    return Nudge.builder()
        .connectionProvider(fx.connections)
        .ruleStore(fx.rules)
        .templateStore(fx.templates)
        .preferenceStore(fx.preferences)
        .queueStore(fx.queue)
        .analyticsStore(fx.analytics)
        .channelRegistry(fx.channels)
        .metrics(fx.metrics)
        .clock(fx.clock)
        .intervalMs(60_000L)
        .sweepIntervalMs(60_000L);
  }

  @Test
  void builderRequiresStores() {
    assertThrows(NullPointerException.class, () -> Nudge.builder().build());
    assertThrows(NullPointerException.class, () -> builder().queueStore(null).build());
  }

  @Test
  void journeyStageFlowsThroughTriggerToDelivery() {
    assertTrue(nudge.startJourney("u1", JourneyCatalog.RE_ENGAGEMENT, Map.of()));

    List<QueueEntry> queued = fx.queue.all();
    assertEquals(1, queued.size());
    QueueEntry entry = queued.get(0);
    assertEquals("r-quiz", entry.triggerId());
    assertEquals(fx.clock.instant().plus(Duration.ofMinutes(60)), entry.scheduledFor());

    assertEquals(0, nudge.deliveryPoller().poll());

    fx.clock.advance(Duration.ofMinutes(60));
    assertEquals(1, nudge.deliveryPoller().poll());
    assertEquals(1, email.sent.size());
    assertEquals(DeliveryStatus.SENT, fx.queue.get(entry.id()).status());
    assertEquals(1, fx.metrics.deliverySuccess.get());
  }

  @Test
  void completionEventFromProcessEventEndsJourney() {
    nudge.startJourney("u1", JourneyCatalog.RE_ENGAGEMENT, Map.of());

    List<RuleOutcome> outcomes = nudge.processEvent(TriggerEvent.builder("quiz_completed").userId("u1").build());

    assertTrue(outcomes.isEmpty());
    assertTrue(nudge.getUserJourneyStatus("u1").isEmpty());
    assertEquals(1, fx.metrics.journeyCompleted.get());
  }

  @Test
  void processEventMatchesRulesAndReturnsOutcomes() {
    List<RuleOutcome> outcomes = nudge.processEvent(TriggerEvent.builder("quiz_abandoned").userId("u2").build());

    assertEquals(1, outcomes.size());
    assertTrue(outcomes.get(0).isEnqueued());
  }

  @Test
  void urgentNotificationIsDeliveredSynchronously() {
    SendResult result = nudge.sendNotification(NotificationRequest.builder("quiz-reminder", "u1")
        .data(Map.of("completion_percentage", 80))
        .priority(Priority.URGENT)
        .build());

    assertEquals(SendResult.Status.DELIVERED, result.status());
    assertEquals("You are 80% done", email.sent.get(0).content());
  }

  @Test
  void registerRulesAndReload() {
    assertEquals(4, nudge.registerRules(DefaultRules.common()));
    assertTrue(nudge.reloadRules());
    assertEquals(1, nudge.triggerEngine().rulesFor("weekly_digest").size());

    fx.rules.failing = true;
    assertFalse(nudge.reloadRules());
  }

  @Test
  void startIsIdempotentAndCloseStopsEverything() {
    nudge.start();
    nudge.start();
    assertEquals(1, fx.rules.listCount.get());

    nudge.close();

    assertTrue(nudge.processEvent(TriggerEvent.builder("quiz_abandoned").userId("u1").build()).isEmpty());
    assertEquals(0, nudge.deliveryPoller().poll());
    assertThrows(IllegalStateException.class, () -> nudge.lifecycleEngine().start());
  }

  @Test
  void closesMetricsExporterThatIsCloseable() {
    nudge.close();
    CloseableMetrics metrics = new CloseableMetrics();
    nudge = builder().metrics(metrics).build();

    nudge.close();

    assertTrue(metrics.closed);
  }

  private static final class CloseableMetrics extends RecordingMetrics implements AutoCloseable {
    volatile boolean closed;

    @Override
    public void close() {
      closed = true;
    }
  }
}
