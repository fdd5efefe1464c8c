package nudge.delivery;

import nudge.channel.DeliveryResult;
import nudge.model.AnalyticsAggregate;
import nudge.model.AnalyticsQuery;
import nudge.model.Channel;
import nudge.model.DeliveryStatus;
import nudge.model.Priority;
import nudge.model.QueueEntry;
import nudge.model.UserPreferences;
import nudge.spi.UserDataProvider;
import nudge.template.Personalizer;
import nudge.testing.CoreFixture;
import nudge.testing.InMemoryQueueStore;
import nudge.testing.RecordingChannelProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class NotificationServiceTest {

  private CoreFixture fx;
  private NotificationService service;
  private RecordingChannelProvider email;

  @BeforeEach
  void setUp() {
    fx = new CoreFixture();
    fx.template("quiz-reminder", Channel.EMAIL, "quiz_abandoned");
    email = fx.provider(Channel.EMAIL);
    service = fx.notificationService();
  }

  private static NotificationRequest.Builder request() {
    return NotificationRequest.builder("quiz-reminder", "u1").data(Map.of("completion_percentage", 40));
  }

  // ── Builder validation ──────────────────────────────────────────

  @Test
  void builderRejectsMissingStores() {
    assertThrows(NullPointerException.class, () -> NotificationService.builder()
        .connectionProvider(fx.connections)
        .templateResolver(fx.templateResolver)
        .build());
  }

  // ── sendNotification ────────────────────────────────────────────

  @Test
  void queuesPersonalizedEntry() {
    SendResult result = service.sendNotification(request().triggerId("r1").build());

    assertEquals(SendResult.Status.QUEUED, result.status());
    assertTrue(result.accepted());
    QueueEntry entry = fx.queue.get(result.entryId());
    assertEquals(DeliveryStatus.QUEUED, entry.status());
    assertEquals(Channel.EMAIL, entry.channel());
    assertEquals("tpl-quiz-reminder", entry.templateId());
    assertEquals("r1", entry.triggerId());
    assertEquals("Hi there", entry.subject());
    assertEquals("You are 40% done", entry.content());
    assertEquals(fx.clock.instant(), entry.scheduledFor());
    assertEquals(1, fx.metrics.queued.get());
    assertTrue(email.sent.isEmpty());
  }

  @Test
  void rejectsUnknownTemplate() {
    SendResult result = service.sendNotification(NotificationRequest.builder("nope", "u1").build());

    assertEquals(SendResult.Status.REJECTED, result.status());
    assertEquals("Template not found: nope", result.reason());
    assertEquals(0, fx.queue.insertCount.get());
  }

  @Test
  void rejectsOptedOutUser() {
    fx.preferences.save(null, UserPreferences.defaults("u1").withGlobalOptOut(true));

    SendResult result = service.sendNotification(request().build());

    assertEquals(SendResult.Status.REJECTED, result.status());
    assertEquals(NotificationService.OPTED_OUT, result.reason());
    assertFalse(result.accepted());
    assertEquals(0, fx.queue.insertCount.get());
  }

  @Test
  void rejectsRequestedChannelThatIsNotAllowed() {
    SendResult result = service.sendNotification(request().channel(Channel.SMS).build());

    assertEquals(SendResult.Status.REJECTED, result.status());
    assertEquals(0, fx.queue.insertCount.get());
  }

  @Test
  void persistenceErrorCreatesNoEntry() {
    fx.queue.failInserts = true;

    SendResult result = service.sendNotification(request().build());

    assertEquals(SendResult.Status.FAILED, result.status());
    assertTrue(result.reason().startsWith("Failed to queue notification"));
    assertNull(result.entryId());
    assertTrue(fx.queue.all().isEmpty());
  }

  // ── Immediate path ──────────────────────────────────────────────

  @Test
  void urgentDueNotificationIsDeliveredSynchronously() {
    SendResult result = service.sendNotification(request().priority(Priority.URGENT).build());

    assertEquals(SendResult.Status.DELIVERED, result.status());
    assertTrue(result.delivery().success());
    assertEquals(1, email.sent.size());
    QueueEntry entry = fx.queue.get(result.entryId());
    assertEquals(DeliveryStatus.SENT, entry.status());
    assertEquals("stub-email", entry.provider());
    assertEquals("msg-" + entry.id(), entry.providerMessageId());
    assertNotNull(entry.sentAt());
    assertNotNull(entry.deliveredAt());
  }

  @Test
  void futureHighPriorityNotificationIsStillDeliveredSynchronously() {
    Instant later = fx.clock.instant().plus(Duration.ofHours(1));

    SendResult result = service.sendNotification(request().priority(Priority.HIGH).scheduledFor(later).build());

    assertEquals(SendResult.Status.DELIVERED, result.status());
    assertEquals(later, result.scheduledFor());
    assertEquals(1, email.sent.size());
    assertEquals(DeliveryStatus.SENT, fx.queue.get(result.entryId()).status());
  }

  @Test
  void immediateEntryIsInvisibleToPollerBetweenInsertAndDelivery() {
    AtomicReference<DeliveryPoller> poller = new AtomicReference<>();
    List<Integer> polledDuringInsert = new ArrayList<>();
    InMemoryQueueStore racingQueue = new InMemoryQueueStore() {
      @Override
      public void insert(Connection conn, QueueEntry entry) {
        super.insert(conn, entry);
        polledDuringInsert.add(poller.get().poll());
      }
    };
    NotificationService racing = NotificationService.builder()
        .connectionProvider(fx.connections)
        .queueStore(racingQueue)
        .preferenceStore(fx.preferences)
        .analyticsStore(fx.analytics)
        .templateResolver(fx.templateResolver)
        .personalizer(new Personalizer(UserDataProvider.EMPTY, fx.clock))
        .channelRegistry(fx.channels)
        .clock(fx.clock)
        .build();
    poller.set(DeliveryPoller.builder().notificationService(racing).build());
    try {
      SendResult result = racing.sendNotification(request().priority(Priority.URGENT).build());

      assertEquals(SendResult.Status.DELIVERED, result.status());
      assertEquals(List.of(0), polledDuringInsert);
      assertEquals(1, email.sent.size());
      assertEquals(DeliveryStatus.SENT, racingQueue.get(result.entryId()).status());
    } finally {
      poller.get().close();
    }
  }

  @Test
  void enqueueClaimsImmediateEntryUntilCompleted() {
    PendingSend pending = service.enqueue(request().priority(Priority.URGENT).build());
    String id = pending.result().entryId();

    assertEquals(SendResult.Status.QUEUED, pending.result().status());
    assertTrue(pending.awaitingDelivery());
    assertEquals(DeliveryStatus.SENDING, fx.queue.get(id).status());
    assertNotNull(fx.queue.get(id).sentAt());
    assertEquals("Notification is already SENDING", service.deliver(id).errorMessage());
    assertTrue(email.sent.isEmpty());

    assertEquals(SendResult.Status.DELIVERED, service.complete(pending).status());
    assertFalse(pending.awaitingDelivery());
    assertEquals(SendResult.Status.QUEUED, service.complete(pending).status());
    assertEquals(1, email.sent.size());
    assertEquals(DeliveryStatus.SENT, fx.queue.get(id).status());
  }

  @Test
  void enqueueLeavesNormalEntryForPoller() {
    PendingSend pending = service.enqueue(request().build());

    assertFalse(pending.awaitingDelivery());
    assertEquals(DeliveryStatus.QUEUED, fx.queue.get(pending.result().entryId()).status());
    assertSame(pending.result(), service.complete(pending));
    assertTrue(email.sent.isEmpty());
  }

  @Test
  void immediateFailureIsReturnedAndRecorded() {
    email.failingWith("mailbox full");

    SendResult result = service.sendNotification(request().priority(Priority.HIGH).build());

    assertEquals(SendResult.Status.FAILED, result.status());
    assertEquals("mailbox full", result.reason());
    QueueEntry entry = fx.queue.get(result.entryId());
    assertEquals(DeliveryStatus.FAILED, entry.status());
    assertEquals(1, entry.retryCount());
    assertEquals("mailbox full", entry.errorMessage());
    assertEquals(1, fx.metrics.deliveryFailure.get());
  }

  // ── deliver ─────────────────────────────────────────────────────

  @Test
  void deliverIsNotRepeatable() {
    String id = service.sendNotification(request().build()).entryId();

    assertTrue(service.deliver(id).success());
    DeliveryResult second = service.deliver(id);

    assertFalse(second.success());
    assertEquals("Notification is already SENT", second.errorMessage());
    assertEquals(1, email.sent.size());
  }

  @Test
  void deliverUnknownEntry() {
    assertEquals(NotificationService.NOT_FOUND, service.deliver("missing").errorMessage());
  }

  @Test
  void deliverWithoutProviderFails() {
    fx.template("sms-alert", Channel.SMS, null);
    fx.preferences.save(null, UserPreferences.defaults("u1").withChannel(Channel.SMS, true));
    String id = service.sendNotification(NotificationRequest.builder("sms-alert", "u1").build()).entryId();

    DeliveryResult result = service.deliver(id);

    assertFalse(result.success());
    assertEquals("No provider available for channel sms", result.errorMessage());
    assertEquals(DeliveryStatus.FAILED, fx.queue.get(id).status());
  }

  @Test
  void deliverSkipsEntryAlreadyInFlight() {
    NotificationService guarded = NotificationService.builder()
        .connectionProvider(fx.connections)
        .queueStore(fx.queue)
        .preferenceStore(fx.preferences)
        .analyticsStore(fx.analytics)
        .templateResolver(fx.templateResolver)
        .personalizer(new nudge.template.Personalizer(nudge.spi.UserDataProvider.EMPTY, fx.clock))
        .channelRegistry(fx.channels)
        .inFlightTracker(new InFlightTracker() {
          @Override
          public boolean tryAcquire(String entryId) {
            return false;
          }

          @Override
          public void release(String entryId) {
          }
        })
        .build();
    String id = guarded.sendNotification(request().build()).entryId();

    assertEquals("Delivery already in progress", guarded.deliver(id).errorMessage());
    assertEquals(0, fx.queue.markSendingCount.get());
    assertEquals(DeliveryStatus.QUEUED, fx.queue.get(id).status());
  }

  // ── Analytics ───────────────────────────────────────────────────

  @Test
  void recordsAnalyticsForSuccessAndFailure() throws SQLException {
    email.responder = m -> DeliveryResult.success("smtp", "m", 120, new BigDecimal("0.001"));
    service.deliver(service.sendNotification(request().build()).entryId());
    email.failingWith("bounced");
    service.deliver(service.sendNotification(request().build()).entryId());

    List<AnalyticsAggregate> rows = service.analytics(AnalyticsQuery.forTemplate("tpl-quiz-reminder"));

    assertEquals(1, rows.size());
    AnalyticsAggregate row = rows.get(0);
    assertEquals(2, row.sent());
    assertEquals(1, row.delivered());
    assertEquals(1, row.failed());
    assertEquals(120d, row.avgDeliveryTimeMs(), 0.001);
    assertEquals(10, row.key().hour());
  }

  @Test
  void analyticsFailureDoesNotUndoDelivery() {
    fx.analytics.failing = true;
    String id = service.sendNotification(request().build()).entryId();

    assertTrue(service.deliver(id).success());
    assertEquals(DeliveryStatus.SENT, fx.queue.get(id).status());
  }

  // ── Preferences ─────────────────────────────────────────────────

  @Test
  void preferencesDefaultUntilSaved() throws SQLException {
    assertEquals(UserPreferences.defaults("u2"), service.preferencesOf("u2"));

    assertTrue(service.updateUserPreferences(UserPreferences.defaults("u2").withMarketingEnabled(false)));

    assertFalse(service.preferencesOf("u2").marketingEnabled());
  }

  @Test
  void findReturnsStoredEntry() throws SQLException {
    String id = service.sendNotification(request().build()).entryId();

    assertEquals(id, service.find(id).orElseThrow().id());
    assertTrue(service.find("missing").isEmpty());
  }
}
