package nudge.delivery;

import nudge.model.Channel;
import nudge.model.DeliveryStatus;
import nudge.model.Priority;
import nudge.model.QueueEntry;
import nudge.testing.CoreFixture;
import nudge.testing.RecordingChannelProvider;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class DeliveryPollerTest {

  private CoreFixture fx;
  private RecordingChannelProvider email;
  private NotificationService service;
  private DeliveryPoller poller;

  @BeforeEach
  void setUp() {
    fx = new CoreFixture();
    email = fx.provider(Channel.EMAIL);
    service = fx.notificationService();
  }

  @AfterEach
  void tearDown() {
    if (poller != null) {
      poller.close();
    }
  }

  private QueueEntry entry(String id, Priority priority, Instant scheduledFor) {
    QueueEntry entry = QueueEntry.builder()
        .id(id)
        .templateId("tpl")
        .recipientId("u-" + id)
        .channel(Channel.EMAIL)
        .content("hello")
        .priority(priority)
        .scheduledFor(scheduledFor)
        .createdAt(fx.clock.instant())
        .build();
    fx.queue.insert(null, entry);
    return entry;
  }

  // ── Builder validation ──────────────────────────────────────────

  @Test
  void builderRejectsNullService() {
    assertThrows(NullPointerException.class, () -> DeliveryPoller.builder().build());
  }

  @Test
  void builderRejectsNonPositiveOptions() {
    assertThrows(IllegalArgumentException.class, () ->
        DeliveryPoller.builder().notificationService(service).batchSize(0).build());
    assertThrows(IllegalArgumentException.class, () ->
        DeliveryPoller.builder().notificationService(service).intervalMs(0).build());
  }

  // ── poll ────────────────────────────────────────────────────────

  @Test
  void deliversHighestPriorityFirstUpToBatchSize() {
    Instant now = fx.clock.instant();
    entry("low", Priority.LOW, now.minusSeconds(60));
    entry("urgent", Priority.URGENT, now);
    entry("high", Priority.HIGH, now.minusSeconds(1));
    poller = DeliveryPoller.builder().notificationService(service).batchSize(2).build();

    assertEquals(2, poller.poll());

    assertEquals(DeliveryStatus.SENT, fx.queue.get("urgent").status());
    assertEquals(DeliveryStatus.SENT, fx.queue.get("high").status());
    assertEquals(DeliveryStatus.QUEUED, fx.queue.get("low").status());
    assertEquals(2, fx.metrics.lastBatchSize.get());

    assertEquals(1, poller.poll());
    assertEquals(DeliveryStatus.SENT, fx.queue.get("low").status());
  }

  @Test
  void leavesFutureEntriesQueued() {
    entry("later", Priority.URGENT, fx.clock.instant().plus(Duration.ofMinutes(60)));
    poller = DeliveryPoller.builder().notificationService(service).build();

    assertEquals(0, poller.poll());
    assertEquals(0, fx.metrics.lastBatchSize.get());

    fx.clock.advance(Duration.ofMinutes(60));
    assertEquals(1, poller.poll());
    assertEquals(DeliveryStatus.SENT, fx.queue.get("later").status());
  }

  @Test
  void oneFailingDeliveryDoesNotStopTheBatch() {
    Instant now = fx.clock.instant();
    entry("a", Priority.NORMAL, now);
    entry("b", Priority.NORMAL, now);
    email.responder = m -> {
      if (m.entryId().equals("a")) {
        throw new IllegalStateException("provider down");
      }
      return nudge.channel.DeliveryResult.success("stub", "ok");
    };
    poller = DeliveryPoller.builder().notificationService(service).build();

    assertEquals(2, poller.poll());

    assertEquals(DeliveryStatus.FAILED, fx.queue.get("a").status());
    assertEquals(DeliveryStatus.SENT, fx.queue.get("b").status());
    assertEquals(0, poller.poll());
  }

  @Test
  void pollReturnsZeroWhenStoreIsUnreachable() {
    NotificationService broken = NotificationService.builder()
        .connectionProvider(nudge.testing.StubConnections.failing())
        .queueStore(fx.queue)
        .preferenceStore(fx.preferences)
        .analyticsStore(fx.analytics)
        .templateResolver(fx.templateResolver)
        .personalizer(new nudge.template.Personalizer(nudge.spi.UserDataProvider.EMPTY, fx.clock))
        .channelRegistry(fx.channels)
        .build();
    poller = DeliveryPoller.builder().notificationService(broken).build();

    assertEquals(0, poller.poll());
    assertFalse(poller.isRunning());
  }

  // ── Lifecycle ───────────────────────────────────────────────────

  @Test
  void startIsIdempotentAndCloseStopsPolling() {
    entry("a", Priority.NORMAL, fx.clock.instant());
    poller = DeliveryPoller.builder().notificationService(service).intervalMs(60_000).build();

    poller.start();
    poller.start();
    poller.close();
    poller.close();

    assertEquals(0, poller.poll());
    assertEquals(DeliveryStatus.QUEUED, fx.queue.get("a").status());
    assertThrows(IllegalStateException.class, poller::start);
  }

  @Test
  void scheduledLoopDeliversEntries() throws InterruptedException {
    entry("a", Priority.NORMAL, fx.clock.instant());
    poller = DeliveryPoller.builder().notificationService(service).intervalMs(20).build();

    poller.start();
    long deadline = System.currentTimeMillis() + 5_000;
    while (fx.queue.get("a").status() != DeliveryStatus.SENT && System.currentTimeMillis() < deadline) {
      Thread.sleep(10);
    }

    assertEquals(DeliveryStatus.SENT, fx.queue.get("a").status());
  }
}
