package nudge.jdbc;

import nudge.model.Channel;
import nudge.model.DeliveryStatus;
import nudge.model.Priority;
import nudge.model.QueueEntry;
import nudge.util.JsonCodec;
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

class JdbcQueueStoreTest {

  private static final Instant NOW = Instant.parse("2024-03-04T12:00:00Z");

  private JdbcDataSource dataSource;
  private JdbcQueueStore store;

  @BeforeEach
  void setUp() throws SQLException {
    TableNames tables = TableNames.withPrefix("t_");
    dataSource = H2Database.create(tables);
    store = new JdbcQueueStore(tables, JsonCodec.getDefault());
  }

  @AfterEach
  void tearDown() throws SQLException {
    H2Database.drop(dataSource);
  }

  private static QueueEntry.Builder entry(String id) {
    return QueueEntry.builder()
        .id(id)
        .templateId("tpl")
        .triggerId("rule")
        .recipientId("u1")
        .channel(Channel.EMAIL)
        .content("body")
        .createdAt(NOW)
        .scheduledFor(NOW);
  }

  @Test
  void insertAndFindRoundTrip() throws SQLException {
    QueueEntry entry = entry("e1")
        .campaignId("spring")
        .subject("Hi")
        .html("<p>body</p>")
        .data(Map.of("name", "Ada", "score", 3))
        .priority(Priority.HIGH)
        .scheduledFor(NOW.plus(Duration.ofMinutes(5)))
        .build();

    try (Connection conn = dataSource.getConnection()) {
      store.insert(conn, entry);
      QueueEntry loaded = store.find(conn, "e1").orElseThrow();

      assertEquals("tpl", loaded.templateId());
      assertEquals("rule", loaded.triggerId());
      assertEquals("spring", loaded.campaignId());
      assertEquals(Channel.EMAIL, loaded.channel());
      assertEquals("Hi", loaded.subject());
      assertEquals("<p>body</p>", loaded.html());
      assertEquals("Ada", loaded.data().get("name"));
      assertEquals(3L, loaded.data().get("score"));
      assertEquals(Priority.HIGH, loaded.priority());
      assertEquals(DeliveryStatus.QUEUED, loaded.status());
      assertEquals(NOW, loaded.createdAt());
      assertEquals(NOW.plus(Duration.ofMinutes(5)), loaded.scheduledFor());
      assertNull(loaded.deliveryTimeMs());
      assertNull(loaded.sentAt());
      assertTrue(store.find(conn, "missing").isEmpty());
    }
  }

  @Test
  void statusOnlyMovesForward() throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      store.insert(conn, entry("e1").build());

      assertEquals(0, store.markSent(conn, "e1", NOW, 5, "p", "m"));
      assertEquals(0, store.markFailed(conn, "e1", NOW, "boom"));
      assertEquals(1, store.markSending(conn, "e1", NOW));
      assertEquals(0, store.markSending(conn, "e1", NOW));
      assertEquals(1, store.markSent(conn, "e1", NOW.plusMillis(40), 40, "ses", "msg-1"));
      assertEquals(0, store.markFailed(conn, "e1", NOW, "late failure"));
      assertEquals(0, store.markSending(conn, "e1", NOW));

      QueueEntry sent = store.find(conn, "e1").orElseThrow();
      assertEquals(DeliveryStatus.SENT, sent.status());
      assertEquals(NOW, sent.sentAt());
      assertEquals(NOW.plusMillis(40), sent.deliveredAt());
      assertEquals(40L, sent.deliveryTimeMs());
      assertEquals("ses", sent.provider());
      assertEquals("msg-1", sent.providerMessageId());
      assertNull(sent.errorMessage());
    }
  }

  @Test
  void failureIsTerminalAndCountsRetry() throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      store.insert(conn, entry("e1").build());
      store.markSending(conn, "e1", NOW);

      assertEquals(1, store.markFailed(conn, "e1", NOW, "x".repeat(5000)));
      assertEquals(0, store.markSent(conn, "e1", NOW, 1, "p", "m"));

      QueueEntry failed = store.find(conn, "e1").orElseThrow();
      assertEquals(DeliveryStatus.FAILED, failed.status());
      assertEquals(1, failed.retryCount());
      assertEquals(NOW, failed.failedAt());
      assertEquals(4000, failed.errorMessage().length());
      assertTrue(failed.errorMessage().endsWith("..."));
    }
  }

  @Test
  void selectDueOrdersByPriorityThenSchedule() throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      store.insert(conn, entry("low-early").priority(Priority.LOW).scheduledFor(NOW.minusSeconds(300)).build());
      store.insert(conn, entry("normal-late").scheduledFor(NOW.minusSeconds(10)).build());
      store.insert(conn, entry("normal-early").scheduledFor(NOW.minusSeconds(60)).build());
      store.insert(conn, entry("urgent").priority(Priority.URGENT).scheduledFor(NOW).build());
      store.insert(conn, entry("future").scheduledFor(NOW.plusSeconds(1)).build());
      store.insert(conn, entry("claimed").scheduledFor(NOW.minusSeconds(600)).build());
      store.markSending(conn, "claimed", NOW);

      List<String> due = store.selectDue(conn, NOW, 10).stream().map(QueueEntry::id).toList();
      assertEquals(List.of("urgent", "normal-early", "normal-late", "low-early"), due);

      assertEquals(2, store.selectDue(conn, NOW, 2).size());
    }
  }

  @Test
  void countRecentSendsCoversAllStatusesInWindow() throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      store.insert(conn, entry("old").createdAt(NOW.minus(Duration.ofDays(2))).build());
      store.insert(conn, entry("recent").createdAt(NOW.minus(Duration.ofHours(1))).build());
      store.insert(conn, entry("sent").build());
      store.markSending(conn, "sent", NOW);
      store.insert(conn, entry("other-user").recipientId("u2").build());
      store.insert(conn, entry("other-rule").triggerId("rule2").build());

      assertEquals(2, store.countRecentSends(conn, "rule", "u1", NOW.minus(Duration.ofDays(1))));
      assertEquals(3, store.countRecentSends(conn, "rule", "u1", NOW.minus(Duration.ofDays(3))));
      assertEquals(0, store.countRecentSends(conn, "rule", "u3", NOW.minus(Duration.ofDays(3))));
    }
  }
}
