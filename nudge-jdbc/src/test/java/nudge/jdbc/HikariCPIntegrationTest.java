package nudge.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import nudge.Nudge;
import nudge.channel.DefaultChannelRegistry;
import nudge.channel.OutboundMessage;
import nudge.delivery.NotificationRequest;
import nudge.delivery.SendResult;
import nudge.model.Channel;
import nudge.model.DeliveryStatus;
import nudge.model.NotificationTemplate;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class HikariCPIntegrationTest {
  private static final Instant FAR_FUTURE = Instant.parse("2100-01-01T00:00:00Z");

  private HikariDataSource hikariDs;
  private JdbcStores stores;
  private TestChannels.RecordingEmail email;
  private Nudge nudge;

  @BeforeEach
  void setup() throws Exception {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl("jdbc:h2:mem:hikari_" + UUID.randomUUID() + ";MODE=MySQL;DB_CLOSE_DELAY=-1");
    config.setMaximumPoolSize(5);
    config.setMinimumIdle(1);
    config.setPoolName("nudge-test-pool");
    hikariDs = new HikariDataSource(config);

    stores = JdbcStores.create(TableNames.withPrefix("pool_"));
    try (Connection conn = hikariDs.getConnection()) {
      JdbcSchema.create(conn, stores.tables());
      stores.templates().insert(conn, NotificationTemplate.builder()
          .id("t1").slug("welcome").channel(Channel.EMAIL).body("Welcome").build());
    }
    email = new TestChannels.RecordingEmail();
    nudge = stores.configure(Nudge.builder())
        .connectionProvider(new DataSourceConnectionProvider(hikariDs))
        .channelRegistry(new DefaultChannelRegistry().register(email))
        .batchSize(100)
        .lifecycleEnabled(false)
        .build();
  }

  @AfterEach
  void tearDown() {
    nudge.close();
    if (hikariDs != null && !hikariDs.isClosed()) {
      hikariDs.close();
    }
  }

  @Test
  void racingDeliveriesSendEachEntryOnce() throws Exception {
    List<String> ids = new ArrayList<>();
    for (int i = 0; i < 20; i++) {
      SendResult result = nudge.sendNotification(NotificationRequest.builder("welcome", "user-" + i).build());
      assertEquals(SendResult.Status.QUEUED, result.status());
      ids.add(result.entryId());
    }

    ExecutorService pool = Executors.newFixedThreadPool(3);
    CountDownLatch go = new CountDownLatch(1);
    List<Future<?>> futures = new ArrayList<>();
    futures.add(pool.submit(() -> {
      go.await();
      return nudge.deliveryPoller().poll();
    }));
    for (int t = 0; t < 2; t++) {
      futures.add(pool.submit(() -> {
        go.await();
        for (String id : ids) {
          nudge.notificationService().deliver(id);
        }
        return null;
      }));
    }
    go.countDown();
    for (Future<?> future : futures) {
      future.get();
    }
    pool.shutdown();

    Set<String> delivered = new HashSet<>();
    for (OutboundMessage message : email.sent) {
      assertTrue(delivered.add(message.entryId()), "delivered twice: " + message.entryId());
    }
    assertEquals(new HashSet<>(ids), delivered);
    try (Connection conn = hikariDs.getConnection()) {
      for (String id : ids) {
        assertEquals(DeliveryStatus.SENT, stores.queue().find(conn, id).orElseThrow().status());
      }
      assertTrue(stores.queue().selectDue(conn, FAR_FUTURE, 100).isEmpty());
    }
  }
}
