package nudge.jdbc;

import nudge.model.Channel;
import nudge.model.DeliveryStatus;
import nudge.model.Priority;
import nudge.model.QueueEntry;
import nudge.spi.QueueStore;
import nudge.util.JsonCodec;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC {@link QueueStore} over the {@code <prefix>queue} table.
 *
 * <p>Status is stored as {@link DeliveryStatus#code()}. Each transition is an
 * {@code UPDATE ... WHERE status = <expected>}, so the row count tells the caller whether it
 * won the transition.
 */
public final class JdbcQueueStore implements QueueStore {
  private static final int MAX_ERROR_LENGTH = 4000;
  private static final String COLUMNS = "id, template_id, trigger_id, campaign_id, recipient_id, channel, "
      + "subject, content, html_content, personalization_data, scheduled_for, priority, priority_rank, status, "
      + "retry_count, created_at, sent_at, delivered_at, failed_at, delivery_time_ms, provider, "
      + "provider_message_id, error_message";

  private final String table;
  private final JsonColumns columns;
  private final JdbcTemplate.RowMapper<QueueEntry> mapper = this::map;

  public JdbcQueueStore() {
    this(TableNames.defaults(), JsonCodec.getDefault());
  }

  public JdbcQueueStore(TableNames tables, JsonCodec json) {
    this.table = Objects.requireNonNull(tables, "tables").queue();
    this.columns = new JsonColumns(Objects.requireNonNull(json, "json"));
  }

  @Override
  public void insert(Connection conn, QueueEntry e) {
    JdbcTemplate.update(conn,
        "INSERT INTO " + table + " (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)",
        e.id(), e.templateId(), e.triggerId(), e.campaignId(), e.recipientId(), e.channel().code(),
        e.subject(), e.content(), e.html(), columns.data(e.data()), e.scheduledFor(),
        e.priority().code(), e.priority().rank(), e.status().code(), e.retryCount(), e.createdAt(),
        e.sentAt(), e.deliveredAt(), e.failedAt(), e.deliveryTimeMs(), e.provider(),
        e.providerMessageId(), truncateError(e.errorMessage()));
  }

  @Override
  public Optional<QueueEntry> find(Connection conn, String entryId) {
    return JdbcTemplate.queryOne(conn, "SELECT " + COLUMNS + " FROM " + table + " WHERE id = ?", mapper, entryId);
  }

  @Override
  public int markSending(Connection conn, String entryId, Instant sentAt) {
    return JdbcTemplate.update(conn,
        "UPDATE " + table + " SET status = " + DeliveryStatus.SENDING.code() + ", sent_at = ?"
            + " WHERE id = ? AND status = " + DeliveryStatus.QUEUED.code(),
        sentAt, entryId);
  }

  @Override
  public int markSent(Connection conn, String entryId, Instant deliveredAt, long deliveryTimeMs,
                      String provider, String providerMessageId) {
    return JdbcTemplate.update(conn,
        "UPDATE " + table + " SET status = " + DeliveryStatus.SENT.code()
            + ", delivered_at = ?, delivery_time_ms = ?, provider = ?, provider_message_id = ?"
            + " WHERE id = ? AND status = " + DeliveryStatus.SENDING.code(),
        deliveredAt, deliveryTimeMs, provider, providerMessageId, entryId);
  }

  @Override
  public int markFailed(Connection conn, String entryId, Instant failedAt, String error) {
    return JdbcTemplate.update(conn,
        "UPDATE " + table + " SET status = " + DeliveryStatus.FAILED.code()
            + ", failed_at = ?, error_message = ?, retry_count = retry_count + 1"
            + " WHERE id = ? AND status = " + DeliveryStatus.SENDING.code(),
        failedAt, truncateError(error), entryId);
  }

  @Override
  public List<QueueEntry> selectDue(Connection conn, Instant now, int limit) {
    return JdbcTemplate.query(conn,
        "SELECT " + COLUMNS + " FROM " + table
            + " WHERE status = " + DeliveryStatus.QUEUED.code() + " AND scheduled_for <= ?"
            + " ORDER BY priority_rank, scheduled_for LIMIT ?",
        mapper, now, limit);
  }

  @Override
  public int countRecentSends(Connection conn, String triggerId, String recipientId, Instant since) {
    return JdbcTemplate.query(conn,
        "SELECT COUNT(*) FROM " + table + " WHERE trigger_id = ? AND recipient_id = ? AND created_at >= ?",
        rs -> rs.getInt(1), triggerId, recipientId, since).get(0);
  }

  private QueueEntry map(ResultSet rs) throws SQLException {
    long deliveryTime = rs.getLong("delivery_time_ms");
    Long deliveryTimeMs = rs.wasNull() ? null : deliveryTime;
    return QueueEntry.builder()
        .id(rs.getString("id"))
        .templateId(rs.getString("template_id"))
        .triggerId(rs.getString("trigger_id"))
        .campaignId(rs.getString("campaign_id"))
        .recipientId(rs.getString("recipient_id"))
        .channel(Channel.fromCode(rs.getString("channel")))
        .subject(rs.getString("subject"))
        .content(rs.getString("content"))
        .html(rs.getString("html_content"))
        .data(columns.data(rs.getString("personalization_data")))
        .scheduledFor(JdbcTemplate.instant(rs, "scheduled_for"))
        .priority(Priority.fromCode(rs.getString("priority")))
        .status(DeliveryStatus.fromCode(rs.getInt("status")))
        .retryCount(rs.getInt("retry_count"))
        .createdAt(JdbcTemplate.instant(rs, "created_at"))
        .sentAt(JdbcTemplate.instant(rs, "sent_at"))
        .deliveredAt(JdbcTemplate.instant(rs, "delivered_at"))
        .failedAt(JdbcTemplate.instant(rs, "failed_at"))
        .deliveryTimeMs(deliveryTimeMs)
        .provider(rs.getString("provider"))
        .providerMessageId(rs.getString("provider_message_id"))
        .errorMessage(rs.getString("error_message"))
        .build();
  }

  private static String truncateError(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH - 3) + "...";
  }
}
