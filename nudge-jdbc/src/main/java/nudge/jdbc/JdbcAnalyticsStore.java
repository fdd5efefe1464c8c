package nudge.jdbc;

import nudge.model.AnalyticsAggregate;
import nudge.model.AnalyticsKey;
import nudge.model.AnalyticsQuery;
import nudge.model.Channel;
import nudge.spi.AnalyticsStore;

import java.math.BigDecimal;
import java.sql.Connection;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * JDBC {@link AnalyticsStore} over the {@code <prefix>analytics} table, one row per
 * {@code (template, channel, date, hour)}.
 *
 * <p>Recording is an increment-in-place {@code UPDATE}, falling back to an {@code INSERT}
 * when the bucket does not exist yet. The running average is assigned before
 * {@code delivered} because MySQL evaluates {@code SET} clauses left to right.
 */
public final class JdbcAnalyticsStore implements AnalyticsStore {
  private static final String KEY = " WHERE template_id = ? AND channel = ? AND bucket_date = ? AND bucket_hour = ?";

  private final String table;

  public JdbcAnalyticsStore() {
    this(TableNames.defaults());
  }

  public JdbcAnalyticsStore(TableNames tables) {
    this.table = Objects.requireNonNull(tables, "tables").analytics();
  }

  @Override
  public void record(Connection conn, AnalyticsKey key, boolean success, long deliveryTimeMs, BigDecimal cost) {
    BigDecimal addCost = cost == null ? BigDecimal.ZERO : cost;
    if (increment(conn, key, success, deliveryTimeMs, addCost) > 0) {
      return;
    }
    try {
      JdbcTemplate.update(conn,
          "INSERT INTO " + table + " (template_id, channel, bucket_date, bucket_hour, sent, delivered, failed, "
              + "avg_delivery_time_ms, total_cost) VALUES (?,?,?,?,?,?,?,?,?)",
          key.templateId(), key.channel().code(), key.date(), key.hour(),
          1L, success ? 1L : 0L, success ? 0L : 1L, success ? (double) deliveryTimeMs : 0d, addCost);
    } catch (NudgeStoreException e) {
      if (!e.isConstraintViolation()) {
        throw e;
      }
      // lost the insert race; the row exists now
      increment(conn, key, success, deliveryTimeMs, addCost);
    }
  }

  private int increment(Connection conn, AnalyticsKey key, boolean success, long deliveryTimeMs, BigDecimal cost) {
    if (success) {
      return JdbcTemplate.update(conn,
          "UPDATE " + table + " SET sent = sent + 1,"
              + " avg_delivery_time_ms = (avg_delivery_time_ms * delivered + ?) / (delivered + 1),"
              + " delivered = delivered + 1, total_cost = total_cost + ?" + KEY,
          (double) deliveryTimeMs, cost, key.templateId(), key.channel().code(), key.date(), key.hour());
    }
    return JdbcTemplate.update(conn,
        "UPDATE " + table + " SET sent = sent + 1, failed = failed + 1, total_cost = total_cost + ?" + KEY,
        cost, key.templateId(), key.channel().code(), key.date(), key.hour());
  }

  @Override
  public List<AnalyticsAggregate> query(Connection conn, AnalyticsQuery query) {
    StringBuilder sql = new StringBuilder("SELECT template_id, channel, bucket_date, bucket_hour, sent, delivered, "
        + "failed, avg_delivery_time_ms, total_cost FROM " + table + " WHERE 1 = 1");
    List<Object> params = new ArrayList<>();
    if (query.templateId() != null) {
      sql.append(" AND template_id = ?");
      params.add(query.templateId());
    }
    if (query.channel() != null) {
      sql.append(" AND channel = ?");
      params.add(query.channel().code());
    }
    if (query.from() != null) {
      sql.append(" AND bucket_date >= ?");
      params.add(query.from());
    }
    if (query.to() != null) {
      sql.append(" AND bucket_date <= ?");
      params.add(query.to());
    }
    sql.append(" ORDER BY bucket_date DESC, bucket_hour DESC, template_id, channel");
    return JdbcTemplate.query(conn, sql.toString(), rs -> new AnalyticsAggregate(
        new AnalyticsKey(rs.getString("template_id"), Channel.fromCode(rs.getString("channel")),
            rs.getDate("bucket_date").toLocalDate(), rs.getInt("bucket_hour")),
        rs.getLong("sent"),
        rs.getLong("delivered"),
        rs.getLong("failed"),
        rs.getDouble("avg_delivery_time_ms"),
        rs.getBigDecimal("total_cost")), params.toArray());
  }
}
