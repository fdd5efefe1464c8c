package nudge.jdbc;

import nudge.model.Priority;
import nudge.model.RateLimit;
import nudge.model.TimeWindow;
import nudge.model.TriggerRule;
import nudge.spi.RuleStore;
import nudge.util.JsonCodec;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC {@link RuleStore} over the {@code <prefix>trigger_rules} table.
 */
public final class JdbcRuleStore implements RuleStore {
  private static final String COLUMNS = "id, slug, name, event_name, conditions, target_segments, "
      + "exclude_segments, max_sends_per_user, cooldown_minutes, time_window, timezone, delay_minutes, "
      + "channel_priority, priority, is_active";

  private final String table;
  private final JsonColumns columns;
  private final JdbcTemplate.RowMapper<TriggerRule> mapper = this::map;

  public JdbcRuleStore() {
    this(TableNames.defaults(), JsonCodec.getDefault());
  }

  public JdbcRuleStore(TableNames tables, JsonCodec json) {
    this.table = Objects.requireNonNull(tables, "tables").rules();
    this.columns = new JsonColumns(Objects.requireNonNull(json, "json"));
  }

  @Override
  public List<TriggerRule> listActive(Connection conn) {
    return JdbcTemplate.query(conn,
        "SELECT " + COLUMNS + " FROM " + table + " WHERE is_active = ? ORDER BY slug", mapper, true);
  }

  @Override
  public Optional<TriggerRule> findBySlug(Connection conn, String slug) {
    return JdbcTemplate.queryOne(conn,
        "SELECT " + COLUMNS + " FROM " + table + " WHERE slug = ? AND is_active = ?", mapper, slug, true);
  }

  @Override
  public boolean insertIfAbsent(Connection conn, TriggerRule rule) {
    boolean exists = !JdbcTemplate.query(conn,
        "SELECT id FROM " + table + " WHERE slug = ? OR id = ?", rs -> rs.getString(1), rule.slug(), rule.id()).isEmpty();
    if (exists) {
      return false;
    }
    try {
      insert(conn, rule);
      return true;
    } catch (NudgeStoreException e) {
      if (e.isConstraintViolation()) {
        return false;
      }
      throw e;
    }
  }

  /**
   * Inserts a rule unconditionally.
   *
   * @throws NudgeStoreException if a rule with the same id or slug exists
   */
  public void insert(Connection conn, TriggerRule rule) {
    TimeWindow window = rule.timeWindow();
    JdbcTemplate.update(conn,
        "INSERT INTO " + table + " (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)",
        rule.id(), rule.slug(), rule.name(), rule.eventName(),
        columns.conditions(rule.conditions()),
        columns.strings(rule.targetSegments()),
        columns.strings(rule.excludeSegments()),
        rule.rateLimit().maxSendsPerUser(),
        (int) rule.rateLimit().cooldown().toMinutes(),
        columns.timeWindow(window),
        window == null || window.zone() == null ? null : window.zone().getId(),
        rule.delayMinutes(),
        columns.channels(rule.channelPriority()),
        rule.priority().code(),
        rule.active());
  }

  /**
   * Activates or deactivates a rule; takes effect at the next rule reload.
   *
   * @return {@code true} if a rule with the slug exists
   */
  public boolean setActive(Connection conn, String slug, boolean active) {
    return JdbcTemplate.update(conn, "UPDATE " + table + " SET is_active = ? WHERE slug = ?", active, slug) > 0;
  }

  private TriggerRule map(ResultSet rs) throws SQLException {
    return TriggerRule.builder()
        .id(rs.getString("id"))
        .slug(rs.getString("slug"))
        .name(rs.getString("name"))
        .eventName(rs.getString("event_name"))
        .conditions(columns.conditions(rs.getString("conditions")))
        .targetSegments(columns.strings(rs.getString("target_segments")))
        .excludeSegments(columns.strings(rs.getString("exclude_segments")))
        .rateLimit(RateLimit.ofMinutes(rs.getInt("max_sends_per_user"), rs.getInt("cooldown_minutes")))
        .timeWindow(columns.timeWindow(rs.getString("time_window"), rs.getString("timezone")))
        .delayMinutes(rs.getInt("delay_minutes"))
        .channelPriority(columns.channels(rs.getString("channel_priority")))
        .priority(Priority.fromCode(rs.getString("priority")))
        .active(rs.getBoolean("is_active"))
        .build();
  }
}
