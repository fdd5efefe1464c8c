package nudge.jdbc;

import nudge.model.Channel;
import nudge.model.NotificationTemplate;
import nudge.model.Priority;
import nudge.spi.TemplateStore;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC {@link TemplateStore} over the {@code <prefix>templates} table.
 */
public final class JdbcTemplateStore implements TemplateStore {
  private static final String COLUMNS =
      "id, slug, name, channel, type, subject, body_template, html_template, priority, is_default, is_active";

  private static final JdbcTemplate.RowMapper<NotificationTemplate> MAPPER = JdbcTemplateStore::map;

  private final String table;

  public JdbcTemplateStore() {
    this(TableNames.defaults());
  }

  public JdbcTemplateStore(TableNames tables) {
    this.table = Objects.requireNonNull(tables, "tables").templates();
  }

  @Override
  public List<NotificationTemplate> listActive(Connection conn) {
    return JdbcTemplate.query(conn,
        "SELECT " + COLUMNS + " FROM " + table + " WHERE is_active = ? ORDER BY slug", MAPPER, true);
  }

  @Override
  public Optional<NotificationTemplate> findBySlug(Connection conn, String slug) {
    return JdbcTemplate.queryOne(conn,
        "SELECT " + COLUMNS + " FROM " + table + " WHERE slug = ? AND is_active = ?", MAPPER, slug, true);
  }

  public void insert(Connection conn, NotificationTemplate template) {
    JdbcTemplate.update(conn,
        "INSERT INTO " + table + " (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?,?)",
        template.id(), template.slug(), template.name(), template.channel().code(), template.type(),
        template.subject(), template.body(), template.html(), template.priority().code(),
        template.defaultTemplate(), template.active());
  }

  private static NotificationTemplate map(ResultSet rs) throws SQLException {
    return NotificationTemplate.builder()
        .id(rs.getString("id"))
        .slug(rs.getString("slug"))
        .name(rs.getString("name"))
        .channel(Channel.fromCode(rs.getString("channel")))
        .type(rs.getString("type"))
        .subject(rs.getString("subject"))
        .body(rs.getString("body_template"))
        .html(rs.getString("html_template"))
        .priority(Priority.fromCode(rs.getString("priority")))
        .defaultTemplate(rs.getBoolean("is_default"))
        .active(rs.getBoolean("is_active"))
        .build();
  }
}
