package nudge.jdbc;

import nudge.model.UserPreferences;
import nudge.spi.PreferenceStore;

import java.sql.Connection;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC {@link PreferenceStore} over the {@code <prefix>user_preferences} table.
 */
public final class JdbcPreferenceStore implements PreferenceStore {
  private static final String FLAGS = "email_enabled = ?, sms_enabled = ?, push_enabled = ?, in_app_enabled = ?, "
      + "whatsapp_enabled = ?, marketing_enabled = ?, transactional_enabled = ?, global_opt_out = ?";

  private final String table;

  public JdbcPreferenceStore() {
    this(TableNames.defaults());
  }

  public JdbcPreferenceStore(TableNames tables) {
    this.table = Objects.requireNonNull(tables, "tables").preferences();
  }

  @Override
  public Optional<UserPreferences> find(Connection conn, String userId) {
    return JdbcTemplate.queryOne(conn,
        "SELECT user_id, email_enabled, sms_enabled, push_enabled, in_app_enabled, whatsapp_enabled, "
            + "marketing_enabled, transactional_enabled, global_opt_out FROM " + table + " WHERE user_id = ?",
        rs -> new UserPreferences(
            rs.getString("user_id"),
            rs.getBoolean("email_enabled"),
            rs.getBoolean("sms_enabled"),
            rs.getBoolean("push_enabled"),
            rs.getBoolean("in_app_enabled"),
            rs.getBoolean("whatsapp_enabled"),
            rs.getBoolean("marketing_enabled"),
            rs.getBoolean("transactional_enabled"),
            rs.getBoolean("global_opt_out")),
        userId);
  }

  @Override
  public void save(Connection conn, UserPreferences p) {
    Object[] flags = {p.emailEnabled(), p.smsEnabled(), p.pushEnabled(), p.inAppEnabled(),
        p.whatsappEnabled(), p.marketingEnabled(), p.transactionalEnabled(), p.globalOptOut()};
    Object[] updateParams = new Object[flags.length + 1];
    System.arraycopy(flags, 0, updateParams, 0, flags.length);
    updateParams[flags.length] = p.userId();
    if (JdbcTemplate.update(conn, "UPDATE " + table + " SET " + FLAGS + " WHERE user_id = ?", updateParams) > 0) {
      return;
    }
    Object[] insertParams = new Object[flags.length + 1];
    insertParams[0] = p.userId();
    System.arraycopy(flags, 0, insertParams, 1, flags.length);
    try {
      JdbcTemplate.update(conn,
          "INSERT INTO " + table + " (user_id, email_enabled, sms_enabled, push_enabled, in_app_enabled, "
              + "whatsapp_enabled, marketing_enabled, transactional_enabled, global_opt_out) "
              + "VALUES (?,?,?,?,?,?,?,?,?)",
          insertParams);
    } catch (NudgeStoreException e) {
      if (!e.isConstraintViolation()) {
        throw e;
      }
      // a concurrent save inserted the row first
      JdbcTemplate.update(conn, "UPDATE " + table + " SET " + FLAGS + " WHERE user_id = ?", updateParams);
    }
  }
}
