package nudge.spi;

import nudge.model.UserPreferences;

import java.sql.Connection;
import java.util.Optional;

/**
 * Per-user channel preferences.
 *
 * @see nudge.jdbc.JdbcPreferenceStore
 */
public interface PreferenceStore {

    /**
     * Returns stored preferences, or empty if the user never saved any.
     */
    Optional<UserPreferences> find(Connection conn, String userId);

    /**
     * Inserts or replaces the user's preferences.
     */
    void save(Connection conn, UserPreferences preferences);
}
