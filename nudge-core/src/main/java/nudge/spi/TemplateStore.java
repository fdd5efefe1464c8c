package nudge.spi;

import nudge.model.NotificationTemplate;

import java.sql.Connection;
import java.util.List;
import java.util.Optional;

/**
 * Read access to notification templates.
 *
 * @see nudge.jdbc.JdbcTemplateStore
 */
public interface TemplateStore {

    List<NotificationTemplate> listActive(Connection conn);

    Optional<NotificationTemplate> findBySlug(Connection conn, String slug);
}
