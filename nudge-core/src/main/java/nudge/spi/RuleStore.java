package nudge.spi;

import nudge.model.TriggerRule;

import java.sql.Connection;
import java.util.List;
import java.util.Optional;

/**
 * Read access to trigger rules. Rules are maintained by configuration management;
 * the engine only writes through {@link #insertIfAbsent} when seeding defaults.
 *
 * @see nudge.jdbc.JdbcRuleStore
 */
public interface RuleStore {

    /**
     * Returns every active rule.
     *
     * @param conn the JDBC connection
     * @return active rules, in no particular order
     */
    List<TriggerRule> listActive(Connection conn);

    /**
     * Looks up an active rule by slug.
     *
     * @param conn the JDBC connection
     * @param slug the rule slug
     * @return the rule, or empty if none is active under that slug
     */
    Optional<TriggerRule> findBySlug(Connection conn, String slug);

    /**
     * Inserts a rule unless one with the same slug already exists.
     *
     * @param conn the JDBC connection
     * @param rule the rule to insert
     * @return {@code true} if the rule was inserted
     */
    boolean insertIfAbsent(Connection conn, TriggerRule rule);
}
