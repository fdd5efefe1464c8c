package nudge.spi;

import nudge.model.AnalyticsAggregate;
import nudge.model.AnalyticsKey;
import nudge.model.AnalyticsQuery;

import java.math.BigDecimal;
import java.sql.Connection;
import java.util.List;

/**
 * Hourly delivery roll-ups keyed by {@link AnalyticsKey}.
 *
 * @see nudge.jdbc.JdbcAnalyticsStore
 */
public interface AnalyticsStore {

    /**
     * Folds one delivery attempt into the aggregate for {@code key}, creating it if needed.
     * Must be atomic with respect to concurrent calls for the same key.
     *
     * @param conn           the JDBC connection
     * @param key            the roll-up bucket
     * @param success        whether the attempt was delivered
     * @param deliveryTimeMs delivery time of a successful attempt
     * @param cost           provider-reported cost (may be {@code null})
     */
    void record(Connection conn, AnalyticsKey key, boolean success, long deliveryTimeMs, BigDecimal cost);

    /**
     * Returns aggregates matching the query, newest date and hour first.
     */
    List<AnalyticsAggregate> query(Connection conn, AnalyticsQuery query);
}
