package nudge.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Delivery counters for one {@link AnalyticsKey}. Every attempt counts as sent; the
 * average delivery time is a cumulative mean over delivered attempts.
 */
public record AnalyticsAggregate(
    AnalyticsKey key,
    long sent,
    long delivered,
    long failed,
    double avgDeliveryTimeMs,
    BigDecimal totalCost
) {

    public AnalyticsAggregate {
        Objects.requireNonNull(key, "key");
        totalCost = totalCost == null ? BigDecimal.ZERO : totalCost;
    }

    public static AnalyticsAggregate empty(AnalyticsKey key) {
        return new AnalyticsAggregate(key, 0, 0, 0, 0d, BigDecimal.ZERO);
    }

    /**
     * Returns a copy with one more attempt folded in.
     *
     * @param success        whether the attempt was delivered
     * @param deliveryTimeMs measured delivery time, used only on success
     * @param cost           provider-reported cost, or {@code null}
     */
    public AnalyticsAggregate record(boolean success, long deliveryTimeMs, BigDecimal cost) {
        BigDecimal newCost = cost == null ? totalCost : totalCost.add(cost);
        if (!success) {
            return new AnalyticsAggregate(key, sent + 1, delivered, failed + 1, avgDeliveryTimeMs, newCost);
        }
        long newDelivered = delivered + 1;
        double newAvg = (avgDeliveryTimeMs * delivered + deliveryTimeMs) / newDelivered;
        return new AnalyticsAggregate(key, sent + 1, newDelivered, failed, newAvg, newCost);
    }
}
