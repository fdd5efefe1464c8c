package nudge.model;

import java.time.LocalDate;

/**
 * Filter for analytics reads. {@code null} fields are unconstrained; date bounds are inclusive.
 */
public record AnalyticsQuery(String templateId, Channel channel, LocalDate from, LocalDate to) {

    public static AnalyticsQuery all() {
        return new AnalyticsQuery(null, null, null, null);
    }

    public static AnalyticsQuery forTemplate(String templateId) {
        return new AnalyticsQuery(templateId, null, null, null);
    }

    public boolean matches(AnalyticsKey key) {
        if (templateId != null && !templateId.equals(key.templateId())) {
            return false;
        }
        if (channel != null && channel != key.channel()) {
            return false;
        }
        if (from != null && key.date().isBefore(from)) {
            return false;
        }
        return to == null || !key.date().isAfter(to);
    }
}
