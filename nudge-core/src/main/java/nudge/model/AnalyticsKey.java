package nudge.model;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * Roll-up bucket for delivery analytics: one template on one channel in one hour.
 */
public record AnalyticsKey(String templateId, Channel channel, LocalDate date, int hour) {

    public AnalyticsKey {
        Objects.requireNonNull(templateId, "templateId");
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(date, "date");
        if (hour < 0 || hour > 23) {
            throw new IllegalArgumentException("hour must be in [0, 23]");
        }
    }

    public static AnalyticsKey of(String templateId, Channel channel, Instant at, ZoneId zone) {
        ZonedDateTime local = at.atZone(zone);
        return new AnalyticsKey(templateId, channel, local.toLocalDate(), local.getHour());
    }
}
