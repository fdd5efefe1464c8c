package nudge.model;

import java.time.DayOfWeek;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.TreeSet;

/**
 * Time-of-day gate for a trigger rule. Empty hour or day sets place no constraint;
 * {@code quietHours} and {@code zone} are optional.
 *
 * @param allowedHours hours of day (0-23) in which the rule may fire
 * @param allowedDays  days of week on which the rule may fire
 * @param quietHours   hours during which the rule must not fire, or {@code null}
 * @param zone         zone the hour and day are evaluated in, or {@code null} for the engine clock's zone
 */
public record TimeWindow(
    Set<Integer> allowedHours,
    Set<DayOfWeek> allowedDays,
    QuietHours quietHours,
    ZoneId zone
) {

    public TimeWindow {
        if (allowedHours != null) {
            for (Integer hour : allowedHours) {
                if (hour == null || hour < 0 || hour > 23) {
                    throw new IllegalArgumentException("allowedHours must be in [0, 23]: " + hour);
                }
            }
        }
        if (allowedDays != null) {
            for (DayOfWeek day : allowedDays) {
                if (day == null) {
                    throw new IllegalArgumentException("allowedDays must not contain null");
                }
            }
        }
        allowedHours = allowedHours == null || allowedHours.isEmpty()
            ? Collections.emptySet()
            : Collections.unmodifiableSet(new TreeSet<>(allowedHours));
        allowedDays = allowedDays == null || allowedDays.isEmpty()
            ? Collections.emptySet()
            : Collections.unmodifiableSet(EnumSet.copyOf(allowedDays));
    }

    public static TimeWindow quiet(QuietHours quietHours) {
        return new TimeWindow(null, null, quietHours, null);
    }

    public boolean permits(ZonedDateTime time) {
        int hour = time.getHour();
        if (!allowedHours.isEmpty() && !allowedHours.contains(hour)) {
            return false;
        }
        if (!allowedDays.isEmpty() && !allowedDays.contains(time.getDayOfWeek())) {
            return false;
        }
        return quietHours == null || !quietHours.contains(hour);
    }

    /**
     * Maps a day to the Sunday-based index (0 = Sunday, 6 = Saturday) used in stored configuration.
     */
    public static int dayIndex(DayOfWeek day) {
        return day.getValue() % 7;
    }

    public static DayOfWeek dayOf(int index) {
        if (index < 0 || index > 6) {
            throw new IllegalArgumentException("day index must be in [0, 6]: " + index);
        }
        return index == 0 ? DayOfWeek.SUNDAY : DayOfWeek.of(index);
    }
}
