package nudge.model;

import java.util.Objects;

/**
 * Inclusive hour-of-day range during which a rule must not fire. When {@code startHour}
 * is after {@code endHour} the range wraps past midnight.
 */
public record QuietHours(int startHour, int endHour) {

    public QuietHours {
        checkHour(startHour, "startHour");
        checkHour(endHour, "endHour");
    }

    /**
     * Parses {@code "HH:mm"} bounds; only the hour component is significant.
     */
    public static QuietHours parse(String start, String end) {
        return new QuietHours(parseHour(start), parseHour(end));
    }

    public boolean contains(int hour) {
        if (startHour <= endHour) {
            return hour >= startHour && hour <= endHour;
        }
        return hour >= startHour || hour <= endHour;
    }

    /** Formats a bound back to the {@code "HH:00"} form accepted by {@link #parse}. */
    public static String format(int hour) {
        return String.format("%02d:00", hour);
    }

    private static int parseHour(String time) {
        Objects.requireNonNull(time, "time");
        String trimmed = time.trim();
        int colon = trimmed.indexOf(':');
        String hourPart = colon < 0 ? trimmed : trimmed.substring(0, colon);
        try {
            return Integer.parseInt(hourPart);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid time of day: " + time, e);
        }
    }

    private static void checkHour(int hour, String name) {
        if (hour < 0 || hour > 23) {
            throw new IllegalArgumentException(name + " must be in [0, 23]");
        }
    }
}
