package nudge.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-user send cap for a trigger rule: at most {@code maxSendsPerUser} queue entries
 * within any {@code cooldown} window. A cap of zero or less disables the limit.
 */
public record RateLimit(int maxSendsPerUser, Duration cooldown) {

    /** One send per user per day. */
    public static final RateLimit DEFAULT = new RateLimit(1, Duration.ofMinutes(1440));

    public RateLimit {
        Objects.requireNonNull(cooldown, "cooldown");
        if (cooldown.isNegative()) {
            throw new IllegalArgumentException("cooldown must be >= 0");
        }
    }

    public static RateLimit unlimited() {
        return new RateLimit(0, Duration.ZERO);
    }

    public static RateLimit ofMinutes(int maxSendsPerUser, long cooldownMinutes) {
        return new RateLimit(maxSendsPerUser, Duration.ofMinutes(cooldownMinutes));
    }

    public boolean isUnlimited() {
        return maxSendsPerUser <= 0;
    }
}
