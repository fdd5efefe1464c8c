package nudge.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Notification priority. {@link #rank()} orders delivery: lower ranks are dequeued first.
 */
public enum Priority {
    URGENT(0, "urgent"),
    HIGH(1, "high"),
    NORMAL(2, "normal"),
    LOW(3, "low");

    private final int rank;
    private final String code;

    Priority(int rank, String code) {
        this.rank = rank;
        this.code = code;
    }

    public int rank() {
        return rank;
    }

    public String code() {
        return code;
    }

    /**
     * Returns {@code true} for priorities that bypass the batch loop and are delivered
     * synchronously when due.
     */
    public boolean isImmediate() {
        return this == URGENT || this == HIGH;
    }

    public static Priority fromCode(String code) {
        Objects.requireNonNull(code, "code");
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (Priority priority : values()) {
            if (priority.code.equals(normalized)) {
                return priority;
            }
        }
        throw new IllegalArgumentException("Unknown priority: " + code);
    }

    public static Priority fromRank(int rank) {
        for (Priority priority : values()) {
            if (priority.rank == rank) {
                return priority;
            }
        }
        throw new IllegalArgumentException("Unknown priority rank: " + rank);
    }
}
