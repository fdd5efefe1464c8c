package nudge.condition;

import java.util.Locale;

/**
 * Comparison operator of a {@link TriggerCondition}. Operator names that are not
 * recognised parse to {@link #UNKNOWN}, which never matches.
 */
public enum Operator {
    EQUALS("equals"),
    NOT_EQUALS("not_equals"),
    GREATER_THAN("greater_than"),
    LESS_THAN("less_than"),
    CONTAINS("contains"),
    EXISTS("exists"),
    UNKNOWN("unknown");

    private final String code;

    Operator(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static Operator fromCode(String code) {
        if (code == null) {
            return UNKNOWN;
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (Operator operator : values()) {
            if (operator != UNKNOWN && operator.code.equals(normalized)) {
                return operator;
            }
        }
        return UNKNOWN;
    }
}
