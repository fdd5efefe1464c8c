package nudge.condition;

import java.util.Objects;

/**
 * A single {@code field operator value} test. {@code field} is a dot path into the
 * evaluation context, e.g. {@code data.score}.
 */
public record TriggerCondition(String field, Operator operator, Value value) {

    public TriggerCondition {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(operator, "operator");
        value = value == null ? Value.NULL : value;
        if (field.isEmpty()) {
            throw new IllegalArgumentException("field cannot be empty");
        }
    }

    public static TriggerCondition of(String field, Operator operator, Object value) {
        return new TriggerCondition(field, operator, Value.of(value));
    }

    public static TriggerCondition exists(String field) {
        return new TriggerCondition(field, Operator.EXISTS, Value.NULL);
    }
}
