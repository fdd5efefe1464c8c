package nudge.condition;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Flat list of conditions combined by a single {@link Logic} flag. There is no nesting.
 */
public record ConditionSet(List<TriggerCondition> conditions, Logic logic) {

    public static final ConditionSet EMPTY = new ConditionSet(List.of(), Logic.AND);

    public enum Logic {
        AND,
        OR
    }

    public ConditionSet {
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
        logic = Objects.requireNonNullElse(logic, Logic.AND);
    }

    public static ConditionSet all(TriggerCondition... conditions) {
        return new ConditionSet(Arrays.asList(conditions), Logic.AND);
    }

    public static ConditionSet any(TriggerCondition... conditions) {
        return new ConditionSet(Arrays.asList(conditions), Logic.OR);
    }

    public boolean isEmpty() {
        return conditions.isEmpty();
    }
}
