package nudge.condition;

import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Evaluates a {@link ConditionSet} against a context map. Evaluation is total: an empty
 * set is {@code true}, an unknown operator is {@code false}, and any failure while
 * resolving or comparing a field counts as a non-match.
 *
 * <p>This class is stateless and thread-safe; use {@link #INSTANCE}.
 */
public final class ConditionEvaluator {
    private static final Logger logger = Logger.getLogger(ConditionEvaluator.class.getName());

    public static final ConditionEvaluator INSTANCE = new ConditionEvaluator();

    private ConditionEvaluator() {
    }

    public boolean evaluate(ConditionSet set, Map<String, ?> context) {
        if (set == null || set.isEmpty()) {
            return true;
        }
        if (set.logic() == ConditionSet.Logic.OR) {
            for (TriggerCondition condition : set.conditions()) {
                if (matches(condition, context)) {
                    return true;
                }
            }
            return false;
        }
        for (TriggerCondition condition : set.conditions()) {
            if (!matches(condition, context)) {
                return false;
            }
        }
        return true;
    }

    public boolean matches(TriggerCondition condition, Map<String, ?> context) {
        try {
            Value actual = FieldPath.resolve(context, condition.field());
            return compare(actual, condition.operator(), condition.value());
        } catch (RuntimeException e) {
            logger.log(Level.FINE, "Condition on field " + condition.field() + " failed to evaluate", e);
            return false;
        }
    }

    static boolean compare(Value actual, Operator operator, Value expected) {
        switch (operator) {
            case EQUALS:
                return actual.strictEquals(expected);
            case NOT_EQUALS:
                return !actual.strictEquals(expected);
            case GREATER_THAN:
                return actual.toNumber() > expected.toNumber();
            case LESS_THAN:
                return actual.toNumber() < expected.toNumber();
            case CONTAINS:
                return actual.toText().contains(expected.toText());
            case EXISTS:
                return actual.isPresent();
            default:
                return false;
        }
    }
}
