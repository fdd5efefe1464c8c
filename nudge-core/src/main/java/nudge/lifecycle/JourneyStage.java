package nudge.lifecycle;

import nudge.condition.ConditionSet;

import java.util.List;
import java.util.Objects;

/**
 * One step of a journey: the events it fires, how long the journey waits in it, and the
 * conditions (against the user-data snapshot) under which its events fire.
 *
 * @param name         stage name, unique within its template
 * @param triggers     event names emitted into the trigger engine on entering the stage
 * @param delayMinutes time spent in this stage before the journey moves on
 * @param conditions   gate for emitting {@code triggers}; a failing gate skips the events
 *                     but not the stage
 */
public record JourneyStage(String name, List<String> triggers, int delayMinutes, ConditionSet conditions) {

    public JourneyStage {
        Objects.requireNonNull(name, "name");
        triggers = triggers == null ? List.of() : List.copyOf(triggers);
        conditions = conditions == null ? ConditionSet.EMPTY : conditions;
        if (delayMinutes < 0) {
            throw new IllegalArgumentException("delayMinutes must be >= 0");
        }
    }

    public static JourneyStage of(String name, int delayMinutes, String... triggers) {
        return new JourneyStage(name, List.of(triggers), delayMinutes, ConditionSet.EMPTY);
    }

    public JourneyStage when(ConditionSet conditions) {
        return new JourneyStage(name, triggers, delayMinutes, conditions);
    }
}
