package nudge.lifecycle;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Ordered stage list for one journey type, plus the events that end the journey early.
 */
public record JourneyTemplate(
    String id,
    String journeyType,
    String name,
    List<JourneyStage> stages,
    Set<String> completionEvents,
    boolean active
) {

    public JourneyTemplate {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(journeyType, "journeyType");
        name = name == null ? journeyType : name;
        if (stages == null || stages.isEmpty()) {
            throw new IllegalArgumentException("stages cannot be empty");
        }
        stages = List.copyOf(stages);
        Set<String> names = new HashSet<>();
        for (JourneyStage stage : stages) {
            if (!names.add(stage.name())) {
                throw new IllegalArgumentException("Duplicate stage name: " + stage.name());
            }
        }
        completionEvents = completionEvents == null ? Set.of() : Set.copyOf(completionEvents);
    }

    public JourneyStage stage(int index) {
        return stages.get(index);
    }

    public boolean isLast(int index) {
        return index == stages.size() - 1;
    }

    public boolean completesOn(String eventName) {
        return completionEvents.contains(eventName);
    }
}
