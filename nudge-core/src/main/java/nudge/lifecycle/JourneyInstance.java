package nudge.lifecycle;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of one user's progress through a journey. Every transition produces a
 * new instance.
 *
 * @param userId          the user
 * @param journeyType     the journey type
 * @param stageIndex      index of the current stage in the template
 * @param currentStage    name of the current stage
 * @param startedAt       when the journey started
 * @param lastStageAt     when the current stage was entered, shifted forward by paused time
 * @param completedStages stages left behind, in order
 * @param metadata        caller metadata from {@code startJourney}, copied into stage events
 * @param pausedAt        when the journey was paused, or {@code null} if running
 */
public record JourneyInstance(
    String userId,
    String journeyType,
    int stageIndex,
    String currentStage,
    Instant startedAt,
    Instant lastStageAt,
    List<String> completedStages,
    Map<String, Object> metadata,
    Instant pausedAt
) {

    public JourneyInstance {
        completedStages = completedStages == null ? List.of() : List.copyOf(completedStages);
        metadata = metadata == null || metadata.isEmpty()
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    static JourneyInstance start(String userId, JourneyTemplate template, Map<String, Object> metadata, Instant now) {
        return new JourneyInstance(userId, template.journeyType(), 0, template.stage(0).name(),
            now, now, List.of(), metadata, null);
    }

    public JourneyKey key() {
        return new JourneyKey(userId, journeyType);
    }

    public boolean isPaused() {
        return pausedAt != null;
    }

    JourneyInstance advanceTo(int index, String stageName, Instant now) {
        List<String> completed = new ArrayList<>(completedStages);
        completed.add(currentStage);
        return new JourneyInstance(userId, journeyType, index, stageName, startedAt, now, completed, metadata, null);
    }

    JourneyInstance pause(Instant now) {
        return new JourneyInstance(userId, journeyType, stageIndex, currentStage, startedAt, lastStageAt,
            completedStages, metadata, now);
    }

    JourneyInstance resume(Instant now) {
        Duration paused = Duration.between(pausedAt, now);
        if (paused.isNegative()) {
            paused = Duration.ZERO;
        }
        return new JourneyInstance(userId, journeyType, stageIndex, currentStage, startedAt,
            lastStageAt.plus(paused), completedStages, metadata, null);
    }
}
