package nudge.lifecycle;

import java.util.Objects;

/**
 * Identity of a journey instance: at most one active instance exists per key.
 */
public record JourneyKey(String userId, String journeyType) {

    public JourneyKey {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(journeyType, "journeyType");
    }
}
