package nudge.lifecycle;

/**
 * What a single advancement check did to one journey instance.
 *
 * @param key       the instance
 * @param type      the kind of transition
 * @param fromStage stage before the check
 * @param toStage   stage after the check, or {@code null} once completed
 * @param message   failure detail, or {@code null}
 */
public record JourneyTransition(JourneyKey key, Type type, String fromStage, String toStage, String message) {

    public enum Type {
        ADVANCED,
        COMPLETED,
        UNCHANGED,
        FAILED
    }

    static JourneyTransition advanced(JourneyKey key, String from, String to) {
        return new JourneyTransition(key, Type.ADVANCED, from, to, null);
    }

    static JourneyTransition completed(JourneyKey key, String from) {
        return new JourneyTransition(key, Type.COMPLETED, from, null, null);
    }

    static JourneyTransition unchanged(JourneyKey key, String stage) {
        return new JourneyTransition(key, Type.UNCHANGED, stage, stage, null);
    }

    static JourneyTransition failed(JourneyKey key, String stage, String message) {
        return new JourneyTransition(key, Type.FAILED, stage, stage, message);
    }

    public boolean changed() {
        return type == Type.ADVANCED || type == Type.COMPLETED;
    }
}
