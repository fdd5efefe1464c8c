package nudge.trigger;

/**
 * Receiver of synthetic events, such as journey stage events emitted by the lifecycle engine.
 *
 * @see TriggerEngine
 */
@FunctionalInterface
public interface TriggerEventSink {

    /**
     * Feeds an event through trigger matching. Must not throw.
     */
    void emit(TriggerEvent event);
}
