package nudge.delivery;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ConcurrentHashMap}-backed in-flight tracker. An entry stays tracked until released.
 *
 * <p>This class is thread-safe.
 */
public final class DefaultInFlightTracker implements InFlightTracker {
    private final Set<String> inflight = ConcurrentHashMap.newKeySet();

    @Override
    public boolean tryAcquire(String entryId) {
        return inflight.add(entryId);
    }

    @Override
    public void release(String entryId) {
        inflight.remove(entryId);
    }

    int size() {
        return inflight.size();
    }
}
