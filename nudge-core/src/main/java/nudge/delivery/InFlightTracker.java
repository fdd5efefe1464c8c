package nudge.delivery;

/**
 * Guards against two threads delivering the same queue entry at once.
 */
public interface InFlightTracker {
  boolean tryAcquire(String entryId);

  void release(String entryId);
}
