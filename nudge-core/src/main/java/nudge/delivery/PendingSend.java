package nudge.delivery;

import nudge.model.QueueEntry;

import java.util.concurrent.atomic.AtomicReference;

/**
 * A request that has been written to the queue but whose synchronous delivery, if any, has
 * not run yet. Returned by {@link NotificationService#enqueue} and finished by
 * {@link NotificationService#complete}.
 *
 * <p>Entries with an immediate priority are written already claimed ({@code SENDING}), so
 * the batch loop never picks them up; only the holder of this object delivers them.
 */
public final class PendingSend {
  private final SendResult result;
  private final AtomicReference<QueueEntry> claimed;

  private PendingSend(SendResult result, QueueEntry claimed) {
    this.result = result;
    this.claimed = new AtomicReference<>(claimed);
  }

  static PendingSend done(SendResult result) {
    return new PendingSend(result, null);
  }

  static PendingSend claimed(SendResult result, QueueEntry entry) {
    return new PendingSend(result, entry);
  }

  /**
   * The enqueue outcome: {@code QUEUED} if an entry was written, else {@code REJECTED} or
   * {@code FAILED}.
   */
  public SendResult result() {
    return result;
  }

  /**
   * Returns {@code true} while a claimed entry is waiting for {@link NotificationService#complete}.
   */
  public boolean awaitingDelivery() {
    return claimed.get() != null;
  }

  QueueEntry takeClaimed() {
    return claimed.getAndSet(null);
  }
}
