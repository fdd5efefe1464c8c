package nudge.delivery;

import nudge.channel.DeliveryResult;

import java.time.Instant;

/**
 * Outcome of {@link NotificationService#sendNotification}.
 *
 * @param status       what happened
 * @param entryId      id of the queue entry, or {@code null} if none was written
 * @param scheduledFor when the entry is due, or {@code null} if none was written
 * @param delivery     result of the synchronous delivery for immediate priorities, else {@code null}
 * @param reason       why the request was rejected or failed, else {@code null}
 */
public record SendResult(Status status, String entryId, Instant scheduledFor, DeliveryResult delivery, String reason) {

    public enum Status {
        /** Written to the queue; the batch loop will deliver it. */
        QUEUED,
        /** Written and delivered synchronously. */
        DELIVERED,
        /** Delivery was attempted synchronously and failed, or the entry could not be written. */
        FAILED,
        /** Nothing was written: unknown template or no allowed channel. */
        REJECTED
    }

    static SendResult queued(String entryId, Instant scheduledFor) {
        return new SendResult(Status.QUEUED, entryId, scheduledFor, null, null);
    }

    static SendResult delivered(String entryId, Instant scheduledFor, DeliveryResult delivery) {
        return new SendResult(Status.DELIVERED, entryId, scheduledFor, delivery, null);
    }

    static SendResult failed(String entryId, Instant scheduledFor, DeliveryResult delivery) {
        return new SendResult(Status.FAILED, entryId, scheduledFor, delivery, delivery.errorMessage());
    }

    static SendResult failed(String reason) {
        return new SendResult(Status.FAILED, null, null, null, reason);
    }

    static SendResult rejected(String reason) {
        return new SendResult(Status.REJECTED, null, null, null, reason);
    }

    /**
     * Returns {@code true} if a queue entry was written.
     */
    public boolean accepted() {
        return entryId != null;
    }
}
