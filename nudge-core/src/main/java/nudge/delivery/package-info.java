/**
 * Notification queue and delivery pipeline.
 *
 * <p>{@link nudge.delivery.NotificationService} writes queue entries and delivers single
 * entries; {@link nudge.delivery.DeliveryPoller} runs the periodic batch loop over due
 * entries. Status moves {@code QUEUED -> SENDING -> SENT | FAILED} and never back.
 */
package nudge.delivery;
