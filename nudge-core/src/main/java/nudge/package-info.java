/**
 * Notification triggering and lifecycle orchestration.
 *
 * <p>{@link nudge.Nudge} is the usual entry point. The engines in {@code nudge.trigger},
 * {@code nudge.delivery} and {@code nudge.lifecycle} can also be wired individually; storage
 * and integrations plug in through {@code nudge.spi}.
 */
package nudge;
