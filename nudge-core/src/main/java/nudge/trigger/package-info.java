/**
 * Event-to-rule matching: the {@link nudge.trigger.TriggerEngine} and the events it consumes.
 */
package nudge.trigger;
