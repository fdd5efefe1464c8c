/**
 * Multi-stage user journeys. {@link nudge.lifecycle.LifecycleEngine} holds the active
 * instances and advances them on user events and on a periodic sweep, feeding stage events
 * back into the trigger engine.
 */
package nudge.lifecycle;
