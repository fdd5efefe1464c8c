/**
 * Flat condition lists evaluated against nested context maps.
 *
 * <p>Used by the trigger engine against event payloads and by the lifecycle engine
 * against user data snapshots.
 */
package nudge.condition;
