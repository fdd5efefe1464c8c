/**
 * Internal helpers: thread factory and the JSON codec used for stored rule and entry fields.
 */
package nudge.util;
