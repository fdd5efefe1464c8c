/**
 * Immutable domain types: trigger rules, templates, queue entries, preferences and
 * analytics roll-ups, plus the enums that classify them.
 */
package nudge.model;
