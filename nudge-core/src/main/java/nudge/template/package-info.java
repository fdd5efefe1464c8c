/**
 * Template selection, channel gating and placeholder substitution.
 */
package nudge.template;
