/**
 * Channel provider contract and registry. Concrete vendor adapters live outside this library.
 */
package nudge.channel;
