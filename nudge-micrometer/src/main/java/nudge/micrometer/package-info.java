/**
 * Micrometer bridge for the engine's counters and gauges.
 *
 * @see nudge.micrometer.MicrometerMetricsExporter
 */
package nudge.micrometer;
