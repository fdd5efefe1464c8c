package nudge.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import nudge.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link MetricsExporter} backed by a Micrometer {@link MeterRegistry}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code nudge.trigger.enqueued} - rule evaluations that produced a queue entry</li>
 *   <li>{@code nudge.trigger.rejected} - rule evaluations stopped by a gate</li>
 *   <li>{@code nudge.trigger.failed} - rule evaluations aborted by an error</li>
 *   <li>{@code nudge.queue.enqueued} - queue entries written</li>
 *   <li>{@code nudge.delivery.success} / {@code nudge.delivery.failure}</li>
 *   <li>{@code nudge.journey.started|advanced|completed}</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code nudge.delivery.batch.size} - entries picked up by the last poll</li>
 *   <li>{@code nudge.delivery.latency.ms} - provider latency of the last delivery</li>
 *   <li>{@code nudge.journey.active} - journey instances currently active</li>
 * </ul>
 *
 * <p>The {@code nudge} prefix is configurable for hosts running more than one engine.
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter triggerEnqueued;
  private final Counter triggerRejected;
  private final Counter triggerFailed;
  private final Counter queued;
  private final Counter deliverySuccess;
  private final Counter deliveryFailure;
  private final Counter journeyStarted;
  private final Counter journeyAdvanced;
  private final Counter journeyCompleted;
  private final Gauge batchSizeGauge;
  private final Gauge latencyGauge;
  private final Gauge activeJourneysGauge;

  private final AtomicInteger batchSize = new AtomicInteger();
  private final AtomicLong latencyMs = new AtomicLong();
  private final AtomicInteger activeJourneys = new AtomicInteger();
  private volatile boolean closed;

  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "nudge");
  }

  /**
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "tenant_a.nudge"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.triggerEnqueued = counter(namePrefix + ".trigger.enqueued", "Rule evaluations that queued a notification");
    this.triggerRejected = counter(namePrefix + ".trigger.rejected", "Rule evaluations stopped by a gate");
    this.triggerFailed = counter(namePrefix + ".trigger.failed", "Rule evaluations aborted by an error");
    this.queued = counter(namePrefix + ".queue.enqueued", "Queue entries written");
    this.deliverySuccess = counter(namePrefix + ".delivery.success", "Notifications delivered");
    this.deliveryFailure = counter(namePrefix + ".delivery.failure", "Notifications that failed delivery");
    this.journeyStarted = counter(namePrefix + ".journey.started", "Journeys started");
    this.journeyAdvanced = counter(namePrefix + ".journey.advanced", "Journey stage transitions");
    this.journeyCompleted = counter(namePrefix + ".journey.completed", "Journeys completed");

    this.batchSizeGauge = Gauge.builder(namePrefix + ".delivery.batch.size", batchSize, AtomicInteger::get)
        .register(registry);
    this.latencyGauge = Gauge.builder(namePrefix + ".delivery.latency.ms", latencyMs, AtomicLong::get)
        .register(registry);
    this.activeJourneysGauge = Gauge.builder(namePrefix + ".journey.active", activeJourneys, AtomicInteger::get)
        .register(registry);
  }

  private Counter counter(String name, String description) {
    return Counter.builder(name).description(description).register(registry);
  }

  @Override
  public void incrementTriggerEnqueued() {
    if (closed) return;
    triggerEnqueued.increment();
  }

  @Override
  public void incrementTriggerRejected() {
    if (closed) return;
    triggerRejected.increment();
  }

  @Override
  public void incrementTriggerFailed() {
    if (closed) return;
    triggerFailed.increment();
  }

  @Override
  public void incrementQueued() {
    if (closed) return;
    queued.increment();
  }

  @Override
  public void incrementDeliverySuccess() {
    if (closed) return;
    deliverySuccess.increment();
  }

  @Override
  public void incrementDeliveryFailure() {
    if (closed) return;
    deliveryFailure.increment();
  }

  @Override
  public void recordDeliveryLatencyMs(long latencyMs) {
    if (closed) return;
    this.latencyMs.set(latencyMs);
  }

  @Override
  public void recordBatchSize(int size) {
    if (closed) return;
    batchSize.set(size);
  }

  @Override
  public void incrementJourneyStarted() {
    if (closed) return;
    journeyStarted.increment();
  }

  @Override
  public void incrementJourneyAdvanced() {
    if (closed) return;
    journeyAdvanced.increment();
  }

  @Override
  public void incrementJourneyCompleted() {
    if (closed) return;
    journeyCompleted.increment();
  }

  @Override
  public void recordActiveJourneys(int count) {
    if (closed) return;
    activeJourneys.set(count);
  }

  /**
   * Stops recording and removes this exporter's meters from the registry so that a closed
   * engine leaves no stale gauges behind.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(triggerEnqueued, triggerRejected, triggerFailed, queued,
        deliverySuccess, deliveryFailure, journeyStarted, journeyAdvanced, journeyCompleted,
        batchSizeGauge, latencyGauge, activeJourneysGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
