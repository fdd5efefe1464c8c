package nudge.lifecycle;

import nudge.condition.ConditionEvaluator;
import nudge.spi.MetricsExporter;
import nudge.spi.UserDataProvider;
import nudge.trigger.TriggerEvent;
import nudge.trigger.TriggerEventSink;
import nudge.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drives users through multi-stage journeys.
 *
 * <p>An instance waits in its current stage for that stage's delay, then moves to the next
 * stage and emits the next stage's events into the {@link TriggerEventSink}, provided the
 * stage's conditions hold against a fresh user-data snapshot. A stage whose conditions fail is
 * entered silently. Leaving the last stage, or receiving one of the template's completion
 * events, completes the journey and removes the instance.
 *
 * <p>Advancement is checked reactively by {@link #processUserEvent} and periodically by
 * {@link #sweep()}, which {@link #start()} schedules. Paused instances do not advance but
 * still complete on completion events.
 *
 * <p>Instances are immutable and replaced with compare-and-set, so a reactive check and a
 * sweep racing on the same instance advance it at most once.
 */
public final class LifecycleEngine implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(LifecycleEngine.class.getName());

    static final String JOURNEY_COMPLETED = "journey_completed";

    private final TriggerEventSink eventSink;
    private final UserDataProvider userDataProvider;
    private final Map<String, JourneyTemplate> templates;
    private final Clock clock;
    private final MetricsExporter metrics;
    private final long sweepIntervalMs;
    private final ConcurrentHashMap<JourneyKey, JourneyInstance> instances = new ConcurrentHashMap<>();
    private final AtomicBoolean sweeping = new AtomicBoolean();

    private ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> sweepTask;
    private volatile boolean closed;

    private LifecycleEngine(Builder builder) {
        this.eventSink = Objects.requireNonNull(builder.eventSink, "eventSink");
        this.userDataProvider = builder.userDataProvider != null ? builder.userDataProvider : UserDataProvider.EMPTY;
        this.templates = builder.templates != null ? builder.templates : JourneyCatalog.defaults();
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        if (builder.sweepIntervalMs <= 0L) {
            throw new IllegalArgumentException("sweepIntervalMs must be > 0");
        }
        this.sweepIntervalMs = builder.sweepIntervalMs;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts the periodic sweep. Subsequent calls are no-ops if already started.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("LifecycleEngine has been closed");
        }
        if (sweepTask != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("nudge-journey-sweep-"));
        sweepTask = scheduler.scheduleWithFixedDelay(this::sweep, sweepIntervalMs, sweepIntervalMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Starts a journey at its first stage and emits that stage's events.
     *
     * @return {@code false} if the user already has an active instance of this journey type,
     *         or the template is missing or inactive
     */
    public boolean startJourney(String userId, String journeyType, Map<String, Object> metadata) {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(journeyType, "journeyType");
        JourneyTemplate template = templates.get(journeyType);
        if (template == null || !template.active()) {
            logger.log(Level.WARNING, "No active journey template for type {0}", journeyType);
            return false;
        }
        Instant now = clock.instant();
        JourneyInstance instance = JourneyInstance.start(userId, template, metadata, now);
        if (instances.putIfAbsent(instance.key(), instance) != null) {
            logger.log(Level.FINE, "Journey {0} already active for {1}", new Object[]{journeyType, userId});
            return false;
        }
        logger.log(Level.INFO, "Started journey {0} for {1}", new Object[]{journeyType, userId});
        metrics.incrementJourneyStarted();
        metrics.recordActiveJourneys(instances.size());
        try {
            enterStage(instance, template, 0, now);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Failed to emit first stage of " + journeyType + " for " + userId, e);
        }
        return true;
    }

    /**
     * Applies a user event to every active journey of that user: completion events end the
     * journey, anything else triggers an advancement check.
     */
    public List<JourneyTransition> processUserEvent(String userId, String eventName, Map<String, Object> data) {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(eventName, "eventName");
        Instant now = clock.instant();
        List<JourneyTransition> transitions = new ArrayList<>();
        for (JourneyInstance instance : getUserJourneyStatus(userId)) {
            transitions.add(safely(instance, () -> {
                JourneyTemplate template = templates.get(instance.journeyType());
                if (template != null && template.completesOn(eventName)) {
                    return complete(instance, template, now, false);
                }
                return advance(instance, now);
            }));
        }
        return transitions;
    }

    /**
     * Runs one advancement check over every active instance. Called automatically by the
     * scheduler, but may also be invoked directly for testing.
     *
     * @return the number of instances that advanced or completed
     */
    public int sweep() {
        if (closed || !sweeping.compareAndSet(false, true)) {
            return 0;
        }
        try {
            Instant now = clock.instant();
            int changed = 0;
            for (JourneyInstance instance : new ArrayList<>(instances.values())) {
                if (safely(instance, () -> advance(instance, now)).changed()) {
                    changed++;
                }
            }
            if (changed > 0) {
                logger.log(Level.FINE, "Journey sweep changed {0} instances", changed);
            }
            return changed;
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Journey sweep failed", t);
            return 0;
        } finally {
            sweeping.set(false);
        }
    }

    /**
     * Stops the delay clock of an active journey.
     *
     * @return {@code false} if there is no such journey or it is already paused
     */
    public boolean pauseJourney(String userId, String journeyType) {
        JourneyKey key = new JourneyKey(userId, journeyType);
        Instant now = clock.instant();
        while (true) {
            JourneyInstance current = instances.get(key);
            if (current == null || current.isPaused()) {
                return false;
            }
            if (instances.replace(key, current, current.pause(now))) {
                logger.log(Level.INFO, "Paused journey {0} for {1}", new Object[]{journeyType, userId});
                return true;
            }
        }
    }

    /**
     * Restarts the delay clock of a paused journey. The current stage's entry time moves
     * forward by the paused duration, so paused time does not count toward the stage delay.
     *
     * @return {@code false} if there is no such journey or it is not paused
     */
    public boolean resumeJourney(String userId, String journeyType) {
        JourneyKey key = new JourneyKey(userId, journeyType);
        Instant now = clock.instant();
        while (true) {
            JourneyInstance current = instances.get(key);
            if (current == null || !current.isPaused()) {
                return false;
            }
            if (instances.replace(key, current, current.resume(now))) {
                logger.log(Level.INFO, "Resumed journey {0} for {1}", new Object[]{journeyType, userId});
                return true;
            }
        }
    }

    /**
     * Returns the user's active journeys, oldest first.
     */
    public List<JourneyInstance> getUserJourneyStatus(String userId) {
        List<JourneyInstance> result = new ArrayList<>();
        for (JourneyInstance instance : instances.values()) {
            if (instance.userId().equals(userId)) {
                result.add(instance);
            }
        }
        result.sort(Comparator.comparing(JourneyInstance::startedAt));
        return result;
    }

    public Collection<JourneyTemplate> getJourneyTemplates() {
        return templates.values();
    }

    public int activeJourneys() {
        return instances.size();
    }

    private JourneyTransition advance(JourneyInstance instance, Instant now) {
        JourneyKey key = instance.key();
        if (instance.isPaused()) {
            return JourneyTransition.unchanged(key, instance.currentStage());
        }
        JourneyTemplate template = templates.get(instance.journeyType());
        if (template == null) {
            return JourneyTransition.failed(key, instance.currentStage(), "No journey template " + instance.journeyType());
        }
        JourneyStage stage = template.stage(instance.stageIndex());
        Duration elapsed = Duration.between(instance.lastStageAt(), now);
        if (elapsed.compareTo(Duration.ofMinutes(stage.delayMinutes())) < 0) {
            return JourneyTransition.unchanged(key, instance.currentStage());
        }
        if (template.isLast(instance.stageIndex())) {
            return complete(instance, template, now, true);
        }

        int next = instance.stageIndex() + 1;
        JourneyStage nextStage = template.stage(next);
        // snapshot before committing, so a failing provider leaves the instance where it was
        boolean emit = conditionsHold(instance, nextStage);
        JourneyInstance advanced = instance.advanceTo(next, nextStage.name(), now);
        if (!instances.replace(key, instance, advanced)) {
            return JourneyTransition.unchanged(key, instance.currentStage());
        }
        metrics.incrementJourneyAdvanced();
        logger.log(Level.FINE, "Journey {0} for {1}: {2} -> {3}",
            new Object[]{instance.journeyType(), instance.userId(), stage.name(), nextStage.name()});
        if (emit) {
            emitStage(advanced, nextStage, now);
        } else {
            logger.log(Level.FINE, "Journey {0} for {1}: conditions of {2} not met, no events",
                new Object[]{instance.journeyType(), instance.userId(), nextStage.name()});
        }
        return JourneyTransition.advanced(key, stage.name(), nextStage.name());
    }

    private JourneyTransition complete(JourneyInstance seen, JourneyTemplate template, Instant now, boolean finishedLastStage) {
        JourneyKey key = seen.key();
        JourneyInstance instance;
        if (finishedLastStage) {
            instance = instances.remove(key, seen) ? seen : null;
        } else {
            // completion events apply to whatever stage the instance has reached by now,
            // but never to a journey restarted after this one was read
            instance = removeSameRun(key, seen);
        }
        if (instance == null) {
            return JourneyTransition.unchanged(key, seen.currentStage());
        }
        List<String> completedStages = new ArrayList<>(instance.completedStages());
        if (finishedLastStage) {
            completedStages.add(instance.currentStage());
        }
        long durationMs = Duration.between(instance.startedAt(), now).toMillis();
        logger.log(Level.INFO, "Completed journey {0} for {1}", new Object[]{template.journeyType(), instance.userId()});
        metrics.incrementJourneyCompleted();
        metrics.recordActiveJourneys(instances.size());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("journeyType", template.journeyType());
        data.put("completedStages", completedStages);
        data.put("durationMs", durationMs);
        emit(TriggerEvent.builder(JOURNEY_COMPLETED)
            .userId(instance.userId())
            .data(data)
            .timestamp(now)
            .build());
        return JourneyTransition.completed(key, instance.currentStage());
    }

    private JourneyInstance removeSameRun(JourneyKey key, JourneyInstance seen) {
        while (true) {
            JourneyInstance current = instances.get(key);
            if (current == null || !current.startedAt().equals(seen.startedAt())) {
                return null;
            }
            if (instances.remove(key, current)) {
                return current;
            }
        }
    }

    private void enterStage(JourneyInstance instance, JourneyTemplate template, int index, Instant now) {
        JourneyStage stage = template.stage(index);
        if (conditionsHold(instance, stage)) {
            emitStage(instance, stage, now);
        }
    }

    private boolean conditionsHold(JourneyInstance instance, JourneyStage stage) {
        if (stage.conditions().isEmpty()) {
            return true;
        }
        Map<String, Object> snapshot = userDataProvider.snapshot(instance.userId());
        return ConditionEvaluator.INSTANCE.evaluate(stage.conditions(), snapshot == null ? Map.of() : snapshot);
    }

    private void emitStage(JourneyInstance instance, JourneyStage stage, Instant now) {
        Map<String, Object> data = new LinkedHashMap<>(instance.metadata());
        data.put("journeyType", instance.journeyType());
        data.put("stage", stage.name());
        Instant sendAt = now.plus(Duration.ofMinutes(stage.delayMinutes()));
        for (String eventName : stage.triggers()) {
            emit(TriggerEvent.builder(eventName)
                .userId(instance.userId())
                .data(data)
                .metadata(Map.of("journeyType", instance.journeyType()))
                .timestamp(sendAt)
                .build());
        }
    }

    private void emit(TriggerEvent event) {
        try {
            eventSink.emit(event);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Failed to emit journey event " + event.eventName(), e);
        }
    }

    private JourneyTransition safely(JourneyInstance instance, TransitionStep step) {
        try {
            return step.run();
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Journey " + instance.journeyType() + " for " + instance.userId()
                + " failed to advance, will retry", e);
            return JourneyTransition.failed(instance.key(), instance.currentStage(), e.getMessage());
        }
    }

    @FunctionalInterface
    private interface TransitionStep {
        JourneyTransition run();
    }

    /**
     * Cancels the sweep schedule. Active instances stay queryable.
     */
    @Override
    public synchronized void close() {
        closed = true;
        if (sweepTask != null) {
            sweepTask.cancel(false);
            sweepTask = null;
        }
        if (scheduler != null) {
            scheduler.shutdownNow();
            try {
                scheduler.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Builder for {@link LifecycleEngine}.
     */
    public static final class Builder {
        private TriggerEventSink eventSink;
        private UserDataProvider userDataProvider;
        private Map<String, JourneyTemplate> templates;
        private Clock clock;
        private MetricsExporter metrics;
        private long sweepIntervalMs = 300_000L;

        private Builder() {
        }

        /**
         * Sets where stage and completion events go, normally the trigger engine.
         *
         * <p><b>Required.</b>
         */
        public Builder eventSink(TriggerEventSink eventSink) {
            this.eventSink = eventSink;
            return this;
        }

        /**
         * Sets the source of user data that stage conditions are evaluated against.
         *
         * <p>Optional. Defaults to {@link UserDataProvider#EMPTY}.
         */
        public Builder userDataProvider(UserDataProvider userDataProvider) {
            this.userDataProvider = userDataProvider;
            return this;
        }

        /**
         * Replaces the journey templates.
         *
         * <p>Optional. Defaults to {@link JourneyCatalog#defaults()}.
         */
        public Builder templates(Collection<JourneyTemplate> templates) {
            this.templates = JourneyCatalog.of(templates);
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Optional. Defaults to {@code 300000} ms (5 minutes). Must be &gt; 0.
         */
        public Builder sweepIntervalMs(long sweepIntervalMs) {
            this.sweepIntervalMs = sweepIntervalMs;
            return this;
        }

        public LifecycleEngine build() {
            return new LifecycleEngine(this);
        }
    }
}
