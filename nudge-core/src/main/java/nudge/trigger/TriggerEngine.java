package nudge.trigger;

import nudge.condition.ConditionEvaluator;
import nudge.delivery.NotificationRequest;
import nudge.delivery.NotificationService;
import nudge.delivery.PendingSend;
import nudge.delivery.SendResult;
import nudge.model.NotificationTemplate;
import nudge.model.RateLimit;
import nudge.model.TimeWindow;
import nudge.model.TriggerRule;
import nudge.spi.ConnectionProvider;
import nudge.spi.MetricsExporter;
import nudge.spi.QueueStore;
import nudge.spi.RuleStore;
import nudge.spi.SegmentResolver;
import nudge.template.TemplateResolver;
import nudge.util.DaemonThreadFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Matches behavioral events against active trigger rules and enqueues notifications.
 *
 * <p>Each matched rule runs through the gates in {@link RuleOutcome.Gate} order. The first
 * gate that says no stops the rule; a gate that throws marks the rule {@code FAILED} without
 * affecting the other rules for the same event. Rules matched by one event are evaluated
 * concurrently on a bounded worker pool.
 *
 * <p>The rule index is built by {@link #loadRules()} and swapped in atomically. It is loaded
 * lazily on the first event if the caller never loaded it.
 *
 * <p>Create instances via {@link #builder()}. Close to release the worker pool.
 */
public final class TriggerEngine implements TriggerEventSink, AutoCloseable {
    private static final Logger logger = Logger.getLogger(TriggerEngine.class.getName());

    private static final int LOCK_STRIPES = 64;

    private final ConnectionProvider connectionProvider;
    private final RuleStore ruleStore;
    private final QueueStore queueStore;
    private final SegmentResolver segmentResolver;
    private final TemplateResolver templateResolver;
    private final NotificationService notificationService;
    private final Clock clock;
    private final MetricsExporter metrics;
    private final ExecutorService workers;
    private final Object[] rateLocks = new Object[LOCK_STRIPES];

    private volatile Map<String, List<TriggerRule>> index;
    private volatile boolean closed;

    private TriggerEngine(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.ruleStore = Objects.requireNonNull(builder.ruleStore, "ruleStore");
        this.queueStore = Objects.requireNonNull(builder.queueStore, "queueStore");
        this.templateResolver = Objects.requireNonNull(builder.templateResolver, "templateResolver");
        this.notificationService = Objects.requireNonNull(builder.notificationService, "notificationService");
        this.segmentResolver = builder.segmentResolver != null ? builder.segmentResolver : SegmentResolver.NONE;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        if (builder.workerCount <= 0) {
            throw new IllegalArgumentException("workerCount must be > 0");
        }
        this.workers = Executors.newFixedThreadPool(builder.workerCount, new DaemonThreadFactory("nudge-trigger-"));
        for (int i = 0; i < LOCK_STRIPES; i++) {
            rateLocks[i] = new Object();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Rebuilds the {@code eventName -> rules} index from the active rules in the store.
     *
     * @return {@code true} if the index was replaced, {@code false} if the store failed and
     *         the previous index was kept
     */
    public boolean loadRules() {
        List<TriggerRule> rules;
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            rules = ruleStore.listActive(conn);
        } catch (SQLException | RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to load trigger rules, keeping previous index", e);
            return false;
        }
        Map<String, List<TriggerRule>> fresh = new LinkedHashMap<>();
        for (TriggerRule rule : rules) {
            if (rule.active()) {
                fresh.computeIfAbsent(rule.eventName(), k -> new ArrayList<>()).add(rule);
            }
        }
        fresh.replaceAll((k, v) -> Collections.unmodifiableList(v));
        index = Collections.unmodifiableMap(fresh);
        templateResolver.reload();
        logger.log(Level.INFO, "Loaded {0} trigger rules for {1} events", new Object[]{rules.size(), fresh.size()});
        return true;
    }

    /**
     * Returns the active rules currently subscribed to the given event name.
     */
    public List<TriggerRule> rulesFor(String eventName) {
        return currentIndex().getOrDefault(eventName, List.of());
    }

    /**
     * Seeds the store with rules that do not exist yet (matched by id), then reloads the index.
     *
     * @return the number of rules inserted
     */
    public int registerRules(List<TriggerRule> rules) {
        int inserted = 0;
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            for (TriggerRule rule : rules) {
                if (ruleStore.insertIfAbsent(conn, rule)) {
                    inserted++;
                }
            }
        } catch (SQLException | RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to register trigger rules", e);
        }
        loadRules();
        return inserted;
    }

    /**
     * Runs every active rule subscribed to the event's name and reports one outcome per rule.
     * Never throws; failures are reported as {@code FAILED} outcomes.
     */
    public List<RuleOutcome> processEvent(TriggerEvent event) {
        Objects.requireNonNull(event, "event");
        if (closed) {
            logger.log(Level.WARNING, "TriggerEngine is closed, dropping event {0}", event.eventName());
            return List.of();
        }
        List<TriggerRule> rules = rulesFor(event.eventName());
        if (rules.isEmpty()) {
            logger.log(Level.FINE, "No rules for event {0}", event.eventName());
            return List.of();
        }
        Instant now = clock.instant();
        if (rules.size() == 1) {
            return List.of(safeEvaluate(rules.get(0), event, now));
        }
        List<Callable<RuleOutcome>> tasks = new ArrayList<>(rules.size());
        for (TriggerRule rule : rules) {
            tasks.add(() -> safeEvaluate(rule, event, now));
        }
        List<RuleOutcome> outcomes = new ArrayList<>(rules.size());
        try {
            List<Future<RuleOutcome>> futures = workers.invokeAll(tasks);
            for (int i = 0; i < futures.size(); i++) {
                outcomes.add(await(futures.get(i), rules.get(i)));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.log(Level.WARNING, "Interrupted while processing event " + event.eventName(), e);
        } catch (RejectedExecutionException e) {
            logger.log(Level.WARNING, "TriggerEngine is shutting down, dropping event " + event.eventName(), e);
        }
        return outcomes;
    }

    @Override
    public void emit(TriggerEvent event) {
        processEvent(event);
    }

    /**
     * Runs a single rule's pipeline for a user, bypassing event-name matching. The synthetic
     * event carries the rule's own event name and the supplied data.
     *
     * @return the outcome, or empty if no active rule has the slug
     */
    public Optional<RuleOutcome> triggerManual(String ruleSlug, String userId, Map<String, Object> data) {
        Objects.requireNonNull(ruleSlug, "ruleSlug");
        Optional<TriggerRule> rule = findRule(ruleSlug);
        if (rule.isEmpty()) {
            logger.log(Level.WARNING, "No active trigger rule with slug {0}", ruleSlug);
            return Optional.empty();
        }
        TriggerEvent event = TriggerEvent.builder(rule.get().eventName())
            .userId(userId)
            .data(data)
            .metadata(Map.of("manual", true))
            .build();
        return Optional.of(safeEvaluate(rule.get(), event, clock.instant()));
    }

    private Optional<TriggerRule> findRule(String slug) {
        for (List<TriggerRule> rules : currentIndex().values()) {
            for (TriggerRule rule : rules) {
                if (rule.slug().equals(slug)) {
                    return Optional.of(rule);
                }
            }
        }
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            return ruleStore.findBySlug(conn, slug).filter(TriggerRule::active);
        } catch (SQLException | RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to look up trigger rule " + slug, e);
            return Optional.empty();
        }
    }

    private Map<String, List<TriggerRule>> currentIndex() {
        Map<String, List<TriggerRule>> current = index;
        if (current == null) {
            synchronized (this) {
                if (index == null && !loadRules()) {
                    return Map.of();
                }
                current = index;
            }
        }
        return current;
    }

    private RuleOutcome await(Future<RuleOutcome> future, TriggerRule rule) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            logger.log(Level.WARNING, "Rule " + rule.slug() + " failed", e.getCause());
            metrics.incrementTriggerFailed();
            return RuleOutcome.failed(rule, null, String.valueOf(e.getCause()));
        }
    }

    private RuleOutcome safeEvaluate(TriggerRule rule, TriggerEvent event, Instant now) {
        RuleOutcome outcome;
        try {
            outcome = evaluate(rule, event, now);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Rule " + rule.slug() + " failed for event " + event.eventName(), e);
            outcome = RuleOutcome.failed(rule, null, e.getMessage());
        }
        switch (outcome.status()) {
            case ENQUEUED:
                metrics.incrementTriggerEnqueued();
                break;
            case REJECTED:
                metrics.incrementTriggerRejected();
                break;
            default:
                metrics.incrementTriggerFailed();
        }
        return outcome;
    }

    RuleOutcome evaluate(TriggerRule rule, TriggerEvent event, Instant now) {
        if (!ConditionEvaluator.INSTANCE.evaluate(rule.conditions(), event.toContext())) {
            logger.log(Level.FINE, "Rule {0}: conditions not met", rule.slug());
            return RuleOutcome.rejected(rule, RuleOutcome.Gate.CONDITIONS, "Conditions not met");
        }

        String recipientId = event.recipientId();
        if (recipientId == null) {
            return RuleOutcome.rejected(rule, RuleOutcome.Gate.TARGETING, "Event has no user or session id");
        }
        if (!rule.targetSegments().isEmpty() || !rule.excludeSegments().isEmpty()) {
            Set<String> segments;
            try {
                segments = segmentResolver.segmentsOf(recipientId);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Rule " + rule.slug() + ": segment lookup failed for " + recipientId, e);
                return RuleOutcome.failed(rule, RuleOutcome.Gate.TARGETING, e.getMessage());
            }
            if (segments == null) {
                segments = Set.of();
            }
            if (!rule.targetSegments().isEmpty() && Collections.disjoint(rule.targetSegments(), segments)) {
                return RuleOutcome.rejected(rule, RuleOutcome.Gate.TARGETING, "Not in target segments");
            }
            if (!Collections.disjoint(rule.excludeSegments(), segments)) {
                return RuleOutcome.rejected(rule, RuleOutcome.Gate.TARGETING, "In excluded segment");
            }
        }

        RateLimit rateLimit = rule.rateLimit();
        Admission admission;
        if (event.userId() == null || rateLimit.isUnlimited()) {
            admission = windowAndEnqueue(rule, event, now);
        } else {
            admission = rateLimitedEnqueue(rule, event, now, rateLimit);
        }
        // immediate deliveries run outside the stripe lock so a slow provider only holds its own slot
        if (admission.pending() != null) {
            notificationService.complete(admission.pending());
        }
        return admission.outcome();
    }

    private Admission rateLimitedEnqueue(TriggerRule rule, TriggerEvent event, Instant now, RateLimit rateLimit) {
        // count and enqueue together, or concurrent identical events could all pass the count
        synchronized (rateLocks[stripeOf(rule.id(), event.userId())]) {
            int recent;
            try (Connection conn = connectionProvider.getConnection()) {
                conn.setAutoCommit(true);
                recent = queueStore.countRecentSends(conn, rule.id(), event.userId(), now.minus(rateLimit.cooldown()));
            } catch (SQLException | RuntimeException e) {
                logger.log(Level.WARNING, "Rule " + rule.slug() + ": rate limit check failed", e);
                return Admission.of(RuleOutcome.failed(rule, RuleOutcome.Gate.RATE_LIMIT, e.getMessage()));
            }
            if (recent >= rateLimit.maxSendsPerUser()) {
                logger.log(Level.FINE, "Rule {0}: rate limited for {1}", new Object[]{rule.slug(), event.userId()});
                return Admission.of(RuleOutcome.rejected(rule, RuleOutcome.Gate.RATE_LIMIT,
                    "Rate limit of " + rateLimit.maxSendsPerUser() + " reached"));
            }
            return windowAndEnqueue(rule, event, now);
        }
    }

    static int stripeOf(String ruleId, String userId) {
        return Math.floorMod((ruleId + '\u0000' + userId).hashCode(), LOCK_STRIPES);
    }

    private Admission windowAndEnqueue(TriggerRule rule, TriggerEvent event, Instant now) {
        TimeWindow window = rule.timeWindow();
        if (window != null) {
            ZoneId zone = window.zone() != null ? window.zone() : clock.getZone();
            if (!window.permits(now.atZone(zone))) {
                return Admission.of(RuleOutcome.rejected(rule, RuleOutcome.Gate.TIME_WINDOW, "Outside time window"));
            }
        }

        NotificationTemplate template;
        try {
            Optional<NotificationTemplate> found = templateResolver.forRule(rule);
            if (found.isEmpty()) {
                return Admission.of(RuleOutcome.rejected(rule, RuleOutcome.Gate.TEMPLATE, "No active template"));
            }
            template = found.get();
        } catch (SQLException | RuntimeException e) {
            logger.log(Level.WARNING, "Rule " + rule.slug() + ": template lookup failed", e);
            return Admission.of(RuleOutcome.failed(rule, RuleOutcome.Gate.TEMPLATE, e.getMessage()));
        }

        Instant base = event.timestamp() != null && event.timestamp().isAfter(now) ? event.timestamp() : now;
        Instant scheduledFor = base.plus(Duration.ofMinutes(rule.delayMinutes()));
        PendingSend pending = notificationService.enqueue(
            NotificationRequest.builder(template.slug(), event.recipientId())
                .data(event.data())
                .scheduledFor(scheduledFor)
                .priority(rule.priority())
                .triggerId(rule.id())
                .channelPriority(rule.channelPriority())
                .build());
        SendResult result = pending.result();
        if (result.accepted()) {
            logger.log(Level.FINE, "Rule {0} enqueued {1} for {2}",
                new Object[]{rule.slug(), result.entryId(), event.recipientId()});
            return new Admission(RuleOutcome.enqueued(rule, result.entryId()), pending);
        }
        if (result.status() == SendResult.Status.REJECTED) {
            return Admission.of(RuleOutcome.rejected(rule, RuleOutcome.Gate.DELIVERY, result.reason()));
        }
        logger.log(Level.WARNING, "Rule {0}: enqueue failed: {1}", new Object[]{rule.slug(), result.reason()});
        return Admission.of(RuleOutcome.failed(rule, RuleOutcome.Gate.DELIVERY, result.reason()));
    }

    /**
     * Gate decision plus the claimed send, if any, still to be delivered.
     */
    private record Admission(RuleOutcome outcome, PendingSend pending) {
        static Admission of(RuleOutcome outcome) {
            return new Admission(outcome, null);
        }
    }

    /**
     * Shuts down the worker pool. Events received afterwards are dropped.
     */
    @Override
    public synchronized void close() {
        closed = true;
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Builder for {@link TriggerEngine}.
     */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private RuleStore ruleStore;
        private QueueStore queueStore;
        private SegmentResolver segmentResolver;
        private TemplateResolver templateResolver;
        private NotificationService notificationService;
        private Clock clock;
        private MetricsExporter metrics;
        private int workerCount = 4;

        private Builder() {
        }

        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        public Builder ruleStore(RuleStore ruleStore) {
            this.ruleStore = ruleStore;
            return this;
        }

        /**
         * Sets the queue store consulted for recent sends by the rate-limit gate.
         */
        public Builder queueStore(QueueStore queueStore) {
            this.queueStore = queueStore;
            return this;
        }

        /**
         * Optional. Defaults to {@link SegmentResolver#NONE}, under which rules with target
         * segments never fire.
         */
        public Builder segmentResolver(SegmentResolver segmentResolver) {
            this.segmentResolver = segmentResolver;
            return this;
        }

        public Builder templateResolver(TemplateResolver templateResolver) {
            this.templateResolver = templateResolver;
            return this;
        }

        public Builder notificationService(NotificationService notificationService) {
            this.notificationService = notificationService;
            return this;
        }

        /**
         * Optional. Defaults to the system UTC clock; its zone is used for rules whose time
         * window carries no zone.
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Optional. Defaults to {@code 4}. Must be &gt; 0.
         */
        public Builder workerCount(int workerCount) {
            this.workerCount = workerCount;
            return this;
        }

        public TriggerEngine build() {
            return new TriggerEngine(this);
        }
    }
}
