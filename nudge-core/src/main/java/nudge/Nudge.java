package nudge;

import nudge.channel.ChannelRegistry;
import nudge.delivery.DeliveryPoller;
import nudge.delivery.NotificationRequest;
import nudge.delivery.NotificationService;
import nudge.delivery.SendResult;
import nudge.lifecycle.JourneyInstance;
import nudge.lifecycle.JourneyTemplate;
import nudge.lifecycle.JourneyTransition;
import nudge.lifecycle.LifecycleEngine;
import nudge.model.TriggerRule;
import nudge.spi.AnalyticsStore;
import nudge.spi.ConnectionProvider;
import nudge.spi.MetricsExporter;
import nudge.spi.PreferenceStore;
import nudge.spi.QueueStore;
import nudge.spi.RuleStore;
import nudge.spi.SegmentResolver;
import nudge.spi.TemplateStore;
import nudge.spi.UserDataProvider;
import nudge.template.Personalizer;
import nudge.template.TemplateResolver;
import nudge.trigger.RuleOutcome;
import nudge.trigger.TriggerEngine;
import nudge.trigger.TriggerEvent;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composite entry point that wires the {@link TriggerEngine}, {@link NotificationService},
 * {@link DeliveryPoller} and {@link LifecycleEngine} into a single {@link AutoCloseable} unit.
 *
 * <p>Behavioral events go to both engines: the trigger engine matches them against rules,
 * the lifecycle engine uses them to complete or advance the user's journeys. Journey stage
 * events flow back into the trigger engine only.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (Nudge nudge = Nudge.builder()
 *     .connectionProvider(connProvider)
 *     .ruleStore(rules)
 *     .templateStore(templates)
 *     .preferenceStore(preferences)
 *     .queueStore(queue)
 *     .analyticsStore(analytics)
 *     .channelRegistry(registry)
 *     .build()) {
 *   nudge.start();
 *   nudge.processEvent(TriggerEvent.builder("quiz_abandoned").userId("u1").build());
 * }
 * }</pre>
 */
public final class Nudge implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(Nudge.class.getName());

  private final NotificationService notificationService;
  private final TriggerEngine triggerEngine;
  private final DeliveryPoller deliveryPoller;
  private final LifecycleEngine lifecycleEngine;
  private final MetricsExporter metrics;
  private final boolean lifecycleEnabled;
  private final AtomicBoolean started = new AtomicBoolean();

  private Nudge(Builder builder) {
    Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    Objects.requireNonNull(builder.templateStore, "templateStore");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    Clock clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    TemplateResolver templateResolver = new TemplateResolver(builder.connectionProvider, builder.templateStore);

    this.notificationService = NotificationService.builder()
        .connectionProvider(builder.connectionProvider)
        .queueStore(builder.queueStore)
        .preferenceStore(builder.preferenceStore)
        .analyticsStore(builder.analyticsStore)
        .templateResolver(templateResolver)
        .personalizer(new Personalizer(builder.userDataProvider, clock))
        .channelRegistry(builder.channelRegistry)
        .metrics(metrics)
        .clock(clock)
        .build();
    this.triggerEngine = TriggerEngine.builder()
        .connectionProvider(builder.connectionProvider)
        .ruleStore(builder.ruleStore)
        .queueStore(builder.queueStore)
        .segmentResolver(builder.segmentResolver)
        .templateResolver(templateResolver)
        .notificationService(notificationService)
        .clock(clock)
        .metrics(metrics)
        .workerCount(builder.workerCount)
        .build();
    this.deliveryPoller = DeliveryPoller.builder()
        .notificationService(notificationService)
        .batchSize(builder.batchSize)
        .intervalMs(builder.intervalMs)
        .build();
    LifecycleEngine.Builder lifecycle = LifecycleEngine.builder()
        .eventSink(triggerEngine)
        .userDataProvider(builder.userDataProvider)
        .clock(clock)
        .metrics(metrics)
        .sweepIntervalMs(builder.sweepIntervalMs);
    if (builder.journeyTemplates != null) {
      lifecycle.templates(builder.journeyTemplates);
    }
    this.lifecycleEngine = lifecycle.build();
    this.lifecycleEnabled = builder.lifecycleEnabled;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Loads the rule index and starts the delivery poller and, if enabled, the journey sweep.
   * Subsequent calls are no-ops.
   */
  public void start() {
    if (!started.compareAndSet(false, true)) {
      return;
    }
    triggerEngine.loadRules();
    deliveryPoller.start();
    if (lifecycleEnabled) {
      lifecycleEngine.start();
    }
    logger.log(Level.INFO, "Nudge started (lifecycle sweep {0})", lifecycleEnabled ? "on" : "off");
  }

  /**
   * Runs trigger matching for the event and, when it names a user, applies it to that
   * user's journeys.
   *
   * @return one outcome per matched rule
   */
  public List<RuleOutcome> processEvent(TriggerEvent event) {
    List<RuleOutcome> outcomes = triggerEngine.processEvent(event);
    if (event.userId() != null) {
      lifecycleEngine.processUserEvent(event.userId(), event.eventName(), event.data());
    }
    return outcomes;
  }

  public SendResult sendNotification(NotificationRequest request) {
    return notificationService.sendNotification(request);
  }

  public Optional<RuleOutcome> triggerManual(String ruleSlug, String userId, Map<String, Object> data) {
    return triggerEngine.triggerManual(ruleSlug, userId, data);
  }

  public boolean startJourney(String userId, String journeyType, Map<String, Object> metadata) {
    return lifecycleEngine.startJourney(userId, journeyType, metadata);
  }

  public List<JourneyTransition> processUserEvent(String userId, String eventName, Map<String, Object> data) {
    return lifecycleEngine.processUserEvent(userId, eventName, data);
  }

  public boolean pauseJourney(String userId, String journeyType) {
    return lifecycleEngine.pauseJourney(userId, journeyType);
  }

  public boolean resumeJourney(String userId, String journeyType) {
    return lifecycleEngine.resumeJourney(userId, journeyType);
  }

  public List<JourneyInstance> getUserJourneyStatus(String userId) {
    return lifecycleEngine.getUserJourneyStatus(userId);
  }

  public Collection<JourneyTemplate> getJourneyTemplates() {
    return lifecycleEngine.getJourneyTemplates();
  }

  /**
   * Rebuilds the rule index and template cache from the stores.
   *
   * @return {@code false} if the store failed and the previous index was kept
   */
  public boolean reloadRules() {
    return triggerEngine.loadRules();
  }

  /**
   * Inserts the given rules where absent and reloads the index.
   *
   * @return the number of rules inserted
   */
  public int registerRules(List<TriggerRule> rules) {
    return triggerEngine.registerRules(rules);
  }

  public NotificationService notificationService() {
    return notificationService;
  }

  public TriggerEngine triggerEngine() {
    return triggerEngine;
  }

  public DeliveryPoller deliveryPoller() {
    return deliveryPoller;
  }

  public LifecycleEngine lifecycleEngine() {
    return lifecycleEngine;
  }

  /**
   * Shuts down components in order: journey sweep, delivery poller, trigger workers.
   */
  @Override
  public void close() {
    List<AutoCloseable> components = new ArrayList<>(List.of(lifecycleEngine, deliveryPoller, triggerEngine));
    if (metrics instanceof AutoCloseable closeable) {
      components.add(closeable);
    }
    RuntimeException first = null;
    for (AutoCloseable component : components) {
      try {
        component.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /**
   * Builder for {@link Nudge}. Stores and the channel registry are required; everything
   * else has a default.
   */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private RuleStore ruleStore;
    private TemplateStore templateStore;
    private PreferenceStore preferenceStore;
    private QueueStore queueStore;
    private AnalyticsStore analyticsStore;
    private ChannelRegistry channelRegistry;
    private SegmentResolver segmentResolver;
    private UserDataProvider userDataProvider = UserDataProvider.EMPTY;
    private MetricsExporter metrics;
    private Clock clock;
    private Collection<JourneyTemplate> journeyTemplates;
    private int batchSize = 50;
    private long intervalMs = 10_000L;
    private int workerCount = 4;
    private long sweepIntervalMs = 300_000L;
    private boolean lifecycleEnabled = true;

    private Builder() {
    }

    /**
     * <b>Required.</b>
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * <b>Required.</b>
     */
    public Builder ruleStore(RuleStore ruleStore) {
      this.ruleStore = ruleStore;
      return this;
    }

    /**
     * <b>Required.</b>
     */
    public Builder templateStore(TemplateStore templateStore) {
      this.templateStore = templateStore;
      return this;
    }

    /**
     * <b>Required.</b>
     */
    public Builder preferenceStore(PreferenceStore preferenceStore) {
      this.preferenceStore = preferenceStore;
      return this;
    }

    /**
     * <b>Required.</b>
     */
    public Builder queueStore(QueueStore queueStore) {
      this.queueStore = queueStore;
      return this;
    }

    /**
     * <b>Required.</b>
     */
    public Builder analyticsStore(AnalyticsStore analyticsStore) {
      this.analyticsStore = analyticsStore;
      return this;
    }

    /**
     * <b>Required.</b>
     */
    public Builder channelRegistry(ChannelRegistry channelRegistry) {
      this.channelRegistry = channelRegistry;
      return this;
    }

    public Builder segmentResolver(SegmentResolver segmentResolver) {
      this.segmentResolver = segmentResolver;
      return this;
    }

    /**
     * Sets the source of user profile data, used both for personalization and for journey
     * stage conditions.
     */
    public Builder userDataProvider(UserDataProvider userDataProvider) {
      this.userDataProvider = userDataProvider != null ? userDataProvider : UserDataProvider.EMPTY;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Replaces the built-in journey catalog.
     */
    public Builder journeyTemplates(Collection<JourneyTemplate> journeyTemplates) {
      this.journeyTemplates = journeyTemplates;
      return this;
    }

    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    public Builder intervalMs(long intervalMs) {
      this.intervalMs = intervalMs;
      return this;
    }

    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    public Builder sweepIntervalMs(long sweepIntervalMs) {
      this.sweepIntervalMs = sweepIntervalMs;
      return this;
    }

    /**
     * Whether {@link Nudge#start()} schedules the journey sweep. Journeys still advance on
     * user events when disabled.
     */
    public Builder lifecycleEnabled(boolean lifecycleEnabled) {
      this.lifecycleEnabled = lifecycleEnabled;
      return this;
    }

    /**
     * @throws NullPointerException     if a required collaborator is missing
     * @throws IllegalArgumentException if a numeric option is out of range
     */
    public Nudge build() {
      return new Nudge(this);
    }
  }
}
