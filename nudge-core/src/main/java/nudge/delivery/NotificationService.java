package nudge.delivery;

import nudge.channel.ChannelProvider;
import nudge.channel.ChannelRegistry;
import nudge.channel.DeliveryResult;
import nudge.channel.OutboundMessage;
import nudge.channel.ProviderCalls;
import nudge.model.AnalyticsAggregate;
import nudge.model.AnalyticsKey;
import nudge.model.AnalyticsQuery;
import nudge.model.Channel;
import nudge.model.DeliveryStatus;
import nudge.model.NotificationTemplate;
import nudge.model.QueueEntry;
import nudge.model.UserPreferences;
import nudge.spi.AnalyticsStore;
import nudge.spi.ConnectionProvider;
import nudge.spi.MetricsExporter;
import nudge.spi.PreferenceStore;
import nudge.spi.QueueStore;
import nudge.template.ChannelPolicy;
import nudge.template.Personalizer;
import nudge.template.RenderedContent;
import nudge.template.TemplateResolver;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Queue writer and single-entry delivery pipeline.
 *
 * <p>{@link #sendNotification} resolves the template, checks the recipient's preferences,
 * picks a channel, renders the content and writes a {@code QUEUED} entry. Entries with an
 * immediate priority ({@code HIGH}, {@code URGENT}) are written already claimed
 * ({@code SENDING}) and delivered before the call returns; everything else waits for the
 * {@link DeliveryPoller}. {@link #enqueue} and {@link #complete} split the two steps for
 * callers that must not hold locks across a provider call.
 *
 * <p>{@link #deliver} claims an entry ({@code QUEUED -> SENDING}), hands it to the channel's
 * provider, records {@code SENT} or {@code FAILED} and folds the attempt into the hourly
 * analytics. Failed entries are not re-queued; the retry count is incremented for inspection.
 *
 * <p>This class is thread-safe.
 *
 * @see DeliveryPoller
 */
public final class NotificationService {
  private static final Logger logger = Logger.getLogger(NotificationService.class.getName());

  static final String OPTED_OUT = "User has opted out of all channels";
  static final String NOT_FOUND = "Notification not found";

  private final ConnectionProvider connectionProvider;
  private final QueueStore queueStore;
  private final PreferenceStore preferenceStore;
  private final AnalyticsStore analyticsStore;
  private final TemplateResolver templateResolver;
  private final Personalizer personalizer;
  private final ChannelRegistry channelRegistry;
  private final InFlightTracker inFlightTracker;
  private final MetricsExporter metrics;
  private final Clock clock;

  private NotificationService(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.queueStore = Objects.requireNonNull(builder.queueStore, "queueStore");
    this.preferenceStore = Objects.requireNonNull(builder.preferenceStore, "preferenceStore");
    this.analyticsStore = Objects.requireNonNull(builder.analyticsStore, "analyticsStore");
    this.templateResolver = Objects.requireNonNull(builder.templateResolver, "templateResolver");
    this.personalizer = Objects.requireNonNull(builder.personalizer, "personalizer");
    this.channelRegistry = Objects.requireNonNull(builder.channelRegistry, "channelRegistry");
    this.inFlightTracker = builder.inFlightTracker != null ? builder.inFlightTracker : new DefaultInFlightTracker();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Queues a notification, delivering it synchronously when its priority is immediate.
   *
   * @param request what to send and to whom
   * @return the outcome; never {@code null}
   */
  public SendResult sendNotification(NotificationRequest request) {
    return complete(enqueue(request));
  }

  /**
   * Writes the queue entry without delivering it. An entry with an immediate priority is
   * written in {@code SENDING} state and must be finished with {@link #complete}.
   *
   * @param request what to send and to whom
   * @return the pending send; never {@code null}
   */
  public PendingSend enqueue(NotificationRequest request) {
    Objects.requireNonNull(request, "request");
    NotificationTemplate template;
    try {
      template = templateResolver.findBySlug(request.templateSlug()).orElse(null);
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to look up template " + request.templateSlug(), e);
      return PendingSend.done(SendResult.failed("Template lookup failed: " + e.getMessage()));
    }
    if (template == null) {
      return PendingSend.done(SendResult.rejected("Template not found: " + request.templateSlug()));
    }

    UserPreferences preferences;
    try {
      preferences = preferencesOf(request.recipientId());
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to load preferences for " + request.recipientId(), e);
      return PendingSend.done(SendResult.failed("Preference lookup failed: " + e.getMessage()));
    }

    Set<Channel> allowed = ChannelPolicy.allowedChannels(template, preferences);
    if (allowed.isEmpty()) {
      return PendingSend.done(SendResult.rejected(OPTED_OUT));
    }
    Optional<Channel> channel = ChannelPolicy.select(allowed, request.channelPriority(), channelRegistry, request.channel());
    if (channel.isEmpty()) {
      return PendingSend.done(SendResult.rejected("Channel " + request.channel().code() + " is not allowed for this user"));
    }

    RenderedContent content = personalizer.personalize(template, request.recipientId(), request.data());
    Instant now = clock.instant();
    Instant scheduledFor = request.scheduledFor() == null ? now : request.scheduledFor();
    boolean immediate = request.priority().isImmediate();
    QueueEntry entry = QueueEntry.builder()
        .templateId(template.id())
        .triggerId(request.triggerId())
        .campaignId(request.campaignId())
        .recipientId(request.recipientId())
        .channel(channel.get())
        .subject(content.subject())
        .content(content.content())
        .html(content.html())
        .data(request.data())
        .scheduledFor(scheduledFor)
        .priority(request.priority())
        .status(immediate ? DeliveryStatus.SENDING : DeliveryStatus.QUEUED)
        .sentAt(immediate ? now : null)
        .createdAt(now)
        .build();

    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      queueStore.insert(conn, entry);
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to queue notification for " + request.recipientId()
          + " template=" + template.slug(), e);
      return PendingSend.done(SendResult.failed("Failed to queue notification: " + e.getMessage()));
    }
    metrics.incrementQueued();

    SendResult queued = SendResult.queued(entry.id(), scheduledFor);
    return immediate ? PendingSend.claimed(queued, entry) : PendingSend.done(queued);
  }

  /**
   * Delivers the claimed entry of a pending send and returns the final outcome. Sends that
   * were not claimed, or were already completed, return their enqueue outcome unchanged.
   */
  public SendResult complete(PendingSend pending) {
    Objects.requireNonNull(pending, "pending");
    QueueEntry entry = pending.takeClaimed();
    if (entry == null) {
      return pending.result();
    }
    DeliveryResult result = send(entry);
    return result.success()
        ? SendResult.delivered(entry.id(), entry.scheduledFor(), result)
        : SendResult.failed(entry.id(), entry.scheduledFor(), result);
  }

  /**
   * Delivers one queued entry. Never throws: every failure is returned as a failed result,
   * and failures after the entry was claimed are also recorded on the entry.
   *
   * @param entryId the entry to deliver
   * @return the normalized delivery outcome
   */
  public DeliveryResult deliver(String entryId) {
    Objects.requireNonNull(entryId, "entryId");
    if (!inFlightTracker.tryAcquire(entryId)) {
      return DeliveryResult.failure("Delivery already in progress");
    }
    try {
      return doDeliver(entryId);
    } finally {
      inFlightTracker.release(entryId);
    }
  }

  private DeliveryResult doDeliver(String entryId) {
    QueueEntry entry;
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      entry = queueStore.find(conn, entryId).orElse(null);
      if (entry == null) {
        return DeliveryResult.failure(NOT_FOUND);
      }
      if (entry.status() != DeliveryStatus.QUEUED) {
        return DeliveryResult.failure("Notification is already " + entry.status());
      }
      if (queueStore.markSending(conn, entryId, clock.instant()) == 0) {
        return DeliveryResult.failure("Notification was claimed by another delivery");
      }
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to claim notification " + entryId, e);
      return DeliveryResult.failure("Failed to claim notification: " + e.getMessage());
    }
    return send(entry);
  }

  private DeliveryResult send(QueueEntry entry) {
    Optional<ChannelProvider> provider = channelRegistry.providerFor(entry.channel());
    DeliveryResult result = provider.isPresent()
        ? ProviderCalls.send(provider.get(), OutboundMessage.from(entry))
        : DeliveryResult.failure("No provider available for channel " + entry.channel().code());
    recordOutcome(entry, result);
    return result;
  }

  private void recordOutcome(QueueEntry entry, DeliveryResult result) {
    Instant finishedAt = clock.instant();
    long deliveryTimeMs = result.deliveryTimeMs() == null ? 0L : Math.max(0L, result.deliveryTimeMs());
    if (result.success()) {
      metrics.incrementDeliverySuccess();
      metrics.recordDeliveryLatencyMs(deliveryTimeMs);
    } else {
      metrics.incrementDeliveryFailure();
      logger.log(Level.WARNING, "Delivery failed for notification " + entry.id() + ": " + result.errorMessage());
    }

    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      int updated = result.success()
          ? queueStore.markSent(conn, entry.id(), finishedAt, deliveryTimeMs, result.provider(), result.messageId())
          : queueStore.markFailed(conn, entry.id(), finishedAt, result.errorMessage());
      if (updated == 0) {
        logger.log(Level.WARNING, "Notification " + entry.id() + " left SENDING before its outcome was recorded");
      }
      try {
        AnalyticsKey key = AnalyticsKey.of(entry.templateId(), entry.channel(), finishedAt, clock.getZone());
        analyticsStore.record(conn, key, result.success(), deliveryTimeMs, result.cost());
      } catch (RuntimeException e) {
        logger.log(Level.SEVERE, "Failed to record delivery analytics for notification " + entry.id(), e);
      }
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to record delivery outcome for notification " + entry.id(), e);
    }
  }

  /**
   * Returns a queue entry by id.
   *
   * @throws SQLException if a connection cannot be obtained
   */
  public Optional<QueueEntry> find(String entryId) throws SQLException {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return queueStore.find(conn, entryId);
    }
  }

  /**
   * Returns the user's stored preferences, or {@link UserPreferences#defaults} if none are stored.
   *
   * @throws SQLException if a connection cannot be obtained
   */
  public UserPreferences preferencesOf(String userId) throws SQLException {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return preferenceStore.find(conn, userId).orElseGet(() -> UserPreferences.defaults(userId));
    }
  }

  /**
   * Saves a user's preferences.
   *
   * @return {@code true} if the preferences were stored
   */
  public boolean updateUserPreferences(UserPreferences preferences) {
    Objects.requireNonNull(preferences, "preferences");
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      preferenceStore.save(conn, preferences);
      return true;
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to update preferences for " + preferences.userId(), e);
      return false;
    }
  }

  /**
   * Reads hourly delivery aggregates, newest first.
   *
   * @throws SQLException if a connection cannot be obtained
   */
  public List<AnalyticsAggregate> analytics(AnalyticsQuery query) throws SQLException {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return analyticsStore.query(conn, query == null ? AnalyticsQuery.all() : query);
    }
  }

  /**
   * Returns up to {@code limit} due entries for the batch loop.
   */
  List<QueueEntry> selectDue(int limit) throws SQLException {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return queueStore.selectDue(conn, clock.instant(), limit);
    }
  }

  MetricsExporter metrics() {
    return metrics;
  }

  /**
   * Builder for {@link NotificationService}.
   */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private QueueStore queueStore;
    private PreferenceStore preferenceStore;
    private AnalyticsStore analyticsStore;
    private TemplateResolver templateResolver;
    private Personalizer personalizer;
    private ChannelRegistry channelRegistry;
    private InFlightTracker inFlightTracker;
    private MetricsExporter metrics;
    private Clock clock;

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
    public Builder queueStore(QueueStore queueStore) {
      this.queueStore = queueStore;
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
    public Builder analyticsStore(AnalyticsStore analyticsStore) {
      this.analyticsStore = analyticsStore;
      return this;
    }

    /**
     * <b>Required.</b>
     */
    public Builder templateResolver(TemplateResolver templateResolver) {
      this.templateResolver = templateResolver;
      return this;
    }

    /**
     * <b>Required.</b>
     */
    public Builder personalizer(Personalizer personalizer) {
      this.personalizer = personalizer;
      return this;
    }

    /**
     * <b>Required.</b>
     */
    public Builder channelRegistry(ChannelRegistry channelRegistry) {
      this.channelRegistry = channelRegistry;
      return this;
    }

    /**
     * Optional. Defaults to a {@link DefaultInFlightTracker}.
     */
    public Builder inFlightTracker(InFlightTracker inFlightTracker) {
      this.inFlightTracker = inFlightTracker;
      return this;
    }

    /**
     * Optional. Defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Optional. Defaults to {@link Clock#systemUTC()}. Its zone buckets analytics by hour.
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public NotificationService build() {
      return new NotificationService(this);
    }
  }
}
