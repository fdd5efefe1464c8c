package nudge.model;

import com.github.f4b6a3.ulid.UlidCreator;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Persisted, schedulable notification. Entries are created {@link DeliveryStatus#QUEUED},
 * mutated only by the delivery pipeline, and never deleted.
 *
 * <p>Each entry is assigned a ULID-based {@code id} by default.
 */
public final class QueueEntry {
    private final String id;
    private final String templateId;
    private final String triggerId;
    private final String campaignId;
    private final String recipientId;
    private final Channel channel;
    private final String subject;
    private final String content;
    private final String html;
    private final Map<String, Object> data;
    private final Instant scheduledFor;
    private final Priority priority;
    private final DeliveryStatus status;
    private final int retryCount;
    private final Instant createdAt;
    private final Instant sentAt;
    private final Instant deliveredAt;
    private final Instant failedAt;
    private final Long deliveryTimeMs;
    private final String provider;
    private final String providerMessageId;
    private final String errorMessage;

    private QueueEntry(Builder builder) {
        this.id = builder.id == null ? UlidCreator.getMonotonicUlid().toString() : builder.id;
        this.templateId = Objects.requireNonNull(builder.templateId, "templateId");
        this.recipientId = Objects.requireNonNull(builder.recipientId, "recipientId");
        this.channel = Objects.requireNonNull(builder.channel, "channel");
        this.triggerId = builder.triggerId;
        this.campaignId = builder.campaignId;
        this.subject = builder.subject;
        this.content = builder.content == null ? "" : builder.content;
        this.html = builder.html;
        this.data = builder.data == null || builder.data.isEmpty()
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(builder.data));
        this.createdAt = builder.createdAt == null ? Instant.now() : builder.createdAt;
        this.scheduledFor = builder.scheduledFor == null ? this.createdAt : builder.scheduledFor;
        this.priority = builder.priority == null ? Priority.NORMAL : builder.priority;
        this.status = builder.status == null ? DeliveryStatus.QUEUED : builder.status;
        if (builder.retryCount < 0) {
            throw new IllegalArgumentException("retryCount must be >= 0");
        }
        this.retryCount = builder.retryCount;
        this.sentAt = builder.sentAt;
        this.deliveredAt = builder.deliveredAt;
        this.failedAt = builder.failedAt;
        this.deliveryTimeMs = builder.deliveryTimeMs;
        this.provider = builder.provider;
        this.providerMessageId = builder.providerMessageId;
        this.errorMessage = builder.errorMessage;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder pre-populated with this entry's fields.
     */
    public Builder toBuilder() {
        return new Builder()
            .id(id)
            .templateId(templateId)
            .triggerId(triggerId)
            .campaignId(campaignId)
            .recipientId(recipientId)
            .channel(channel)
            .subject(subject)
            .content(content)
            .html(html)
            .data(data)
            .scheduledFor(scheduledFor)
            .priority(priority)
            .status(status)
            .retryCount(retryCount)
            .createdAt(createdAt)
            .sentAt(sentAt)
            .deliveredAt(deliveredAt)
            .failedAt(failedAt)
            .deliveryTimeMs(deliveryTimeMs)
            .provider(provider)
            .providerMessageId(providerMessageId)
            .errorMessage(errorMessage);
    }

    public String id() {
        return id;
    }

    public String templateId() {
        return templateId;
    }

    public String triggerId() {
        return triggerId;
    }

    public String campaignId() {
        return campaignId;
    }

    public String recipientId() {
        return recipientId;
    }

    public Channel channel() {
        return channel;
    }

    public String subject() {
        return subject;
    }

    public String content() {
        return content;
    }

    public String html() {
        return html;
    }

    public Map<String, Object> data() {
        return data;
    }

    public Instant scheduledFor() {
        return scheduledFor;
    }

    public Priority priority() {
        return priority;
    }

    public DeliveryStatus status() {
        return status;
    }

    public int retryCount() {
        return retryCount;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant sentAt() {
        return sentAt;
    }

    public Instant deliveredAt() {
        return deliveredAt;
    }

    public Instant failedAt() {
        return failedAt;
    }

    public Long deliveryTimeMs() {
        return deliveryTimeMs;
    }

    public String provider() {
        return provider;
    }

    public String providerMessageId() {
        return providerMessageId;
    }

    public String errorMessage() {
        return errorMessage;
    }

    public boolean isDue(Instant now) {
        return status == DeliveryStatus.QUEUED && !scheduledFor.isAfter(now);
    }

    @Override
    public String toString() {
        return "QueueEntry{id=" + id
            + ", recipientId=" + recipientId
            + ", channel=" + channel.code()
            + ", status=" + status
            + ", scheduledFor=" + scheduledFor + '}';
    }

    /**
     * Builder for {@link QueueEntry}. {@code templateId}, {@code recipientId} and
     * {@code channel} are required.
     */
    public static final class Builder {
        private String id;
        private String templateId;
        private String triggerId;
        private String campaignId;
        private String recipientId;
        private Channel channel;
        private String subject;
        private String content;
        private String html;
        private Map<String, Object> data;
        private Instant scheduledFor;
        private Priority priority;
        private DeliveryStatus status;
        private int retryCount;
        private Instant createdAt;
        private Instant sentAt;
        private Instant deliveredAt;
        private Instant failedAt;
        private Long deliveryTimeMs;
        private String provider;
        private String providerMessageId;
        private String errorMessage;

        private Builder() {
        }

        /**
         * Optional. Defaults to a monotonic ULID.
         */
        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder templateId(String templateId) {
            this.templateId = templateId;
            return this;
        }

        public Builder triggerId(String triggerId) {
            this.triggerId = triggerId;
            return this;
        }

        public Builder campaignId(String campaignId) {
            this.campaignId = campaignId;
            return this;
        }

        public Builder recipientId(String recipientId) {
            this.recipientId = recipientId;
            return this;
        }

        public Builder channel(Channel channel) {
            this.channel = channel;
            return this;
        }

        public Builder subject(String subject) {
            this.subject = subject;
            return this;
        }

        public Builder content(String content) {
            this.content = content;
            return this;
        }

        public Builder html(String html) {
            this.html = html;
            return this;
        }

        public Builder data(Map<String, Object> data) {
            this.data = data;
            return this;
        }

        /**
         * Optional. Defaults to {@code createdAt}.
         */
        public Builder scheduledFor(Instant scheduledFor) {
            this.scheduledFor = scheduledFor;
            return this;
        }

        public Builder priority(Priority priority) {
            this.priority = priority;
            return this;
        }

        public Builder status(DeliveryStatus status) {
            this.status = status;
            return this;
        }

        public Builder retryCount(int retryCount) {
            this.retryCount = retryCount;
            return this;
        }

        /**
         * Optional. Defaults to {@link Instant#now()}.
         */
        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder sentAt(Instant sentAt) {
            this.sentAt = sentAt;
            return this;
        }

        public Builder deliveredAt(Instant deliveredAt) {
            this.deliveredAt = deliveredAt;
            return this;
        }

        public Builder failedAt(Instant failedAt) {
            this.failedAt = failedAt;
            return this;
        }

        public Builder deliveryTimeMs(Long deliveryTimeMs) {
            this.deliveryTimeMs = deliveryTimeMs;
            return this;
        }

        public Builder provider(String provider) {
            this.provider = provider;
            return this;
        }

        public Builder providerMessageId(String providerMessageId) {
            this.providerMessageId = providerMessageId;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public QueueEntry build() {
            return new QueueEntry(this);
        }
    }
}
