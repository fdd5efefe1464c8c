package nudge.delivery;

import nudge.model.Channel;
import nudge.model.Priority;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Direct request to queue a notification, bypassing trigger matching.
 */
public final class NotificationRequest {
    private final String templateSlug;
    private final String recipientId;
    private final Map<String, Object> data;
    private final Instant scheduledFor;
    private final Priority priority;
    private final String triggerId;
    private final String campaignId;
    private final Channel channel;
    private final List<Channel> channelPriority;

    private NotificationRequest(Builder builder) {
        this.templateSlug = Objects.requireNonNull(builder.templateSlug, "templateSlug");
        this.recipientId = Objects.requireNonNull(builder.recipientId, "recipientId");
        if (recipientId.isEmpty()) {
            throw new IllegalArgumentException("recipientId cannot be empty");
        }
        this.data = builder.data == null || builder.data.isEmpty()
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(builder.data));
        this.scheduledFor = builder.scheduledFor;
        this.priority = builder.priority == null ? Priority.NORMAL : builder.priority;
        this.triggerId = builder.triggerId;
        this.campaignId = builder.campaignId;
        this.channel = builder.channel;
        this.channelPriority = builder.channelPriority == null ? List.of() : List.copyOf(builder.channelPriority);
    }

    public static Builder builder(String templateSlug, String recipientId) {
        return new Builder(templateSlug, recipientId);
    }

    public String templateSlug() {
        return templateSlug;
    }

    public String recipientId() {
        return recipientId;
    }

    public Map<String, Object> data() {
        return data;
    }

    /**
     * Returns the requested send time, or {@code null} for "now".
     */
    public Instant scheduledFor() {
        return scheduledFor;
    }

    public Priority priority() {
        return priority;
    }

    public String triggerId() {
        return triggerId;
    }

    public String campaignId() {
        return campaignId;
    }

    /**
     * Returns the explicitly requested channel, or {@code null} to let preferences decide.
     */
    public Channel channel() {
        return channel;
    }

    public List<Channel> channelPriority() {
        return channelPriority;
    }

    public static final class Builder {
        private final String templateSlug;
        private final String recipientId;
        private Map<String, Object> data;
        private Instant scheduledFor;
        private Priority priority;
        private String triggerId;
        private String campaignId;
        private Channel channel;
        private List<Channel> channelPriority;

        private Builder(String templateSlug, String recipientId) {
            this.templateSlug = templateSlug;
            this.recipientId = recipientId;
        }

        public Builder data(Map<String, Object> data) {
            this.data = data;
            return this;
        }

        public Builder scheduledFor(Instant scheduledFor) {
            this.scheduledFor = scheduledFor;
            return this;
        }

        /**
         * Optional. Defaults to {@link Priority#NORMAL}.
         */
        public Builder priority(Priority priority) {
            this.priority = priority;
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

        public Builder channel(Channel channel) {
            this.channel = channel;
            return this;
        }

        public Builder channelPriority(List<Channel> channelPriority) {
            this.channelPriority = channelPriority;
            return this;
        }

        public NotificationRequest build() {
            return new NotificationRequest(this);
        }
    }
}
