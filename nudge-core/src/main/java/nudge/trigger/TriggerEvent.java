package nudge.trigger;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Behavioral event fed into the trigger engine, e.g. {@code quiz_abandoned} for a user.
 *
 * <p>Rule conditions are evaluated against {@link #toContext()}, so condition fields are
 * paths such as {@code data.completion_percentage} or {@code metadata.source}.
 */
public final class TriggerEvent {
    private final String eventName;
    private final String userId;
    private final String sessionId;
    private final Map<String, Object> data;
    private final Map<String, Object> metadata;
    private final Instant timestamp;

    private TriggerEvent(Builder builder) {
        this.eventName = Objects.requireNonNull(builder.eventName, "eventName");
        if (eventName.isEmpty()) {
            throw new IllegalArgumentException("eventName cannot be empty");
        }
        this.userId = builder.userId;
        this.sessionId = builder.sessionId;
        this.data = copy(builder.data);
        this.metadata = copy(builder.metadata);
        this.timestamp = builder.timestamp;
    }

    public static Builder builder(String eventName) {
        return new Builder(eventName);
    }

    public String eventName() {
        return eventName;
    }

    public String userId() {
        return userId;
    }

    public String sessionId() {
        return sessionId;
    }

    public Map<String, Object> data() {
        return data;
    }

    public Map<String, Object> metadata() {
        return metadata;
    }

    /**
     * Returns the event time, or {@code null} if the caller did not supply one. A future
     * timestamp (as on journey stage events) pushes the scheduled send out accordingly.
     */
    public Instant timestamp() {
        return timestamp;
    }

    /**
     * Returns the identity notifications are addressed to: the user id, else the session id.
     */
    public String recipientId() {
        return userId != null ? userId : sessionId;
    }

    /**
     * Returns the map rule conditions are evaluated against.
     */
    public Map<String, Object> toContext() {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("eventName", eventName);
        context.put("userId", userId);
        context.put("sessionId", sessionId);
        context.put("data", data);
        context.put("metadata", metadata);
        context.put("timestamp", timestamp == null ? null : timestamp.toString());
        return context;
    }

    @Override
    public String toString() {
        return "TriggerEvent{eventName=" + eventName + ", userId=" + userId + ", sessionId=" + sessionId + '}';
    }

    private static Map<String, Object> copy(Map<String, Object> source) {
        if (source == null || source.isEmpty()) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    public static final class Builder {
        private final String eventName;
        private String userId;
        private String sessionId;
        private Map<String, Object> data;
        private Map<String, Object> metadata;
        private Instant timestamp;

        private Builder(String eventName) {
            this.eventName = eventName;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder data(Map<String, Object> data) {
            this.data = data;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public TriggerEvent build() {
            return new TriggerEvent(this);
        }
    }
}
