package nudge.model;

import nudge.condition.ConditionSet;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable trigger rule: a conditionally gated subscription to an event name that
 * schedules a notification when every gate passes.
 *
 * <p>Rules are owned by configuration management; the engine only reads them.
 *
 * @see nudge.trigger.TriggerEngine
 */
public final class TriggerRule {
    private final String id;
    private final String slug;
    private final String name;
    private final String eventName;
    private final ConditionSet conditions;
    private final Set<String> targetSegments;
    private final Set<String> excludeSegments;
    private final RateLimit rateLimit;
    private final TimeWindow timeWindow;
    private final int delayMinutes;
    private final List<Channel> channelPriority;
    private final Priority priority;
    private final boolean active;

    private TriggerRule(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id");
        this.slug = Objects.requireNonNull(builder.slug, "slug");
        this.eventName = Objects.requireNonNull(builder.eventName, "eventName");
        if (slug.isEmpty()) {
            throw new IllegalArgumentException("slug cannot be empty");
        }
        if (eventName.isEmpty()) {
            throw new IllegalArgumentException("eventName cannot be empty");
        }
        if (builder.delayMinutes < 0) {
            throw new IllegalArgumentException("delayMinutes must be >= 0");
        }
        this.name = builder.name == null ? slug : builder.name;
        this.conditions = builder.conditions == null ? ConditionSet.EMPTY : builder.conditions;
        this.targetSegments = copy(builder.targetSegments);
        this.excludeSegments = copy(builder.excludeSegments);
        this.rateLimit = builder.rateLimit == null ? RateLimit.DEFAULT : builder.rateLimit;
        this.timeWindow = builder.timeWindow;
        this.delayMinutes = builder.delayMinutes;
        this.channelPriority = builder.channelPriority == null ? List.of() : List.copyOf(builder.channelPriority);
        this.priority = builder.priority == null ? Priority.NORMAL : builder.priority;
        this.active = builder.active;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String id() {
        return id;
    }

    public String slug() {
        return slug;
    }

    public String name() {
        return name;
    }

    public String eventName() {
        return eventName;
    }

    public ConditionSet conditions() {
        return conditions;
    }

    public Set<String> targetSegments() {
        return targetSegments;
    }

    public Set<String> excludeSegments() {
        return excludeSegments;
    }

    public RateLimit rateLimit() {
        return rateLimit;
    }

    /**
     * Returns the time-of-day gate, or {@code null} if the rule may fire at any time.
     */
    public TimeWindow timeWindow() {
        return timeWindow;
    }

    public int delayMinutes() {
        return delayMinutes;
    }

    public List<Channel> channelPriority() {
        return channelPriority;
    }

    public Priority priority() {
        return priority;
    }

    public boolean active() {
        return active;
    }

    @Override
    public String toString() {
        return "TriggerRule{id=" + id + ", slug=" + slug + ", eventName=" + eventName + '}';
    }

    private static Set<String> copy(Set<String> source) {
        if (source == null || source.isEmpty()) {
            return Collections.emptySet();
        }
        return Collections.unmodifiableSet(new LinkedHashSet<>(source));
    }

    /**
     * Builder for {@link TriggerRule}. {@code id}, {@code slug} and {@code eventName} are required.
     */
    public static final class Builder {
        private String id;
        private String slug;
        private String name;
        private String eventName;
        private ConditionSet conditions;
        private Set<String> targetSegments;
        private Set<String> excludeSegments;
        private RateLimit rateLimit;
        private TimeWindow timeWindow;
        private int delayMinutes;
        private List<Channel> channelPriority;
        private Priority priority;
        private boolean active = true;

        private Builder() {
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder slug(String slug) {
            this.slug = slug;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder eventName(String eventName) {
            this.eventName = eventName;
            return this;
        }

        public Builder conditions(ConditionSet conditions) {
            this.conditions = conditions;
            return this;
        }

        public Builder targetSegments(Set<String> targetSegments) {
            this.targetSegments = targetSegments;
            return this;
        }

        public Builder excludeSegments(Set<String> excludeSegments) {
            this.excludeSegments = excludeSegments;
            return this;
        }

        /**
         * Optional. Defaults to {@link RateLimit#DEFAULT}.
         */
        public Builder rateLimit(RateLimit rateLimit) {
            this.rateLimit = rateLimit;
            return this;
        }

        public Builder timeWindow(TimeWindow timeWindow) {
            this.timeWindow = timeWindow;
            return this;
        }

        /**
         * Minutes between the matching event and the scheduled send. Must be &ge; 0.
         */
        public Builder delayMinutes(int delayMinutes) {
            this.delayMinutes = delayMinutes;
            return this;
        }

        public Builder channelPriority(List<Channel> channelPriority) {
            this.channelPriority = channelPriority;
            return this;
        }

        /**
         * Optional. Defaults to {@link Priority#NORMAL}.
         */
        public Builder priority(Priority priority) {
            this.priority = priority;
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public TriggerRule build() {
            return new TriggerRule(this);
        }
    }
}
