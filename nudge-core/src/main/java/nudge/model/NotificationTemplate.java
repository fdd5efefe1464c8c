package nudge.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Notification content with {@code {{variable}}} placeholders, bound to one channel.
 */
public final class NotificationTemplate {
    private final String id;
    private final String slug;
    private final String name;
    private final Channel channel;
    private final String type;
    private final String subject;
    private final String body;
    private final String html;
    private final Priority priority;
    private final boolean defaultTemplate;
    private final boolean active;

    private NotificationTemplate(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id");
        this.slug = Objects.requireNonNull(builder.slug, "slug");
        this.channel = Objects.requireNonNull(builder.channel, "channel");
        this.name = builder.name == null ? slug : builder.name;
        this.type = builder.type;
        this.subject = builder.subject;
        this.body = builder.body == null ? "" : builder.body;
        this.html = builder.html;
        this.priority = builder.priority == null ? Priority.NORMAL : builder.priority;
        this.defaultTemplate = builder.defaultTemplate;
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

    public Channel channel() {
        return channel;
    }

    public String type() {
        return type;
    }

    public String subject() {
        return subject;
    }

    public String body() {
        return body;
    }

    public String html() {
        return html;
    }

    public Priority priority() {
        return priority;
    }

    public boolean defaultTemplate() {
        return defaultTemplate;
    }

    public boolean active() {
        return active;
    }

    /**
     * Returns {@code true} if the template type marks promotional content, which users
     * can opt out of separately.
     */
    public boolean isMarketing() {
        if (type == null) {
            return false;
        }
        String lower = type.toLowerCase(Locale.ROOT);
        return lower.contains("marketing") || lower.contains("promo");
    }

    @Override
    public String toString() {
        return "NotificationTemplate{slug=" + slug + ", channel=" + channel.code() + ", type=" + type + '}';
    }

    public static final class Builder {
        private String id;
        private String slug;
        private String name;
        private Channel channel;
        private String type;
        private String subject;
        private String body;
        private String html;
        private Priority priority;
        private boolean defaultTemplate;
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

        public Builder channel(Channel channel) {
            this.channel = channel;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder subject(String subject) {
            this.subject = subject;
            return this;
        }

        public Builder body(String body) {
            this.body = body;
            return this;
        }

        public Builder html(String html) {
            this.html = html;
            return this;
        }

        public Builder priority(Priority priority) {
            this.priority = priority;
            return this;
        }

        public Builder defaultTemplate(boolean defaultTemplate) {
            this.defaultTemplate = defaultTemplate;
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public NotificationTemplate build() {
            return new NotificationTemplate(this);
        }
    }
}
