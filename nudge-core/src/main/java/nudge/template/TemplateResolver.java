package nudge.template;

import nudge.model.Channel;
import nudge.model.NotificationTemplate;
import nudge.model.TriggerRule;
import nudge.spi.ConnectionProvider;
import nudge.spi.TemplateStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Caches active templates and picks the template a trigger rule should send.
 *
 * <p>The cache is an immutable snapshot swapped atomically by {@link #reload()}. Slug
 * lookups that miss the snapshot go to the store, so templates added after the last
 * reload are still found.
 *
 * <p>This class is thread-safe.
 */
public final class TemplateResolver {
    private static final Logger logger = Logger.getLogger(TemplateResolver.class.getName());

    private final ConnectionProvider connectionProvider;
    private final TemplateStore templateStore;
    private final AtomicReference<Snapshot> snapshot = new AtomicReference<>();

    public TemplateResolver(ConnectionProvider connectionProvider, TemplateStore templateStore) {
        this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
        this.templateStore = Objects.requireNonNull(templateStore, "templateStore");
    }

    /**
     * Reloads every active template from the store. On failure the previous snapshot is kept.
     *
     * @return {@code true} if the snapshot was replaced
     */
    public boolean reload() {
        try {
            snapshot.set(load());
            return true;
        } catch (SQLException | RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to reload notification templates", e);
            return false;
        }
    }

    /**
     * Returns the active templates in store order, loading them on first use.
     *
     * @throws SQLException if the first load cannot obtain a connection
     */
    public List<NotificationTemplate> activeTemplates() throws SQLException {
        return current().ordered;
    }

    /**
     * Looks up an active template by slug.
     *
     * @param slug template slug
     * @return the template, or empty if no active template has that slug
     * @throws SQLException if the store cannot be reached
     */
    public Optional<NotificationTemplate> findBySlug(String slug) throws SQLException {
        Objects.requireNonNull(slug, "slug");
        NotificationTemplate cached = current().bySlug.get(slug);
        if (cached != null) {
            return Optional.of(cached);
        }
        Optional<NotificationTemplate> found;
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            found = templateStore.findBySlug(conn, slug).filter(NotificationTemplate::active);
        }
        found.ifPresent(template -> snapshot.updateAndGet(s -> s == null ? null : s.with(template)));
        return found;
    }

    /**
     * Chooses the template for a rule: one whose type equals the rule slug, else the
     * template flagged default, else the first whose channel appears in the rule's channel
     * priority (in priority order), else the first active template.
     *
     * @param rule the matched rule
     * @return the chosen template, or empty if there are no active templates
     * @throws SQLException if the first load cannot obtain a connection
     */
    public Optional<NotificationTemplate> forRule(TriggerRule rule) throws SQLException {
        List<NotificationTemplate> templates = current().ordered;
        if (templates.isEmpty()) {
            return Optional.empty();
        }
        for (NotificationTemplate template : templates) {
            if (rule.slug().equals(template.type())) {
                return Optional.of(template);
            }
        }
        for (NotificationTemplate template : templates) {
            if (template.defaultTemplate()) {
                return Optional.of(template);
            }
        }
        for (Channel channel : rule.channelPriority()) {
            for (NotificationTemplate template : templates) {
                if (template.channel() == channel) {
                    return Optional.of(template);
                }
            }
        }
        return Optional.of(templates.get(0));
    }

    private Snapshot current() throws SQLException {
        Snapshot s = snapshot.get();
        if (s != null) {
            return s;
        }
        Snapshot loaded = load();
        return snapshot.compareAndSet(null, loaded) ? loaded : snapshot.get();
    }

    private Snapshot load() throws SQLException {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            return Snapshot.of(templateStore.listActive(conn));
        }
    }

    private static final class Snapshot {
        private final List<NotificationTemplate> ordered;
        private final Map<String, NotificationTemplate> bySlug;

        private Snapshot(List<NotificationTemplate> ordered, Map<String, NotificationTemplate> bySlug) {
            this.ordered = ordered;
            this.bySlug = bySlug;
        }

        static Snapshot of(List<NotificationTemplate> templates) {
            Map<String, NotificationTemplate> bySlug = new LinkedHashMap<>();
            for (NotificationTemplate template : templates) {
                if (template.active()) {
                    bySlug.putIfAbsent(template.slug(), template);
                }
            }
            return new Snapshot(List.copyOf(bySlug.values()), Collections.unmodifiableMap(bySlug));
        }

        Snapshot with(NotificationTemplate template) {
            if (bySlug.containsKey(template.slug())) {
                return this;
            }
            Map<String, NotificationTemplate> copy = new LinkedHashMap<>(bySlug);
            copy.put(template.slug(), template);
            return new Snapshot(List.copyOf(copy.values()), Collections.unmodifiableMap(copy));
        }
    }
}
