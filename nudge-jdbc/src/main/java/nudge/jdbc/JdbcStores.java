package nudge.jdbc;

import nudge.Nudge;
import nudge.util.JsonCodec;

import java.util.Objects;

/**
 * The five JDBC stores for one table prefix, created together.
 *
 * <pre>{@code
 * JdbcStores stores = JdbcStores.create(TableNames.withPrefix("app_nudge_"));
 * Nudge nudge = stores.configure(Nudge.builder())
 *     .connectionProvider(new DataSourceConnectionProvider(dataSource))
 *     .channelRegistry(registry)
 *     .build();
 * }</pre>
 */
public final class JdbcStores {
  private final TableNames tables;
  private final JdbcRuleStore rules;
  private final JdbcTemplateStore templates;
  private final JdbcPreferenceStore preferences;
  private final JdbcQueueStore queue;
  private final JdbcAnalyticsStore analytics;

  private JdbcStores(TableNames tables, JsonCodec json) {
    this.tables = tables;
    this.rules = new JdbcRuleStore(tables, json);
    this.templates = new JdbcTemplateStore(tables);
    this.preferences = new JdbcPreferenceStore(tables);
    this.queue = new JdbcQueueStore(tables, json);
    this.analytics = new JdbcAnalyticsStore(tables);
  }

  public static JdbcStores create(TableNames tables) {
    return create(tables, JsonCodec.getDefault());
  }

  public static JdbcStores create(TableNames tables, JsonCodec json) {
    return new JdbcStores(Objects.requireNonNull(tables, "tables"), Objects.requireNonNull(json, "json"));
  }

  /**
   * Sets every store on the builder.
   */
  public Nudge.Builder configure(Nudge.Builder builder) {
    return builder
        .ruleStore(rules)
        .templateStore(templates)
        .preferenceStore(preferences)
        .queueStore(queue)
        .analyticsStore(analytics);
  }

  public TableNames tables() {
    return tables;
  }

  public JdbcRuleStore rules() {
    return rules;
  }

  public JdbcTemplateStore templates() {
    return templates;
  }

  public JdbcPreferenceStore preferences() {
    return preferences;
  }

  public JdbcQueueStore queue() {
    return queue;
  }

  public JdbcAnalyticsStore analytics() {
    return analytics;
  }
}
