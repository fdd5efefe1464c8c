package nudge.jdbc;

import java.util.Objects;

/**
 * Table names for one deployment, derived from a shared prefix ({@code nudge_} by default).
 */
public final class TableNames {
  public static final String DEFAULT_PREFIX = "nudge_";
  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private final String prefix;

  private TableNames(String prefix) {
    this.prefix = prefix;
  }

  public static TableNames defaults() {
    return new TableNames(DEFAULT_PREFIX);
  }

  /**
   * @param prefix prepended to every table name; may be empty
   * @throws IllegalArgumentException if the resulting names are not plain SQL identifiers
   */
  public static TableNames withPrefix(String prefix) {
    Objects.requireNonNull(prefix, "prefix");
    validate(prefix + "queue");
    return new TableNames(prefix);
  }

  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }

  public String prefix() {
    return prefix;
  }

  public String rules() {
    return prefix + "trigger_rules";
  }

  public String templates() {
    return prefix + "templates";
  }

  public String preferences() {
    return prefix + "user_preferences";
  }

  public String queue() {
    return prefix + "queue";
  }

  public String analytics() {
    return prefix + "analytics";
  }
}
