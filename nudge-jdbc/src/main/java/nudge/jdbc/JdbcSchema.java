package nudge.jdbc;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Creates the engine's tables from the bundled {@code nudge/jdbc/schema.sql}.
 *
 * <p>The script uses {@code CREATE ... IF NOT EXISTS} throughout, so running it against an
 * initialized database is a no-op. It targets H2, PostgreSQL and MySQL; production
 * deployments usually apply it through their own migration tool instead.
 */
public final class JdbcSchema {
  private static final Logger logger = Logger.getLogger(JdbcSchema.class.getName());
  private static final String RESOURCE = "nudge/jdbc/schema.sql";

  private JdbcSchema() {}

  public static void create(Connection conn, TableNames tables) {
    List<String> statements = statements(tables);
    try (Statement st = conn.createStatement()) {
      for (String sql : statements) {
        st.execute(sql);
      }
    } catch (SQLException e) {
      throw new NudgeStoreException("Failed to create schema", e);
    }
    logger.log(Level.INFO, "Schema ready ({0} statements, prefix {1})",
        new Object[]{statements.size(), tables.prefix()});
  }

  /**
   * Returns the DDL statements with table and index names rewritten to the given prefix.
   */
  public static List<String> statements(TableNames tables) {
    StringBuilder script = new StringBuilder();
    for (String line : load().split("\n")) {
      if (!line.trim().startsWith("--")) {
        script.append(line).append('\n');
      }
    }
    List<String> statements = new ArrayList<>();
    for (String sql : script.toString().split(";")) {
      String trimmed = sql.trim();
      if (!trimmed.isEmpty()) {
        statements.add(trimmed.replaceAll("\\bnudge_", tables.prefix()));
      }
    }
    return statements;
  }

  private static String load() {
    try (InputStream in = JdbcSchema.class.getClassLoader().getResourceAsStream(RESOURCE)) {
      if (in == null) {
        throw new IllegalStateException("Missing classpath resource " + RESOURCE);
      }
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
