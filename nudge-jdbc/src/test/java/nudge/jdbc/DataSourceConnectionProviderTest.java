package nudge.jdbc;

import nudge.model.Channel;
import nudge.model.UserPreferences;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.*;

class DataSourceConnectionProviderTest {

  private JdbcDataSource dataSource;
  private DataSourceConnectionProvider provider;
  private final JdbcPreferenceStore preferences = new JdbcPreferenceStore();

  @BeforeEach
  void setUp() throws SQLException {
    dataSource = H2Database.create(TableNames.defaults());
    provider = new DataSourceConnectionProvider(dataSource);
  }

  @AfterEach
  void tearDown() throws SQLException {
    H2Database.drop(dataSource);
  }

  @Test
  void requiresDataSource() {
    assertThrows(NullPointerException.class, () -> new DataSourceConnectionProvider(null));
  }

  @Test
  void eachCallOpensItsOwnConnection() throws SQLException {
    try (Connection first = provider.getConnection();
         Connection second = provider.getConnection()) {
      assertNotSame(first, second);
      assertFalse(first.isClosed());
      assertFalse(second.isClosed());
    }
  }

  @Test
  void autoCommitWriteIsVisibleToOtherConnections() throws SQLException {
    UserPreferences prefs = UserPreferences.defaults("u1").withChannel(Channel.PUSH, false);
    try (Connection writer = provider.getConnection()) {
      writer.setAutoCommit(true);
      preferences.save(writer, prefs);
    }
    try (Connection reader = provider.getConnection()) {
      assertEquals(prefs, preferences.find(reader, "u1").orElseThrow());
    }
  }

  @Test
  void transactionModeIsLeftToTheCaller() throws SQLException {
    try (Connection writer = provider.getConnection()) {
      writer.setAutoCommit(false);
      preferences.save(writer, UserPreferences.defaults("u2"));
      try (Connection reader = provider.getConnection()) {
        assertTrue(preferences.find(reader, "u2").isEmpty());
      }
      writer.rollback();
    }
    try (Connection reader = provider.getConnection()) {
      assertTrue(preferences.find(reader, "u2").isEmpty());
    }
  }
}
