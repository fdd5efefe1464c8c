package nudge.jdbc;

import java.sql.SQLException;

/**
 * Unchecked exception wrapping JDBC errors thrown by the JDBC store implementations.
 */
public final class NudgeStoreException extends RuntimeException {
  public NudgeStoreException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * Returns {@code true} if the underlying SQL state is an integrity constraint violation
   * (class {@code 23}), such as a duplicate primary key.
   */
  public boolean isConstraintViolation() {
    return getCause() instanceof SQLException sql
        && sql.getSQLState() != null
        && sql.getSQLState().startsWith("23");
  }
}
