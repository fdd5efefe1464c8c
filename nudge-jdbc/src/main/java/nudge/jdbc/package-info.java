/**
 * JDBC implementations of the store SPIs.
 *
 * <p>Stores are plain SQL over five tables sharing a configurable prefix ({@link nudge.jdbc.TableNames});
 * the bundled {@code nudge/jdbc/schema.sql} creates them ({@link nudge.jdbc.JdbcSchema}). JSON columns
 * go through {@link nudge.util.JsonCodec}. SQL errors surface as {@link nudge.jdbc.NudgeStoreException}.
 *
 * @see nudge.jdbc.JdbcStores
 */
package nudge.jdbc;
