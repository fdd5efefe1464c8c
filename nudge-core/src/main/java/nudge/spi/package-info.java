/**
 * Service Provider Interfaces (SPI) consumed by the engines.
 *
 * <p>Store interfaces receive an explicit {@link java.sql.Connection} obtained from a
 * {@link nudge.spi.ConnectionProvider}; JDBC implementations live in {@code nudge-jdbc}.
 * Segment and user-data lookups are plain callbacks into the host application.
 *
 * @see nudge.spi.ConnectionProvider
 * @see nudge.spi.QueueStore
 * @see nudge.spi.MetricsExporter
 */
package nudge.spi;
