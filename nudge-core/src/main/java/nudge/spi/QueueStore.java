package nudge.spi;

import nudge.model.QueueEntry;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for queue entries, managing status transitions
 * {@code QUEUED -> SENDING -> SENT | FAILED}.
 *
 * <p>Every transition is conditional on the current status, so a transition applied to an
 * entry that has already moved on updates nothing and returns {@code 0}. This is what keeps
 * the status monotonic when batches and the immediate path race for the same entry.
 *
 * @see nudge.jdbc.JdbcQueueStore
 */
public interface QueueStore {

    /**
     * Inserts a new entry with its current status (normally {@code QUEUED}).
     */
    void insert(Connection conn, QueueEntry entry);

    Optional<QueueEntry> find(Connection conn, String entryId);

    /**
     * Moves a {@code QUEUED} entry to {@code SENDING}.
     *
     * @param conn    the JDBC connection
     * @param entryId the entry to claim
     * @param sentAt  send timestamp to stamp on the entry
     * @return the number of rows updated (0 or 1)
     */
    int markSending(Connection conn, String entryId, Instant sentAt);

    /**
     * Moves a {@code SENDING} entry to {@code SENT}.
     *
     * @return the number of rows updated (0 or 1)
     */
    int markSent(Connection conn, String entryId, Instant deliveredAt, long deliveryTimeMs,
                 String provider, String providerMessageId);

    /**
     * Moves a {@code SENDING} entry to {@code FAILED} and increments its retry count.
     *
     * @param error error message from the provider (may be {@code null})
     * @return the number of rows updated (0 or 1)
     */
    int markFailed(Connection conn, String entryId, Instant failedAt, String error);

    /**
     * Returns up to {@code limit} {@code QUEUED} entries with {@code scheduledFor <= now},
     * ordered by priority rank (urgent first) then by scheduled time.
     */
    List<QueueEntry> selectDue(Connection conn, Instant now, int limit);

    /**
     * Counts entries created for {@code (triggerId, recipientId)} at or after {@code since},
     * regardless of status.
     */
    int countRecentSends(Connection conn, String triggerId, String recipientId, Instant since);
}
