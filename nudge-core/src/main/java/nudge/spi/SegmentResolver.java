package nudge.spi;

import java.util.Set;

/**
 * Resolves the segments (named cohorts) a user or anonymous session belongs to.
 */
@FunctionalInterface
public interface SegmentResolver {

    /** Resolver that places every identity in no segment. */
    SegmentResolver NONE = id -> Set.of();

    /**
     * @param userOrSessionId a user id, or a session id for anonymous visitors
     * @return segment names; never {@code null}
     */
    Set<String> segmentsOf(String userOrSessionId);
}
