package nudge.spi;

import java.util.Map;

/**
 * Supplies a nested snapshot of what is known about a user, for example
 * {@code {profile: {name, email, completeness}, quiz: {...}, engagement: {...}}}.
 *
 * <p>The snapshot feeds journey stage conditions and personalization variables.
 */
@FunctionalInterface
public interface UserDataProvider {

    UserDataProvider EMPTY = userId -> Map.of();

    /**
     * @param userId the user
     * @return snapshot map; never {@code null}
     */
    Map<String, Object> snapshot(String userId);
}
