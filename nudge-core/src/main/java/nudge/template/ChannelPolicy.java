package nudge.template;

import nudge.channel.ChannelRegistry;
import nudge.model.Channel;
import nudge.model.NotificationTemplate;
import nudge.model.UserPreferences;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Channel gating and selection from user preferences.
 */
public final class ChannelPolicy {

    /** Selection order used when the caller supplies none. */
    public static final List<Channel> DEFAULT_ORDER =
        List.of(Channel.EMAIL, Channel.PUSH, Channel.IN_APP, Channel.SMS, Channel.WHATSAPP);

    private ChannelPolicy() {
    }

    /**
     * Channels the template may be sent on for this user. A template is bound to one
     * channel, so the result is either that channel or nothing: nothing when the user
     * opted out globally, when the template is marketing and the user disabled marketing,
     * or when the user disabled the channel.
     */
    public static Set<Channel> allowedChannels(NotificationTemplate template, UserPreferences preferences) {
        if (preferences.globalOptOut()) {
            return EnumSet.noneOf(Channel.class);
        }
        if (template.isMarketing() && !preferences.marketingEnabled()) {
            return EnumSet.noneOf(Channel.class);
        }
        if (!preferences.channelEnabled(template.channel())) {
            return EnumSet.noneOf(Channel.class);
        }
        return EnumSet.of(template.channel());
    }

    /**
     * Picks the delivery channel. An explicitly requested channel wins if it is allowed.
     * Otherwise the first channel in {@code priority} that is both allowed and has a
     * provider, falling back to the first allowed channel in priority order.
     *
     * @param allowed   channels permitted by {@link #allowedChannels}
     * @param priority  preferred order; {@link #DEFAULT_ORDER} when empty
     * @param registry  provider lookup
     * @param requested explicitly requested channel, or {@code null}
     * @return the channel, or empty if nothing is allowed (or the requested channel is not)
     */
    public static Optional<Channel> select(Set<Channel> allowed, List<Channel> priority,
                                           ChannelRegistry registry, Channel requested) {
        if (allowed.isEmpty()) {
            return Optional.empty();
        }
        if (requested != null) {
            return allowed.contains(requested) ? Optional.of(requested) : Optional.empty();
        }
        List<Channel> order = priority == null || priority.isEmpty() ? DEFAULT_ORDER : priority;
        for (Channel channel : order) {
            if (allowed.contains(channel) && registry.hasProvider(channel)) {
                return Optional.of(channel);
            }
        }
        for (Channel channel : order) {
            if (allowed.contains(channel)) {
                return Optional.of(channel);
            }
        }
        return allowed.stream().findFirst();
    }
}
