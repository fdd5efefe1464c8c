package nudge.channel;

import nudge.model.Channel;

import java.util.Optional;

/**
 * Lookup of the provider that delivers on a given channel.
 *
 * @see DefaultChannelRegistry
 */
public interface ChannelRegistry {

  /**
   * Returns the provider registered for {@code channel}, if any.
   */
  Optional<ChannelProvider> providerFor(Channel channel);

  default boolean hasProvider(Channel channel) {
    return providerFor(channel).isPresent();
  }
}
