package nudge.channel;

import nudge.model.Channel;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe registry holding at most one provider per channel. Registering a second
 * provider for a channel replaces the first.
 *
 * <pre>{@code
 * ChannelRegistry registry = new DefaultChannelRegistry()
 *     .register(emailProvider)
 *     .register(pushProvider);
 * }</pre>
 */
public final class DefaultChannelRegistry implements ChannelRegistry {
  private final Map<Channel, ChannelProvider> providers = new ConcurrentHashMap<>();

  /**
   * Registers a provider under its own {@link ChannelProvider#channel()}.
   *
   * @param provider the provider
   * @return this registry for chaining
   */
  public DefaultChannelRegistry register(ChannelProvider provider) {
    Objects.requireNonNull(provider, "provider");
    providers.put(Objects.requireNonNull(provider.channel(), "provider.channel()"), provider);
    return this;
  }

  @Override
  public Optional<ChannelProvider> providerFor(Channel channel) {
    if (channel == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(providers.get(channel));
  }

  @Override
  public boolean hasProvider(Channel channel) {
    return channel != null && providers.containsKey(channel);
  }
}
