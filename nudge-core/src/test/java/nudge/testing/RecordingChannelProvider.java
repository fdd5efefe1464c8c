package nudge.testing;

import nudge.channel.ChannelProvider;
import nudge.channel.DeliveryResult;
import nudge.channel.OutboundMessage;
import nudge.model.Channel;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Channel provider that records every message and answers with a configurable result.
 */
public class RecordingChannelProvider implements ChannelProvider {
  private final Channel channel;
  private final String name;
  public final List<OutboundMessage> sent = new CopyOnWriteArrayList<>();
  public volatile Function<OutboundMessage, DeliveryResult> responder;

  public RecordingChannelProvider(Channel channel) {
    this(channel, "stub-" + channel.code());
  }

  public RecordingChannelProvider(Channel channel, String name) {
    this.channel = channel;
    this.name = name;
    this.responder = m -> DeliveryResult.success(name, "msg-" + m.entryId());
  }

  public RecordingChannelProvider failingWith(String error) {
    this.responder = m -> DeliveryResult.failure(name, error);
    return this;
  }

  @Override
  public Channel channel() {
    return channel;
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public DeliveryResult send(OutboundMessage message) {
    sent.add(message);
    return responder.apply(message);
  }
}
