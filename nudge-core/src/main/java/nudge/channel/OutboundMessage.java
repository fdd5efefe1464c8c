package nudge.channel;

import nudge.model.Channel;
import nudge.model.QueueEntry;

import java.util.Map;

/**
 * Rendered notification handed to a {@link ChannelProvider}.
 */
public record OutboundMessage(
    String entryId,
    String recipientId,
    Channel channel,
    String subject,
    String content,
    String html,
    Map<String, Object> data
) {

  public OutboundMessage {
    data = data == null ? Map.of() : data;
  }

  public static OutboundMessage from(QueueEntry entry) {
    return new OutboundMessage(entry.id(), entry.recipientId(), entry.channel(),
        entry.subject(), entry.content(), entry.html(), entry.data());
  }
}
