package nudge.channel;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Invokes a {@link ChannelProvider} and normalizes whatever comes back: a thrown
 * exception or a {@code null} result becomes a failed {@link DeliveryResult}, and a
 * missing delivery time is filled with the measured call duration.
 */
public final class ProviderCalls {
  private static final Logger logger = Logger.getLogger(ProviderCalls.class.getName());

  private ProviderCalls() {
  }

  public static DeliveryResult send(ChannelProvider provider, OutboundMessage message) {
    long start = System.nanoTime();
    DeliveryResult result;
    try {
      result = provider.send(message);
      if (result == null) {
        result = DeliveryResult.failure("Provider returned no result");
      }
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Provider " + provider.name() + " threw for entry " + message.entryId(), e);
      String reason = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
      result = DeliveryResult.failure(reason);
    }
    long elapsedMs = (System.nanoTime() - start) / 1_000_000L;
    return result.withMeasuredTime(elapsedMs).withProvider(provider.name());
  }
}
