package nudge.channel;

import java.math.BigDecimal;

/**
 * Channel-agnostic outcome of one send attempt.
 *
 * @param success        whether the provider accepted the message
 * @param messageId      provider-assigned message id, if any
 * @param provider       provider name, if known
 * @param deliveryTimeMs provider-reported delivery time; measured by the pipeline when {@code null}
 * @param errorMessage   failure description, set when {@code success} is false
 * @param cost           provider-reported cost, if any
 */
public record DeliveryResult(
    boolean success,
    String messageId,
    String provider,
    Long deliveryTimeMs,
    String errorMessage,
    BigDecimal cost
) {

  public static DeliveryResult success(String provider, String messageId) {
    return new DeliveryResult(true, messageId, provider, null, null, null);
  }

  public static DeliveryResult success(String provider, String messageId, long deliveryTimeMs, BigDecimal cost) {
    return new DeliveryResult(true, messageId, provider, deliveryTimeMs, null, cost);
  }

  public static DeliveryResult failure(String provider, String errorMessage) {
    return new DeliveryResult(false, null, provider, null, errorMessage, null);
  }

  public static DeliveryResult failure(String errorMessage) {
    return failure(null, errorMessage);
  }

  DeliveryResult withMeasuredTime(long elapsedMs) {
    if (deliveryTimeMs != null) {
      return this;
    }
    return new DeliveryResult(success, messageId, provider, elapsedMs, errorMessage, cost);
  }

  DeliveryResult withProvider(String name) {
    if (provider != null) {
      return this;
    }
    return new DeliveryResult(success, messageId, name, deliveryTimeMs, errorMessage, cost);
  }
}
