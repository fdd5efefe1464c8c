package nudge.channel;

import nudge.model.Channel;

/**
 * Adapter that performs the actual send for one delivery channel (an email vendor,
 * a push gateway, an SMS carrier).
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>Implementations must be thread-safe; one instance serves every concurrent delivery slot.</li>
 *   <li>Failures should be reported as a {@link DeliveryResult#failure failed result}. Exceptions
 *       that do escape are caught by the pipeline and recorded the same way.</li>
 *   <li>No timeout is applied by the caller; a hung call holds its delivery slot until it returns.</li>
 * </ul>
 *
 * @see ChannelRegistry
 */
public interface ChannelProvider {

  /**
   * The channel this provider delivers on.
   */
  Channel channel();

  /**
   * Provider name recorded on queue entries and in logs, e.g. {@code "sendgrid"}.
   */
  String name();

  /**
   * Sends one message.
   *
   * @param message the rendered notification
   * @return the normalized outcome; never {@code null}
   */
  DeliveryResult send(OutboundMessage message);
}
