/**
 * Spring Boot auto-configuration for the notification engine.
 *
 * <p>Set {@code nudge.*} properties to tune delivery, trigger and journey settings; declare
 * {@link nudge.channel.ChannelProvider} beans to plug in delivery channels.
 *
 * @see nudge.spring.boot.NudgeAutoConfiguration
 * @see nudge.spring.boot.NudgeProperties
 */
package nudge.spring.boot;
