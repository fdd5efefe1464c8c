package nudge.model;

import java.util.Objects;

/**
 * Per-user channel and content preferences.
 */
public record UserPreferences(
    String userId,
    boolean emailEnabled,
    boolean smsEnabled,
    boolean pushEnabled,
    boolean inAppEnabled,
    boolean whatsappEnabled,
    boolean marketingEnabled,
    boolean transactionalEnabled,
    boolean globalOptOut
) {

    public UserPreferences {
        Objects.requireNonNull(userId, "userId");
    }

    /**
     * Preferences assumed for users with no stored row: email, push and in-app on,
     * SMS and WhatsApp off, marketing and transactional on.
     */
    public static UserPreferences defaults(String userId) {
        return new UserPreferences(userId, true, false, true, true, false, true, true, false);
    }

    public boolean channelEnabled(Channel channel) {
        switch (channel) {
            case EMAIL:
                return emailEnabled;
            case SMS:
                return smsEnabled;
            case PUSH:
                return pushEnabled;
            case IN_APP:
                return inAppEnabled;
            case WHATSAPP:
                return whatsappEnabled;
            default:
                return false;
        }
    }

    public UserPreferences withGlobalOptOut(boolean optOut) {
        return new UserPreferences(userId, emailEnabled, smsEnabled, pushEnabled, inAppEnabled,
            whatsappEnabled, marketingEnabled, transactionalEnabled, optOut);
    }

    public UserPreferences withMarketingEnabled(boolean enabled) {
        return new UserPreferences(userId, emailEnabled, smsEnabled, pushEnabled, inAppEnabled,
            whatsappEnabled, enabled, transactionalEnabled, globalOptOut);
    }

    public UserPreferences withChannel(Channel channel, boolean enabled) {
        return new UserPreferences(userId,
            channel == Channel.EMAIL ? enabled : emailEnabled,
            channel == Channel.SMS ? enabled : smsEnabled,
            channel == Channel.PUSH ? enabled : pushEnabled,
            channel == Channel.IN_APP ? enabled : inAppEnabled,
            channel == Channel.WHATSAPP ? enabled : whatsappEnabled,
            marketingEnabled, transactionalEnabled, globalOptOut);
    }
}
