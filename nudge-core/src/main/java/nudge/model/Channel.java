package nudge.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Delivery channel a notification is routed through. The string {@link #code()} is the
 * value persisted in stores and used in rule/template configuration.
 */
public enum Channel {
    EMAIL("email"),
    SMS("sms"),
    PUSH("push"),
    IN_APP("in_app"),
    WHATSAPP("whatsapp");

    private final String code;

    Channel(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * Resolves a channel from its persisted code, ignoring case and surrounding whitespace.
     *
     * @param code channel code such as {@code "in_app"}
     * @return the matching channel
     * @throws IllegalArgumentException if no channel has that code
     */
    public static Channel fromCode(String code) {
        Objects.requireNonNull(code, "code");
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (Channel channel : values()) {
            if (channel.code.equals(normalized)) {
                return channel;
            }
        }
        throw new IllegalArgumentException("Unknown channel: " + code);
    }
}
