package nudge.template;

import nudge.model.NotificationTemplate;
import nudge.spi.UserDataProvider;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Literal {@code {{variable}}} substitution over template subject, body and HTML.
 *
 * <p>Built-in variables are {@code userId}, {@code userName} (from the user snapshot's
 * {@code profile.name}, defaulting to {@code "there"}), {@code userEmail},
 * {@code currentDate} and {@code currentTime}. Every scalar top-level entry of the
 * caller's data is also available and overrides a built-in of the same name. There are
 * no conditionals or loops, and placeholders with no value are left as written.
 */
public final class Personalizer {
    private static final Logger logger = Logger.getLogger(Personalizer.class.getName());

    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss");
    private static final String DEFAULT_NAME = "there";

    private final UserDataProvider userDataProvider;
    private final Clock clock;

    public Personalizer(UserDataProvider userDataProvider, Clock clock) {
        this.userDataProvider = Objects.requireNonNull(userDataProvider, "userDataProvider");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Renders a template for one recipient. If building the variables fails the raw
     * template text is returned.
     */
    public RenderedContent personalize(NotificationTemplate template, String recipientId, Map<String, ?> data) {
        Map<String, String> variables;
        try {
            variables = variables(recipientId, data);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Personalization failed for template " + template.slug()
                + ", sending raw content", e);
            return new RenderedContent(template.subject(), template.body(), template.html());
        }
        return new RenderedContent(
            substitute(template.subject(), variables),
            substitute(template.body(), variables),
            substitute(template.html(), variables));
    }

    Map<String, String> variables(String recipientId, Map<String, ?> data) {
        Map<String, String> variables = new HashMap<>();
        Map<String, Object> profile = profileOf(recipientId);
        Object name = profile.get("name");
        Object email = profile.get("email");
        ZonedDateTime now = ZonedDateTime.now(clock);

        variables.put("userId", recipientId == null ? "" : recipientId);
        variables.put("userName", name == null || name.toString().isEmpty() ? DEFAULT_NAME : name.toString());
        variables.put("userEmail", email == null ? "" : email.toString());
        variables.put("currentDate", now.toLocalDate().toString());
        variables.put("currentTime", now.format(TIME));

        if (data != null) {
            for (Map.Entry<String, ?> entry : data.entrySet()) {
                Object value = entry.getValue();
                if (value instanceof CharSequence || value instanceof Number || value instanceof Boolean) {
                    variables.put(entry.getKey(), value.toString());
                }
            }
        }
        return variables;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> profileOf(String recipientId) {
        if (recipientId == null) {
            return Map.of();
        }
        Map<String, Object> snapshot = userDataProvider.snapshot(recipientId);
        Object profile = snapshot == null ? null : snapshot.get("profile");
        return profile instanceof Map ? (Map<String, Object>) profile : Map.of();
    }

    /**
     * Replaces each {@code {{name}}} whose name is a key of {@code variables}.
     */
    static String substitute(String text, Map<String, String> variables) {
        if (text == null || text.indexOf("{{") < 0) {
            return text;
        }
        StringBuilder out = new StringBuilder(text.length());
        int index = 0;
        while (index < text.length()) {
            int open = text.indexOf("{{", index);
            if (open < 0) {
                break;
            }
            int close = text.indexOf("}}", open + 2);
            if (close < 0) {
                break;
            }
            String name = text.substring(open + 2, close);
            String value = variables.get(name);
            out.append(text, index, open);
            if (value == null) {
                out.append(text, open, close + 2);
            } else {
                out.append(value);
            }
            index = close + 2;
        }
        out.append(text, index, text.length());
        return out.toString();
    }
}
