package nudge.template;

/**
 * Template content after placeholder substitution.
 */
public record RenderedContent(String subject, String content, String html) {
}
