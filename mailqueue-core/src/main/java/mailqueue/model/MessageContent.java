package mailqueue.model;

import java.util.Map;
import java.util.Objects;

/**
 * Body of a message: either inline rendered content or a reference to a template that the
 * transport side renders with {@code templateVars}.
 *
 * <p>Rendering is not performed by the queue; the content is handed to the transport as stored.
 */
public record MessageContent(
    String subject,
    String bodyHtml,
    String bodyText,
    String templateId,
    Map<String, String> templateVars
) {
  private static final int MAX_SUBJECT_LENGTH = 500;

  public MessageContent {
    templateVars = templateVars == null ? Map.of() : Map.copyOf(templateVars);
    if (subject != null && subject.length() > MAX_SUBJECT_LENGTH) {
      throw new IllegalArgumentException("subject exceeds " + MAX_SUBJECT_LENGTH + " characters");
    }
    if (templateId == null) {
      boolean hasBody = (bodyHtml != null && !bodyHtml.isBlank())
          || (bodyText != null && !bodyText.isBlank());
      if (subject == null || !hasBody) {
        throw new IllegalArgumentException(
            "Inline content requires a subject and an HTML or text body, or a templateId");
      }
    } else if (templateId.isBlank()) {
      throw new IllegalArgumentException("templateId must not be blank");
    }
  }

  public static MessageContent inline(String subject, String bodyHtml, String bodyText) {
    return new MessageContent(subject, bodyHtml, bodyText, null, Map.of());
  }

  public static MessageContent template(String templateId, Map<String, String> templateVars) {
    Objects.requireNonNull(templateId, "templateId");
    return new MessageContent(null, null, null, templateId, templateVars);
  }

  public boolean isTemplated() {
    return templateId != null;
  }
}
