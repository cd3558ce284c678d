package ca.gc.cra.docrelay.domain.doc;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> A named, map-shaped document flowing between publishers and consumers.
 * <p><strong>Why:</strong> Run documents travel as {@code (name, payload)} pairs so a consumer can route
 * them without inspecting the payload.</p>
 * <p><strong>Role:</strong> Domain value object produced by document codecs and handed to
 * {@link ca.gc.cra.docrelay.application.consume.DocumentHandler}s.</p>
 * <p><strong>Thread-safety:</strong> Immutable; the payload is copied into an unmodifiable map.</p>
 * <p><strong>Performance:</strong> Construction copies the top-level payload map only; nested values are shared.</p>
 * <p><strong>Observability:</strong> {@link #name()} is safe to log; payloads should be truncated via
 * {@link ca.gc.cra.docrelay.logging.Logs#truncate(String, int)}.</p>
 *
 * @param name document name such as {@code start} or {@code event}; must not be blank
 * @param payload document body keyed by field name; {@code null} values are allowed, {@code null} map is not
 * @since 0.1.0
 */
public record Document(String name, Map<String, Object> payload) {

  /**
   * Validates the name and freezes the payload.
   *
   * @throws NullPointerException if {@code name} or {@code payload} is {@code null}
   * @throws IllegalArgumentException if {@code name} is blank
   */
  public Document {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(payload, "payload");
    if (name.isBlank()) {
      throw new IllegalArgumentException("name must not be blank");
    }
    payload = Collections.unmodifiableMap(new LinkedHashMap<>(payload));
  }

  /**
   * Creates a document from a well-known {@link DocumentName}.
   *
   * @param name well-known document name
   * @param payload document body
   * @return new document
   */
  public static Document of(DocumentName name, Map<String, Object> payload) {
    return new Document(Objects.requireNonNull(name, "name").wireName(), payload);
  }

  /**
   * Indicates whether this document carries the given well-known name.
   *
   * @param candidate name to compare against
   * @return {@code true} when the wire names match
   */
  public boolean is(DocumentName candidate) {
    return candidate != null && candidate.wireName().equals(name);
  }
}
