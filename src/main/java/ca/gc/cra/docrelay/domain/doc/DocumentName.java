package ca.gc.cra.docrelay.domain.doc;

import java.util.Locale;
import java.util.Optional;

/**
 * Well-known document names emitted by acquisition run engines.
 *
 * <p>The consumer core never interprets names; this enum exists for publishers and stopping
 * predicates that need to recognise {@link #STOP}.</p>
 *
 * @since 0.1.0
 */
public enum DocumentName {
  START("start"),
  DESCRIPTOR("descriptor"),
  EVENT("event"),
  EVENT_PAGE("event_page"),
  DATUM("datum"),
  DATUM_PAGE("datum_page"),
  RESOURCE("resource"),
  STOP("stop");

  private final String wireName;

  DocumentName(String wireName) {
    this.wireName = wireName;
  }

  /**
   * Returns the lowercase name used on the wire.
   *
   * @return wire name
   */
  public String wireName() {
    return wireName;
  }

  /**
   * Resolves a wire name, ignoring case and surrounding whitespace.
   *
   * @param raw candidate wire name; may be {@code null}
   * @return matching constant, or empty when the name is not well known
   */
  public static Optional<DocumentName> fromWire(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    for (DocumentName candidate : values()) {
      if (candidate.wireName.equals(normalized)) {
        return Optional.of(candidate);
      }
    }
    return Optional.empty();
  }
}
