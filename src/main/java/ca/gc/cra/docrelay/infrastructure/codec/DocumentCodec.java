package ca.gc.cra.docrelay.infrastructure.codec;

import ca.gc.cra.docrelay.application.port.Codec;
import ca.gc.cra.docrelay.application.port.DecodeException;
import ca.gc.cra.docrelay.domain.doc.Document;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Encodes a {@link Document} as the two-element array {@code [name, payload]}.
 *
 * <p>Decoding rejects anything else: a non-array, an array of another length, a non-string name or a
 * non-map payload all raise {@link DecodeException}.</p>
 *
 * @since 0.1.0
 */
public final class DocumentCodec implements Codec<Document> {
  private static final DocumentCodec JSON = new DocumentCodec(JacksonCodec.json());
  private static final DocumentCodec MSGPACK = new DocumentCodec(JacksonCodec.msgpack());

  private final JacksonCodec values;

  public DocumentCodec(JacksonCodec values) {
    this.values = Objects.requireNonNull(values, "values");
  }

  public static DocumentCodec json() {
    return JSON;
  }

  /**
   * MessagePack document codec; the default wire format for document topics.
   *
   * @return shared MessagePack document codec
   */
  public static DocumentCodec msgpack() {
    return MSGPACK;
  }

  public static DocumentCodec forFormat(String format) {
    return new DocumentCodec(JacksonCodec.forFormat(format));
  }

  @Override
  public byte[] encode(Document document) {
    Objects.requireNonNull(document, "document");
    return values.encode(List.of(document.name(), document.payload()));
  }

  @Override
  public Document decode(byte[] payload) {
    Object decoded = values.decode(payload);
    if (!(decoded instanceof List<?> pair) || pair.size() != 2) {
      throw new DecodeException("Expected a [name, document] pair");
    }
    if (!(pair.get(0) instanceof String name) || name.isBlank()) {
      throw new DecodeException("Document name must be a non-blank string");
    }
    if (!(pair.get(1) instanceof Map<?, ?> raw)) {
      throw new DecodeException("Document body for '" + name + "' must be a map");
    }
    Map<String, Object> body = new LinkedHashMap<>();
    raw.forEach((key, value) -> body.put(String.valueOf(key), value));
    return new Document(name, body);
  }

  @Override
  public String toString() {
    return "DocumentCodec(" + values.format() + ")";
  }
}
