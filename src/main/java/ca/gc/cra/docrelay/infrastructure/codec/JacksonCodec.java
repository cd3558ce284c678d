package ca.gc.cra.docrelay.infrastructure.codec;

import ca.gc.cra.docrelay.application.port.Codec;
import ca.gc.cra.docrelay.application.port.DecodeException;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.io.JsonEOFException;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.msgpack.jackson.dataformat.MessagePackFactory;

/**
 * <strong>What:</strong> {@link Codec} for structured values (maps, lists, strings, numbers, booleans,
 * {@code null}, byte arrays) over a Jackson streaming {@link JsonFactory}.
 * <p><strong>Why:</strong> Documents are schemaless maps; the streaming API encodes them without a data-binding
 * layer, and the same walker serves JSON and MessagePack because {@link MessagePackFactory} is a
 * {@link JsonFactory}.</p>
 * <p><strong>Thread-safety:</strong> Immutable; Jackson factories are thread-safe once configured.</p>
 *
 * @implNote Decoded maps are {@link LinkedHashMap}s and lists are {@link ArrayList}s. Integers decode as
 * {@link Long}, or {@link BigInteger} beyond 64 bits; floating point decodes as {@link Double}. Narrower
 * numeric types are widened on encode, so a document round-trips exactly when its integers are {@code Long}
 * ({@code BigInteger} only outside the {@code long} range) and its floating point values are {@code Double}. Byte arrays survive MessagePack but are written as Base64 strings in
 * JSON.
 * @since 0.1.0
 */
public final class JacksonCodec implements Codec<Object> {
  private static final JacksonCodec JSON = new JacksonCodec("json", new JsonFactory());
  private static final JacksonCodec MSGPACK = new JacksonCodec("msgpack", new MessagePackFactory());

  private final String format;
  private final JsonFactory factory;

  private JacksonCodec(String format, JsonFactory factory) {
    this.format = format;
    this.factory = factory;
  }

  /**
   * UTF-8 JSON text.
   *
   * @return shared JSON codec
   */
  public static JacksonCodec json() {
    return JSON;
  }

  /**
   * MessagePack binary encoding.
   *
   * @return shared MessagePack codec
   */
  public static JacksonCodec msgpack() {
    return MSGPACK;
  }

  /**
   * Looks up a codec by format name.
   *
   * @param format {@code json} or {@code msgpack}
   * @return matching codec
   * @throws IllegalArgumentException for unknown formats
   */
  public static JacksonCodec forFormat(String format) {
    Objects.requireNonNull(format, "format");
    return switch (format.trim().toLowerCase(Locale.ROOT)) {
      case "json" -> JSON;
      case "msgpack", "messagepack" -> MSGPACK;
      default -> throw new IllegalArgumentException("format must be json or msgpack (was " + format + ")");
    };
  }

  public String format() {
    return format;
  }

  /**
   * Encodes a structured value.
   *
   * @param value value to encode
   * @return encoded bytes
   * @throws IllegalArgumentException if the value graph contains an unsupported type
   */
  @Override
  public byte[] encode(Object value) {
    ByteArrayOutputStream out = new ByteArrayOutputStream(256);
    try (JsonGenerator generator = factory.createGenerator(out)) {
      writeValue(generator, value);
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to encode " + format + " payload", ex);
    }
    return out.toByteArray();
  }

  /**
   * Decodes exactly one structured value.
   *
   * @param payload encoded bytes
   * @return decoded value graph
   * @throws DecodeException if the payload is empty, malformed or has trailing content
   */
  @Override
  public Object decode(byte[] payload) {
    if (payload == null || payload.length == 0) {
      throw new DecodeException("Empty " + format + " payload");
    }
    try (JsonParser parser = factory.createParser(payload)) {
      JsonToken token = parser.nextToken();
      if (token == null) {
        throw new DecodeException("Empty " + format + " payload");
      }
      Object value = readValue(parser, token);
      if (hasTrailingContent(parser)) {
        throw new DecodeException(format + " payload contains trailing content");
      }
      return value;
    } catch (DecodeException ex) {
      throw ex;
    } catch (IOException | RuntimeException ex) {
      throw new DecodeException("Invalid " + format + " payload: " + ex.getMessage(), ex);
    }
  }

  @Override
  public String toString() {
    return "JacksonCodec(" + format + ")";
  }

  // MessagePackParser throws at end of input where the JSON parser returns null.
  private static boolean hasTrailingContent(JsonParser parser) throws IOException {
    JsonToken trailing;
    try {
      trailing = parser.nextToken();
    } catch (JsonEOFException endOfInput) {
      return false;
    }
    return trailing != null && trailing != JsonToken.NOT_AVAILABLE;
  }

  private static void writeValue(JsonGenerator generator, Object value) throws IOException {
    if (value == null) {
      generator.writeNull();
    } else if (value instanceof String text) {
      generator.writeString(text);
    } else if (value instanceof Boolean flag) {
      generator.writeBoolean(flag);
    } else if (value instanceof Long || value instanceof Integer || value instanceof Short
        || value instanceof Byte) {
      generator.writeNumber(((Number) value).longValue());
    } else if (value instanceof BigInteger number) {
      generator.writeNumber(number);
    } else if (value instanceof Double || value instanceof Float) {
      generator.writeNumber(((Number) value).doubleValue());
    } else if (value instanceof byte[] bytes) {
      generator.writeBinary(bytes);
    } else if (value instanceof Map<?, ?> map) {
      generator.writeStartObject();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        if (!(entry.getKey() instanceof String key)) {
          throw new IllegalArgumentException("Map keys must be strings (was " + entry.getKey() + ")");
        }
        generator.writeFieldName(key);
        writeValue(generator, entry.getValue());
      }
      generator.writeEndObject();
    } else if (value instanceof Collection<?> items) {
      generator.writeStartArray();
      for (Object item : items) {
        writeValue(generator, item);
      }
      generator.writeEndArray();
    } else if (value instanceof Object[] items) {
      generator.writeStartArray();
      for (Object item : items) {
        writeValue(generator, item);
      }
      generator.writeEndArray();
    } else {
      throw new IllegalArgumentException("Unsupported value type " + value.getClass().getName());
    }
  }

  private static Object readValue(JsonParser parser, JsonToken token) throws IOException {
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case START_ARRAY -> readArray(parser);
      case VALUE_STRING -> parser.getText();
      case VALUE_NUMBER_INT -> readInteger(parser);
      case VALUE_NUMBER_FLOAT -> parser.getDoubleValue();
      case VALUE_TRUE -> Boolean.TRUE;
      case VALUE_FALSE -> Boolean.FALSE;
      case VALUE_NULL -> null;
      case VALUE_EMBEDDED_OBJECT -> parser.getBinaryValue();
      default -> throw new DecodeException("Unexpected token " + token);
    };
  }

  private static Object readInteger(JsonParser parser) throws IOException {
    if (parser.getNumberType() == JsonParser.NumberType.BIG_INTEGER) {
      return parser.getBigIntegerValue();
    }
    return parser.getLongValue();
  }

  private static Map<String, Object> readObject(JsonParser parser) throws IOException {
    Map<String, Object> map = new LinkedHashMap<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_OBJECT) {
        return map;
      }
      if (token != JsonToken.FIELD_NAME) {
        throw new DecodeException("Expected field name but found " + token);
      }
      String fieldName = parser.currentName();
      map.put(fieldName, readValue(parser, requireToken(parser.nextToken())));
    }
  }

  private static List<Object> readArray(JsonParser parser) throws IOException {
    List<Object> list = new ArrayList<>();
    while (true) {
      JsonToken token = requireToken(parser.nextToken());
      if (token == JsonToken.END_ARRAY) {
        return list;
      }
      list.add(readValue(parser, token));
    }
  }

  private static JsonToken requireToken(JsonToken token) {
    if (token == null) {
      throw new DecodeException("Truncated payload");
    }
    return token;
  }
}
