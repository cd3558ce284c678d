package ca.gc.cra.docrelay.config;

import ca.gc.cra.docrelay.logging.Logs;
import ca.gc.cra.docrelay.validation.Net;
import ca.gc.cra.docrelay.validation.Strings;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.UUID;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;

/**
 * <strong>What:</strong> Effective Kafka client configuration for one producer or consumer.
 * <p><strong>Why:</strong> Callers supply bootstrap servers separately from a free-form override map; both
 * sources must be merged, validated and rendered without leaking credentials.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Concatenate the explicit bootstrap servers with any {@code bootstrap.servers} override, explicit
 *       servers first, validating every {@code host:port}.</li>
 *   <li>Apply role defaults: {@code enable.idempotence=true} for producers; {@code auto.offset.reset}
 *       and {@code group.id} for consumers.</li>
 *   <li>Force the byte-level (de)serializers the adapters rely on.</li>
 *   <li>Mask secret values in {@link #redacted()} and {@link #toString()}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 */
public final class KafkaClientConfig {
  /** Offset reset policy used when the caller supplies none. */
  public static final String DEFAULT_AUTO_OFFSET_RESET = "latest";

  static final String GROUP_ID_PREFIX = "docrelay-";

  /** Client role the configuration was built for. */
  public enum Role {
    PRODUCER,
    CONSUMER
  }

  private final Role role;
  private final List<String> bootstrapServers;
  private final Map<String, Object> properties;

  private KafkaClientConfig(Role role, List<String> bootstrapServers, Map<String, Object> properties) {
    this.role = role;
    this.bootstrapServers = List.copyOf(bootstrapServers);
    this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
  }

  /**
   * Builds a producer configuration.
   *
   * @param bootstrapServers comma-separated {@code String} or collection of {@code host:port} entries
   * @param overrides additional client properties; may be {@code null}
   * @return producer configuration
   * @throws IllegalArgumentException if no valid bootstrap server remains or an entry is malformed
   */
  public static KafkaClientConfig producer(Object bootstrapServers, Map<String, ?> overrides) {
    Map<String, Object> merged = new LinkedHashMap<>();
    merged.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, Boolean.TRUE);
    copyOverrides(overrides, merged);
    List<String> servers = mergeBootstrap(bootstrapServers, merged);
    merged.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, String.join(",", servers));
    merged.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    merged.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());
    return new KafkaClientConfig(Role.PRODUCER, servers, merged);
  }

  /**
   * Builds a consumer configuration.
   *
   * <p>{@code groupId} and {@code autoOffsetReset}, when given, win over the same keys in {@code overrides}.
   * Without any group id a random {@code docrelay-<uuid>} group is generated.</p>
   *
   * @param bootstrapServers comma-separated {@code String} or collection of {@code host:port} entries
   * @param groupId consumer group; may be {@code null}
   * @param autoOffsetReset {@code earliest} or {@code latest}; {@code null} keeps the override or {@code latest}
   * @param overrides additional client properties; may be {@code null}
   * @return consumer configuration
   */
  public static KafkaClientConfig consumer(
      Object bootstrapServers, String groupId, String autoOffsetReset, Map<String, ?> overrides) {
    Map<String, Object> merged = new LinkedHashMap<>();
    copyOverrides(overrides, merged);
    List<String> servers = mergeBootstrap(bootstrapServers, merged);
    merged.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, String.join(",", servers));

    Object reset = autoOffsetReset != null
        ? autoOffsetReset
        : merged.getOrDefault(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, DEFAULT_AUTO_OFFSET_RESET);
    merged.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, validateOffsetReset(String.valueOf(reset)));

    if (groupId != null) {
      merged.put(ConsumerConfig.GROUP_ID_CONFIG, Strings.requireNonBlank("group.id", groupId));
    } else if (merged.get(ConsumerConfig.GROUP_ID_CONFIG) == null) {
      merged.put(ConsumerConfig.GROUP_ID_CONFIG, GROUP_ID_PREFIX + UUID.randomUUID());
    }
    merged.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class.getName());
    merged.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class.getName());
    return new KafkaClientConfig(Role.CONSUMER, servers, merged);
  }

  public Role role() {
    return role;
  }

  /**
   * Returns the merged bootstrap list in connection order.
   *
   * @return immutable list of normalized {@code host:port} entries
   */
  public List<String> bootstrapServers() {
    return bootstrapServers;
  }

  /**
   * Returns the effective properties, secrets included. Never log this map; use {@link #redacted()}.
   *
   * @return unmodifiable property map
   */
  public Map<String, Object> properties() {
    return properties;
  }

  public Optional<Object> get(String key) {
    return Optional.ofNullable(properties.get(key));
  }

  /**
   * Copies the properties into a {@link Properties} instance for the Kafka client constructors.
   *
   * @return fresh properties; caller owns the result
   */
  public Properties toProperties() {
    Properties props = new Properties();
    properties.forEach(props::put);
    return props;
  }

  /**
   * Returns the properties with every secret value replaced by {@link Logs#MASK}.
   *
   * @return unmodifiable redacted map, safe to log
   */
  public Map<String, Object> redacted() {
    Map<String, Object> copy = new LinkedHashMap<>();
    properties.forEach((key, value) -> copy.put(key, Logs.redact(key, value)));
    return Collections.unmodifiableMap(copy);
  }

  @Override
  public String toString() {
    return "KafkaClientConfig(role=" + role.name().toLowerCase(Locale.ROOT) + ", " + redacted() + ")";
  }

  private static void copyOverrides(Map<String, ?> overrides, Map<String, Object> target) {
    if (overrides == null) {
      return;
    }
    overrides.forEach((key, value) -> {
      if (key == null || key.isBlank()) {
        throw new IllegalArgumentException("client configuration contains a blank key");
      }
      if (value != null) {
        target.put(key.trim(), value);
      }
    });
  }

  // Reads the copied overrides, whose keys are already trimmed.
  private static List<String> mergeBootstrap(Object explicit, Map<String, Object> copiedOverrides) {
    List<String> servers = new ArrayList<>(toServerList(explicit));
    servers.addAll(toServerList(copiedOverrides.get(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG)));
    return Net.validateBootstrapServers(servers);
  }

  private static List<String> toServerList(Object value) {
    if (value == null) {
      return List.of();
    }
    if (value instanceof String csv) {
      return csv.isBlank() ? List.of() : Strings.splitCsv("bootstrap.servers", csv);
    }
    if (value instanceof Collection<?> entries) {
      List<String> servers = new ArrayList<>(entries.size());
      for (Object entry : entries) {
        Objects.requireNonNull(entry, "bootstrap server entry");
        servers.addAll(toServerList(entry.toString()));
      }
      return servers;
    }
    throw new IllegalArgumentException(
        "bootstrap servers must be a comma-separated string or a collection, not " + value.getClass().getName());
  }

  private static String validateOffsetReset(String value) {
    String normalized = Strings.requireNonBlank("auto.offset.reset", value).toLowerCase(Locale.ROOT);
    if (!normalized.equals("earliest") && !normalized.equals("latest")) {
      throw new IllegalArgumentException("auto.offset.reset must be earliest or latest (was " + value + ")");
    }
    return normalized;
  }
}
