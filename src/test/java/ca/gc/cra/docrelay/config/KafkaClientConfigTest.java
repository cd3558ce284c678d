package ca.gc.cra.docrelay.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Properties;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.junit.jupiter.api.Test;

class KafkaClientConfigTest {

  @Test
  void explicitBootstrapServersComeBeforeOverrideServers() {
    KafkaClientConfig config = KafkaClientConfig.producer("1.2.3.4:9092",
        Map.of("bootstrap.servers", "5.6.7.8:9092"));

    assertEquals("1.2.3.4:9092,5.6.7.8:9092", config.get("bootstrap.servers").orElseThrow());
    assertEquals(List.of("1.2.3.4:9092", "5.6.7.8:9092"), config.bootstrapServers());
  }

  @Test
  void paddedBootstrapOverrideKeyStillMerges() {
    KafkaClientConfig config = KafkaClientConfig.consumer("1.2.3.4:9092", "g", null,
        Map.of(" bootstrap.servers ", "5.6.7.8:9092"));

    assertEquals("1.2.3.4:9092,5.6.7.8:9092", config.get("bootstrap.servers").orElseThrow());
    assertEquals(List.of("1.2.3.4:9092", "5.6.7.8:9092"), config.bootstrapServers());
  }

  @Test
  void bootstrapServersMayBeACollection() {
    KafkaClientConfig config = KafkaClientConfig.consumer(List.of("broker-1:9092", " broker-2:9093 "), "g",
        null, Map.of());

    assertEquals("broker-1:9092,broker-2:9093", config.get("bootstrap.servers").orElseThrow());
  }

  @Test
  void producerDefaultsToIdempotenceAndFixedSerializers() {
    KafkaClientConfig config = KafkaClientConfig.producer("localhost:9092",
        Map.of("key.serializer", "com.example.Other", "linger.ms", 5));

    assertEquals(KafkaClientConfig.Role.PRODUCER, config.role());
    assertEquals(Boolean.TRUE, config.get("enable.idempotence").orElseThrow());
    assertEquals(StringSerializer.class.getName(), config.get("key.serializer").orElseThrow());
    assertEquals(ByteArraySerializer.class.getName(), config.get("value.serializer").orElseThrow());
    assertEquals(5, config.get("linger.ms").orElseThrow());
  }

  @Test
  void idempotenceCanBeOverridden() {
    KafkaClientConfig config = KafkaClientConfig.producer("localhost:9092", Map.of("enable.idempotence", false));

    assertEquals(false, config.get("enable.idempotence").orElseThrow());
  }

  @Test
  void consumerGetsRandomGroupAndLatestOffsetsByDefault() {
    KafkaClientConfig first = KafkaClientConfig.consumer("localhost:9092", null, null, null);
    KafkaClientConfig second = KafkaClientConfig.consumer("localhost:9092", null, null, null);

    String group = (String) first.get("group.id").orElseThrow();
    assertTrue(group.startsWith(KafkaClientConfig.GROUP_ID_PREFIX));
    assertNotEquals(group, second.get("group.id").orElseThrow());
    assertEquals("latest", first.get("auto.offset.reset").orElseThrow());
    assertEquals(ByteArrayDeserializer.class.getName(), first.get("value.deserializer").orElseThrow());
    assertEquals(ByteArrayDeserializer.class.getName(), first.get("key.deserializer").orElseThrow());
  }

  @Test
  void explicitGroupAndOffsetResetWinOverOverrides() {
    Map<String, Object> overrides = Map.of("group.id", "from-file", "auto.offset.reset", "latest");

    KafkaClientConfig explicit = KafkaClientConfig.consumer("localhost:9092", "cli-group", "EARLIEST", overrides);
    KafkaClientConfig fromFile = KafkaClientConfig.consumer("localhost:9092", null, null, overrides);

    assertEquals("cli-group", explicit.get("group.id").orElseThrow());
    assertEquals("earliest", explicit.get("auto.offset.reset").orElseThrow());
    assertEquals("from-file", fromFile.get("group.id").orElseThrow());
  }

  @Test
  void rejectsInvalidInputs() {
    assertThrows(IllegalArgumentException.class, () -> KafkaClientConfig.producer(null, Map.of()));
    assertThrows(IllegalArgumentException.class, () -> KafkaClientConfig.producer("no-port", Map.of()));
    assertThrows(IllegalArgumentException.class, () -> KafkaClientConfig.producer(42, Map.of()));
    assertThrows(IllegalArgumentException.class,
        () -> KafkaClientConfig.consumer("localhost:9092", "g", "none", Map.of()));
    assertThrows(IllegalArgumentException.class,
        () -> KafkaClientConfig.consumer("localhost:9092", " ", null, Map.of()));
  }

  @Test
  void toStringAndRedactedMaskSecretsButPropertiesKeepThem() {
    KafkaClientConfig config = KafkaClientConfig.producer("localhost:9092", Map.of(
        "sasl.jaas.config", "secret-jaas",
        "ssl.keystore.password", "secret-pass",
        "client.id", "docrelay-publisher"));

    String rendered = config.toString();
    Properties props = config.toProperties();

    assertTrue(rendered.startsWith("KafkaClientConfig(role=producer, {"));
    assertFalse(rendered.contains("secret-"), rendered);
    assertEquals("****", config.redacted().get("sasl.jaas.config"));
    assertEquals("****", config.redacted().get("ssl.keystore.password"));
    assertEquals("docrelay-publisher", config.redacted().get("client.id"));
    assertEquals("secret-jaas", props.get("sasl.jaas.config"));
  }
}
