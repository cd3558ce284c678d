package ca.gc.cra.docrelay.adapter.kafka;

import java.util.Map;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.Partitioner;
import org.apache.kafka.common.Cluster;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;

/**
 * Builds {@link MockProducer}s typed like {@link KafkaMessageSink}'s producer, with every record routed to
 * partition 0 so delivery reports are predictable.
 */
final class MockProducerFactory {

  private MockProducerFactory() {
    // Utility
  }

  /** Producer whose sends complete immediately. */
  static MockProducer<String, byte[]> autoCompleting() {
    return new MockProducer<>(true, new PartitionZero(), new StringSerializer(), new ByteArraySerializer());
  }

  /** Producer whose sends stay pending until completed, errored or flushed. */
  static MockProducer<String, byte[]> manual() {
    return new MockProducer<>(false, new PartitionZero(), new StringSerializer(), new ByteArraySerializer());
  }

  /** Auto-completing producer that answers {@code partitionsFor} from {@code cluster}. */
  static MockProducer<String, byte[]> withCluster(Cluster cluster) {
    return new MockProducer<>(
        cluster, true, new PartitionZero(), new StringSerializer(), new ByteArraySerializer());
  }

  private static final class PartitionZero implements Partitioner {
    @Override
    public int partition(
        String topic, Object key, byte[] keyBytes, Object value, byte[] valueBytes, Cluster cluster) {
      return 0;
    }

    @Override
    public void configure(Map<String, ?> configs) {}

    @Override
    public void close() {}
  }
}
