package ca.gc.cra.docrelay.domain.msg;

import java.util.List;
import java.util.Objects;

/**
 * Partition layout of a topic as reported by the cluster.
 *
 * @param topic topic name
 * @param partitions partitions ordered by id; empty when the topic is unknown
 * @since 0.1.0
 */
public record TopicMetadata(String topic, List<PartitionMetadata> partitions) {

  public TopicMetadata {
    Objects.requireNonNull(topic, "topic");
    partitions = List.copyOf(Objects.requireNonNullElse(partitions, List.of()));
  }

  /**
   * Returns the number of partitions.
   *
   * @return partition count
   */
  public int partitionCount() {
    return partitions.size();
  }

  /**
   * Metadata for a single partition.
   *
   * @param id partition index
   * @param leader broker id of the leader, or {@code -1} when no leader is elected
   * @param replicas broker ids hosting replicas
   */
  public record PartitionMetadata(int id, int leader, List<Integer> replicas) {
    public PartitionMetadata {
      replicas = List.copyOf(Objects.requireNonNullElse(replicas, List.of()));
    }
  }
}
