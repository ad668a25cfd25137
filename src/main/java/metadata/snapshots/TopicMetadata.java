package metadata.snapshots;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Represents an immutable snapshot of a topic's partitions.
 *
 * {@code partitions} lists every partition id the cluster reports, in order.
 * {@code writablePartitions} is the subset whose leader is currently reachable.
 */
public record TopicMetadata(String topicName,
                            List<Integer> partitions,
                            List<Integer> writablePartitions) {

    public TopicMetadata {
        partitions = ImmutableList.copyOf(partitions);
        writablePartitions = ImmutableList.copyOf(writablePartitions);
    }

    /**
     * A topic whose partitions are all writable.
     */
    public static TopicMetadata of(String topicName, List<Integer> partitions) {
        return new TopicMetadata(topicName, partitions, partitions);
    }

    /**
     * A topic with partitions {@code 0} through {@code numPartitions - 1}, all writable.
     */
    public static TopicMetadata withPartitionCount(String topicName, int numPartitions) {
        ImmutableList.Builder<Integer> ids = ImmutableList.builder();
        for (int p = 0; p < numPartitions; p++) {
            ids.add(p);
        }
        return of(topicName, ids.build());
    }

    public int numPartitions() {
        return partitions.size();
    }
}
