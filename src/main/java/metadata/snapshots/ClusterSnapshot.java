package metadata.snapshots;

import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Map;

/**
 * Represents an immutable snapshot of the cluster's topic layout, as last refreshed from metadata.
 */
public record ClusterSnapshot(Map<String, TopicMetadata> topics) { // <topic name, metadata>

    public ClusterSnapshot {
        topics = ImmutableMap.copyOf(topics);
    }

    public static ClusterSnapshot empty() {
        return new ClusterSnapshot(ImmutableMap.of());
    }

    /**
     * Builds a snapshot from topic name to partition ids, treating every partition as writable.
     */
    public static ClusterSnapshot fromPartitions(Map<String, List<Integer>> partitionsByTopic) {
        ImmutableMap.Builder<String, TopicMetadata> topics = ImmutableMap.builder();
        partitionsByTopic.forEach((topicName, partitions) -> topics.put(topicName, TopicMetadata.of(topicName, partitions)));
        return new ClusterSnapshot(topics.build());
    }

    public TopicMetadata topic(String topicName) {
        return topics.get(topicName);
    }
}
