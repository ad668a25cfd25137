package producer.partitioner;

import com.google.common.base.Preconditions;
import exceptions.InvalidPartitionException;
import exceptions.InvalidTopicException;
import metadata.snapshots.TopicMetadata;
import producer.ProducerRecord;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.IntToLongFunction;

/**
 * Routes records to partitions using one {@link Partitioner}.
 *
 * Keeps the topic partitioner of every topic seen so far, creating each exactly once. A record
 * that requires consistency is placed among all of its topic's partitions; any other record only
 * among the writable ones, when there are any. The chosen index is checked here, so a partitioner
 * returning an out-of-range index (manual partitioning with a bad hint, for instance) fails the
 * record instead of being silently remapped.
 *
 * Safe to share across topics. Decisions for any single topic must be serialized by the caller.
 */
public class PartitionSelector {
    private static final IntToLongFunction NO_BACKUP = partition -> 0L;

    private final Partitioner partitioner;
    private final ConcurrentMap<String, TopicPartitioner> topicPartitioners;

    public PartitionSelector(Partitioner partitioner) {
        this.partitioner = partitioner;
        this.topicPartitioners = new ConcurrentHashMap<>();
    }

    public TopicPartitioner topicPartitioner(String topic) {
        return topicPartitioners.computeIfAbsent(topic, partitioner::forTopic);
    }

    /**
     * Forwards a batch rollover on {@code topic} to its topic partitioner.
     */
    public void onNewBatch(String topic) {
        topicPartitioner(topic).onNewBatch();
    }

    /**
     * Picks the partition id for {@code record} among {@code topic}'s partitions.
     *
     * @param bufferedByPartition buffered record count for a partition id, or null if unknown
     * @throws IllegalArgumentException if {@code topic} is not the record's topic
     * @throws InvalidTopicException if the topic has no partitions
     * @throws InvalidPartitionException if the partitioner picks an index out of range
     */
    public int selectPartition(ProducerRecord record, TopicMetadata topic, IntToLongFunction bufferedByPartition) {
        Preconditions.checkArgument(record.getTopic().equals(topic.topicName()),
                "Record for topic %s cannot be placed using metadata of topic %s", record.getTopic(), topic.topicName());
        TopicPartitioner topicPartitioner = topicPartitioner(record.getTopic());

        List<Integer> candidates = topic.partitions();
        if (!topicPartitioner.requiresConsistency(record) && !topic.writablePartitions().isEmpty()) {
            candidates = topic.writablePartitions();
        }
        if (candidates.isEmpty()) {
            throw new InvalidTopicException(record.getTopic());
        }

        IntToLongFunction backupById = bufferedByPartition != null ? bufferedByPartition : NO_BACKUP;
        List<Integer> mapping = candidates;
        int index = pick(topicPartitioner, record, mapping.size(), i -> backupById.applyAsLong(mapping.get(i)));
        return mapping.get(index);
    }

    /**
     * Picks a partition index in {@code [0, numPartitions)} for {@code record}.
     *
     * @param bufferedAt buffered record count by partition index, or null if unknown
     */
    public int selectIndex(ProducerRecord record, int numPartitions, IntToLongFunction bufferedAt) {
        if (numPartitions <= 0) {
            throw new InvalidTopicException(record.getTopic());
        }
        return pick(topicPartitioner(record.getTopic()), record, numPartitions,
                bufferedAt != null ? bufferedAt : NO_BACKUP);
    }

    private int pick(TopicPartitioner topicPartitioner, ProducerRecord record, int numPartitions, IntToLongFunction bufferedAt) {
        int index;
        if (topicPartitioner instanceof TopicBackupPartitioner) {
            BufferedCounts backup = new BufferedCounts(numPartitions, bufferedAt);
            index = ((TopicBackupPartitioner) topicPartitioner).partitionByBackup(record, numPartitions, backup);
        } else {
            index = topicPartitioner.partition(record, numPartitions);
        }
        if (index < 0 || index >= numPartitions) {
            throw new InvalidPartitionException(index, record.getTopic(), numPartitions);
        }
        return index;
    }
}
