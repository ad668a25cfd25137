package producer.partitioner;

import producer.ProducerRecord;

/**
 * Chooses partitions for records of a single topic.
 *
 * The producer never partitions two records of the same topic at once, so implementations may
 * keep unsynchronized state.
 */
public interface TopicPartitioner {

    /**
     * Called when the batch for the last chosen partition rolls over to a new batch.
     */
    void onNewBatch();

    /**
     * Whether {@code record} must map to the same partition even while that partition is
     * unavailable. Such records are partitioned over all partitions and wait for the chosen one
     * to return; others are partitioned over writable partitions only.
     */
    boolean requiresConsistency(ProducerRecord record);

    /**
     * Index in {@code [0, numPartitions)} of the partition to use for {@code record}.
     */
    int partition(ProducerRecord record, int numPartitions);
}
