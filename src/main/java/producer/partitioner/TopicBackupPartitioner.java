package producer.partitioner;

import producer.ProducerRecord;

/**
 * A {@link TopicPartitioner} that partitions by how many records each partition has buffered.
 *
 * When a topic partitioner implements this interface, {@link #partitionByBackup} is used and
 * {@link #partition} is never called.
 */
public interface TopicBackupPartitioner extends TopicPartitioner {

    /**
     * Like {@link #partition}, with access to per-partition buffered record counts. {@code backup}
     * may be read at most {@code numPartitions} times; reading it more is a contract violation.
     */
    int partitionByBackup(ProducerRecord record, int numPartitions, BackupSupplier backup);
}
