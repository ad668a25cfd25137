package producer.partitioner;

import producer.ProducerRecord;

/**
 * Picks a partition index in {@code [0, numPartitions)} for a record.
 */
@FunctionalInterface
public interface PartitionFunction {

    int partition(ProducerRecord record, int numPartitions);
}
