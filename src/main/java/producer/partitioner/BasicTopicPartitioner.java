package producer.partitioner;

import producer.ProducerRecord;

/**
 * Adapts a plain partition function. The function alone decides placement, so every record
 * requires consistency and is never moved off an unavailable partition.
 */
class BasicTopicPartitioner implements TopicPartitioner {
    private final PartitionFunction fn;

    BasicTopicPartitioner(PartitionFunction fn) {
        this.fn = fn;
    }

    @Override
    public void onNewBatch() {
    }

    @Override
    public boolean requiresConsistency(ProducerRecord record) {
        return true;
    }

    @Override
    public int partition(ProducerRecord record, int numPartitions) {
        return fn.partition(record, numPartitions);
    }
}
