package producer.partitioner;

import producer.ProducerRecord;

import java.util.Random;

/**
 * Hashes keyed records with the configured hasher and pins unkeyed records the way
 * {@link StickyTopicPartitioner} does.
 */
class StickyKeyTopicPartitioner extends StickyTopicPartitioner {
    private final PartitionerHasher hasher;

    StickyKeyTopicPartitioner(PartitionerHasher hasher) {
        super();
        this.hasher = hasher;
    }

    StickyKeyTopicPartitioner(PartitionerHasher hasher, Random rng) {
        super(rng);
        this.hasher = hasher;
    }

    @Override
    public boolean requiresConsistency(ProducerRecord record) {
        return record.getKey() != null;
    }

    @Override
    public int partition(ProducerRecord record, int numPartitions) {
        if (record.getKey() != null) {
            return hasher.partition(record.getKey(), numPartitions);
        }
        return super.partition(record, numPartitions);
    }
}
