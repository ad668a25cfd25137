package producer.partitioner;

import java.util.function.Function;

/**
 * Factories for the built-in partitioning strategies.
 */
public final class Partitioners {

    private Partitioners() {
        throw new AssertionError("Cannot be instantiated.");
    }

    /**
     * Wraps a function of the topic name that returns the partition function for that topic.
     * Records always require consistency.
     */
    public static Partitioner basicConsistent(Function<String, PartitionFunction> forTopic) {
        return topic -> new BasicTopicPartitioner(forTopic.apply(topic));
    }

    /**
     * Uses the partition already set on each record. A record without one gets index -1, which
     * fails when the partition is validated.
     */
    public static Partitioner manual() {
        return basicConsistent(topic -> (record, n) -> record.getPartition() == null ? -1 : record.getPartition());
    }

    /**
     * Spreads records across partitions one at a time, with an independent cycle per topic.
     * Like every basic partitioner, it requires consistency and so also cycles through
     * partitions that are currently unavailable.
     */
    public static Partitioner roundRobin() {
        return basicConsistent(topic -> {
            int[] next = {0};
            // floorMod keeps the index in range once the counter wraps negative
            return (record, n) -> Math.floorMod(next[0]++, n);
        });
    }

    /**
     * Pins a random partition per batch, ignoring keys.
     */
    public static Partitioner sticky() {
        return topic -> new StickyTopicPartitioner();
    }

    /**
     * Hashes keyed records with {@code hasher} and pins unkeyed records per batch.
     * A null hasher partitions keys exactly as Kafka's Java client does: murmur2, sign bit
     * masked, modulo the partition count.
     */
    public static Partitioner stickyKey(PartitionerHasher hasher) {
        PartitionerHasher effective = hasher != null ? hasher : PartitionerHasher.murmur2();
        return topic -> new StickyKeyTopicPartitioner(effective);
    }

    /**
     * Pins the least backed-up partition per batch. Favors throughput over even spread and keeps
     * writing while some brokers are slow or down.
     */
    public static Partitioner leastBackup() {
        return topic -> new LeastBackupTopicPartitioner();
    }
}
