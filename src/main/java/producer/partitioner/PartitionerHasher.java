package producer.partitioner;

/**
 * Maps a record key to a partition index in {@code [0, n)}.
 *
 * Clients differ in how they turn a signed 32-bit hash into an index. The two adapters here
 * reproduce the Java client and Sarama respectively, so either ecosystem's key placement can be
 * matched with any hash function.
 */
@FunctionalInterface
public interface PartitionerHasher {

    int partition(byte[] key, int numPartitions);

    /**
     * Clears the sign bit, then takes the remainder, like Kafka's Java client.
     */
    static PartitionerHasher kafka(KeyHash hashFn) {
        return (key, n) -> (hashFn.hash(key) & 0x7fffffff) % n;
    }

    /**
     * Takes the signed remainder, then flips a negative result positive, like Sarama.
     */
    static PartitionerHasher sarama(KeyHash hashFn) {
        return (key, n) -> {
            int p = hashFn.hash(key) % n;
            if (p < 0) {
                p = -p;
            }
            return p;
        };
    }

    /**
     * The Java client's default: murmur2 with the sign bit masked.
     */
    static PartitionerHasher murmur2() {
        return kafka(MurmurHash2::hash);
    }
}
