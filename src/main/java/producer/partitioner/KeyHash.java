package producer.partitioner;

/**
 * A 32-bit hash over a record key.
 */
@FunctionalInterface
public interface KeyHash {
    int hash(byte[] key);
}
