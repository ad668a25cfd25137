package producer.partitioner;

/**
 * Number of records currently buffered for the partition at {@code index}.
 */
public record PartitionBackup(int index, long buffered) {
}
