package producer.partitioner;

/**
 * Lazily yields the buffered record count of each partition, one partition per call.
 */
@FunctionalInterface
public interface BackupSupplier {

    PartitionBackup next();
}
