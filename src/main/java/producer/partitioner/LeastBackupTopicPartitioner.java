package producer.partitioner;

import producer.ProducerRecord;

/**
 * Pins the least backed-up partition until its batch rolls over.
 *
 * Whenever there is no pin, or the pin is out of range for the current partition count, every
 * partition's buffered count is read once and the first partition holding the minimum wins.
 */
class LeastBackupTopicPartitioner implements TopicBackupPartitioner {
    private int onPart;

    LeastBackupTopicPartitioner() {
        this.onPart = -1;
    }

    @Override
    public void onNewBatch() {
        onPart = -1;
    }

    @Override
    public boolean requiresConsistency(ProducerRecord record) {
        return false;
    }

    @Override
    public int partition(ProducerRecord record, int numPartitions) {
        throw new UnsupportedOperationException("Least backup partitioning needs buffered counts; use partitionByBackup");
    }

    @Override
    public int partitionByBackup(ProducerRecord record, int numPartitions, BackupSupplier backup) {
        if (onPart == -1 || onPart >= numPartitions) {
            int pick = -1;
            long leastBackup = Long.MAX_VALUE;
            for (int i = 0; i < numPartitions; i++) {
                PartitionBackup candidate = backup.next();
                if (pick == -1 || candidate.buffered() < leastBackup) {
                    leastBackup = candidate.buffered();
                    pick = candidate.index();
                }
            }
            onPart = pick;
        }
        return onPart;
    }
}
