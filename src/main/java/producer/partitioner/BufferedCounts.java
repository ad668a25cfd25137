package producer.partitioner;

import exceptions.PartitionerMisuseException;

import java.util.function.IntToLongFunction;

/**
 * Walks partition indexes 0 through n-1, reading each one's buffered count on demand.
 * A fresh instance is made for every partitioning decision.
 */
public class BufferedCounts implements BackupSupplier {
    private final int numPartitions;
    private final IntToLongFunction bufferedAt;
    private int on;

    public BufferedCounts(int numPartitions, IntToLongFunction bufferedAt) {
        this.numPartitions = numPartitions;
        this.bufferedAt = bufferedAt;
        this.on = 0;
    }

    @Override
    public PartitionBackup next() {
        if (on >= numPartitions) {
            throw new PartitionerMisuseException("Buffered counts read " + (on + 1) + " times for "
                    + numPartitions + " partitions; a partitioner may read each partition at most once");
        }
        int index = on++;
        return new PartitionBackup(index, bufferedAt.applyAsLong(index));
    }
}
