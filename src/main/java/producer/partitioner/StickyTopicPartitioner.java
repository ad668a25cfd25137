package producer.partitioner;

import producer.ProducerRecord;

import java.util.Random;

/**
 * Pins one randomly chosen partition until its batch rolls over.
 *
 * States are unpinned ({@code onPart == -1}) and pinned. {@link #onNewBatch()} unpins and
 * remembers the old pin; the next decision picks a random partition, stepping to the following
 * one if it drew the old pin again, so consecutive batches do not land on the same partition.
 */
class StickyTopicPartitioner implements TopicPartitioner {
    private final Random rng;
    private int lastPart;
    private int onPart;

    StickyTopicPartitioner() {
        this(new Random());
    }

    StickyTopicPartitioner(Random rng) {
        this.rng = rng;
        this.lastPart = -1;
        this.onPart = -1;
    }

    @Override
    public void onNewBatch() {
        lastPart = onPart;
        onPart = -1;
    }

    @Override
    public boolean requiresConsistency(ProducerRecord record) {
        return false;
    }

    @Override
    public int partition(ProducerRecord record, int numPartitions) {
        if (onPart == -1 || onPart >= numPartitions) {
            onPart = rng.nextInt(numPartitions);
            if (onPart == lastPart) {
                onPart = (onPart + 1) % numPartitions;
            }
        }
        return onPart;
    }
}
