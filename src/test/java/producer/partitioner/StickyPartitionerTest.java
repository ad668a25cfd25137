package producer.partitioner;

import org.junit.jupiter.api.Test;
import producer.ProducerRecord;

import java.util.HashSet;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class StickyPartitionerTest {

    private static final ProducerRecord UNKEYED = new ProducerRecord("t", new byte[]{1});

    private static Random always(int value) {
        return new Random() {
            @Override
            public int nextInt(int bound) {
                return value % bound;
            }
        };
    }

    @Test
    public void unkeyedRecordsStickUntilNewBatch() {
        StickyTopicPartitioner partitioner = new StickyTopicPartitioner(new Random(7));
        int first = partitioner.partition(UNKEYED, 10);

        for (int i = 0; i < 100; i++) {
            assertEquals(first, partitioner.partition(UNKEYED, 10));
        }
        assertFalse(partitioner.requiresConsistency(UNKEYED));
    }

    @Test
    public void newBatchNeverRepeatsPreviousPartition() {
        StickyTopicPartitioner partitioner = new StickyTopicPartitioner(always(2));

        assertEquals(2, partitioner.partition(UNKEYED, 5));
        partitioner.onNewBatch();
        assertEquals(3, partitioner.partition(UNKEYED, 5));
        partitioner.onNewBatch();
        assertEquals(2, partitioner.partition(UNKEYED, 5));
    }

    @Test
    public void repeatWrapsAroundToZero() {
        StickyTopicPartitioner partitioner = new StickyTopicPartitioner(always(4));

        assertEquals(4, partitioner.partition(UNKEYED, 5));
        partitioner.onNewBatch();
        assertEquals(0, partitioner.partition(UNKEYED, 5));
    }

    @Test
    public void pinBeyondPartitionCountIsRepicked() {
        StickyTopicPartitioner partitioner = new StickyTopicPartitioner(new Random(3));
        int pinned = partitioner.partition(UNKEYED, 100);
        int shrunk = partitioner.partition(UNKEYED, 1);

        assertTrue(pinned >= 0 && pinned < 100);
        assertEquals(0, shrunk);
    }

    @Test
    public void stickyKeyHashesKeyedRecords() {
        StickyKeyTopicPartitioner partitioner = new StickyKeyTopicPartitioner(PartitionerHasher.murmur2(), new Random(11));
        ProducerRecord keyed = ProducerRecord.of("t", "foobar", "v");

        for (int i = 0; i < 5; i++) {
            assertEquals(6, partitioner.partition(keyed, 10));
            partitioner.onNewBatch();
        }
        assertTrue(partitioner.requiresConsistency(keyed));
        assertFalse(partitioner.requiresConsistency(UNKEYED));
    }

    @Test
    public void stickyKeyUnkeyedChangesOnlyOnNewBatch() {
        StickyKeyTopicPartitioner partitioner = new StickyKeyTopicPartitioner(PartitionerHasher.murmur2(), new Random(5));
        ProducerRecord keyed = ProducerRecord.of("t", "abc", "v");
        Set<Integer> seen = new HashSet<>();

        int pinned = partitioner.partition(UNKEYED, 10);
        partitioner.partition(keyed, 10);
        assertEquals(pinned, partitioner.partition(UNKEYED, 10));

        for (int batch = 0; batch < 20; batch++) {
            partitioner.onNewBatch();
            int next = partitioner.partition(UNKEYED, 10);
            assertNotEquals(pinned, next);
            pinned = next;
            seen.add(next);
        }
        assertTrue(seen.size() > 1);
    }

    @Test
    public void roundRobinCycles() {
        TopicPartitioner partitioner = Partitioners.roundRobin().forTopic("t");

        for (int i = 0; i < 9; i++) {
            assertEquals(i % 3, partitioner.partition(UNKEYED, 3));
        }
        assertTrue(partitioner.requiresConsistency(UNKEYED));
    }

    @Test
    public void manualUsesRecordPartition() {
        TopicPartitioner partitioner = Partitioners.manual().forTopic("t");

        assertEquals(3, partitioner.partition(new ProducerRecord("t", 3, null, new byte[1]), 4));
        assertEquals(-1, partitioner.partition(UNKEYED, 4));
        assertTrue(partitioner.requiresConsistency(UNKEYED));
    }
}
