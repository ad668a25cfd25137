package producer;

import com.google.common.base.Preconditions;
import exceptions.RecordTooLargeException;
import org.tinylog.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An append-only group of records bound for one topic partition.
 *
 * Every append numbers the record (offset delta, timestamp delta, body length) and keeps a running
 * total of the encoded size, so the batch always knows its exact wire length without encoding.
 * Once {@link #seal()}ed, the batch only serves as input to {@link RecordBatchEncoder}.
 *
 * Not thread-safe; a batch is filled by one producing path.
 */
public class RecordBatch {
    /**
     * Fixed bytes of an encoded batch before any record: nullable bytes length (4), base offset (8),
     * batch length (4), partition leader epoch (4), magic (1), crc (4), attributes (2),
     * last offset delta (4), first timestamp (8), max timestamp (8), producer id (8),
     * producer epoch (2), base sequence (4), record count (4).
     */
    public static final int RECORD_BATCH_OVERHEAD = 65;

    private static final int DEFAULT_MAX_BATCH_SIZE = 1_000_000;

    private final TopicPartition topicPartition;
    private final int maxBatchSizeInBytes;
    private final List<NumberedRecord> records;
    private final long creationTime;
    private final short attributes;
    private long firstTimestamp;
    private int wireLength;
    private boolean sealed;

    public RecordBatch(String topic, int partition) {
        this(topic, partition, DEFAULT_MAX_BATCH_SIZE);
    }

    public RecordBatch(String topic, int partition, int maxBatchSizeInBytes) {
        Preconditions.checkArgument(maxBatchSizeInBytes > RECORD_BATCH_OVERHEAD,
                "Max batch size %s must leave room for the %s byte batch header", maxBatchSizeInBytes, RECORD_BATCH_OVERHEAD);
        this.topicPartition = new TopicPartition(topic, partition);
        this.maxBatchSizeInBytes = maxBatchSizeInBytes;
        this.records = new ArrayList<>();
        this.creationTime = System.currentTimeMillis();
        this.attributes = 0;
        this.wireLength = RECORD_BATCH_OVERHEAD;
        this.sealed = false;
    }

    public boolean tryAppend(ProducerRecord record) {
        return tryAppend(record, System.currentTimeMillis());
    }

    /**
     * Append {@code record} if it fits.
     *
     * @param nowMs timestamp to use when the record carries none
     * @return false if the record would push the batch past its max size; a new batch is needed
     * @throws RecordTooLargeException if the record does not fit even in an empty batch
     */
    public boolean tryAppend(ProducerRecord record, long nowMs) {
        Preconditions.checkState(!sealed, "Cannot append to sealed batch for %s", topicPartition);

        long timestamp = record.getTimestamp() != null ? record.getTimestamp() : nowMs;
        boolean first = records.isEmpty();
        long baseTimestamp = first ? timestamp : firstTimestamp;

        NumberedRecord numbered = NumberedRecord.of(record, records.size(), timestamp - baseTimestamp);
        int newWireLength = wireLength + numbered.wireLength();
        if (newWireLength > maxBatchSizeInBytes) {
            if (first) {
                throw new RecordTooLargeException(numbered.wireLength(), maxBatchSizeInBytes);
            }
            Logger.warn("Record can not fit in current batch for {}. New one may be necessary", topicPartition);
            return false;
        }

        if (first) {
            firstTimestamp = timestamp;
        }
        records.add(numbered);
        wireLength = newWireLength;
        return true;
    }

    /**
     * Close the batch to further appends.
     */
    public void seal() {
        sealed = true;
    }

    public boolean isSealed() {
        return sealed;
    }

    public TopicPartition getTopicPartition() {
        return topicPartition;
    }

    public int getMaxBatchSizeInBytes() {
        return maxBatchSizeInBytes;
    }

    public int getRecordCount() {
        return records.size();
    }

    public List<NumberedRecord> getRecords() {
        return Collections.unmodifiableList(records);
    }

    public long getFirstTimestamp() {
        return firstTimestamp;
    }

    public short getAttributes() {
        return attributes;
    }

    /**
     * Exact uncompressed encoded size, including the leading 4-byte length.
     */
    public int getWireLength() {
        return wireLength;
    }

    public long getCreationTime() {
        return creationTime;
    }

    public long getAge() {
        return System.currentTimeMillis() - creationTime;
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
