package producer;

import commons.header.Header;
import commons.utils.ByteUtils;
import commons.utils.WireBuffer;

/**
 * A record placed in a batch: its position, its timestamp relative to the batch's first record,
 * and the precomputed length of its encoded body.
 *
 * The body length covers everything after the length prefix itself.
 */
public record NumberedRecord(ProducerRecord record, int lengthField, long timestampDelta, int offsetDelta) {

    /**
     * Numbers {@code record} for the given position and timestamp delta.
     */
    public static NumberedRecord of(ProducerRecord record, int offsetDelta, long timestampDelta) {
        int length = 1 // attributes
                + ByteUtils.sizeOfVarlong(timestampDelta)
                + ByteUtils.sizeOfVarint(offsetDelta)
                + ByteUtils.sizeOfVarintBytes(record.getKey())
                + ByteUtils.sizeOfVarintBytes(record.getValue())
                + ByteUtils.sizeOfVarint(record.getHeaders().size());
        for (Header header : record.getHeaders()) {
            length += ByteUtils.sizeOfVarintString(header.getKey())
                    + ByteUtils.sizeOfVarintBytes(header.getValue());
        }
        return new NumberedRecord(record, length, timestampDelta, offsetDelta);
    }

    /**
     * Bytes this record occupies in the batch, length prefix included.
     */
    public int wireLength() {
        return ByteUtils.sizeOfVarint(lengthField) + lengthField;
    }

    public void appendTo(WireBuffer dst) {
        dst.appendVarint(lengthField);
        dst.appendInt8((byte) 0); // attributes, unused
        dst.appendVarlong(timestampDelta);
        dst.appendVarint(offsetDelta);
        dst.appendVarintBytes(record.getKey());
        dst.appendVarintBytes(record.getValue());
        dst.appendVarint(record.getHeaders().size());
        for (Header header : record.getHeaders()) {
            dst.appendVarintString(header.getKey());
            dst.appendVarintBytes(header.getValue());
        }
    }
}
