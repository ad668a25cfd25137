package producer;

import com.google.common.base.Preconditions;
import commons.compression.Compressor;
import commons.compression.CompressorPool;
import commons.utils.Checksums;
import commons.utils.WireBuffer;
import org.tinylog.Logger;

import java.util.List;

/**
 * Writes a sealed {@link RecordBatch} in the magic v2 record batch format, as the nullable bytes
 * value of one partition in a produce request.
 *
 * Layout, all integers big-endian:
 * <pre>
 *   length            int32   bytes that follow in this entry
 *   baseOffset        int64   0, the broker assigns offsets
 *   batchLength       int32   bytes that follow this field
 *   leaderEpoch       int32   -1
 *   magic             int8    2
 *   crc               uint32  CRC-32C of everything after this field
 *   attributes        int16   compression codec in the low bits
 *   lastOffsetDelta   int32
 *   firstTimestamp    int64
 *   maxTimestamp      int64
 *   producerId        int64   -1
 *   producerEpoch     int16   -1
 *   baseSequence      int32   -1
 *   records           [Record]
 * </pre>
 *
 * Only the records region is compressed. If compressing it does not make it strictly smaller,
 * or the codec fails, the uncompressed records are kept and the attributes carry no codec.
 *
 * Stateless and safe for concurrent use; each call writes only to the caller's buffer.
 */
public class RecordBatchEncoder {
    static final byte MAGIC = 2;

    /**
     * Appends the encoded batch to {@code dst}.
     *
     * @param compressor pool for the negotiated codec, or null to write uncompressed
     * @throws IllegalArgumentException if the batch is empty
     * @throws IllegalStateException if the batch is not sealed
     */
    public void appendTo(WireBuffer dst, RecordBatch batch, CompressorPool compressor) {
        Preconditions.checkArgument(!batch.isEmpty(), "Cannot encode empty batch for %s", batch.getTopicPartition());
        Preconditions.checkState(batch.isSealed(), "Batch for %s must be sealed before encoding", batch.getTopicPartition());

        List<NumberedRecord> records = batch.getRecords();

        int nullableBytesLen = batch.getWireLength() - 4;
        int nullableBytesLenAt = dst.position();
        dst.appendInt32(nullableBytesLen);

        dst.appendInt64(0L); // base offset

        int batchLen = nullableBytesLen - 8 - 4;
        int batchLenAt = dst.position();
        dst.appendInt32(batchLen);

        dst.appendInt32(-1); // partition leader epoch
        dst.appendInt8(MAGIC);

        int crcAt = dst.position();
        dst.appendInt32(0); // filled in last

        short attributes = batch.getAttributes();
        int attributesAt = dst.position();
        dst.appendInt16(attributes);

        dst.appendInt32(records.size() - 1); // last offset delta
        dst.appendInt64(batch.getFirstTimestamp());
        NumberedRecord last = records.get(records.size() - 1);
        dst.appendInt64(batch.getFirstTimestamp() + last.timestampDelta());

        dst.appendInt64(-1L); // producer id
        dst.appendInt16((short) -1); // producer epoch
        dst.appendInt32(-1); // base sequence

        dst.appendArrayLen(records.size());
        int recordsAt = dst.position();
        for (NumberedRecord record : records) {
            record.appendTo(dst);
        }

        if (compressor != null) {
            Compressor zipper = compressor.acquire();
            try {
                int uncompressedLen = dst.position() - recordsAt;
                byte[] compressed = zipper.compress(dst.array(), recordsAt, uncompressedLen);
                if (compressed != null && compressed.length < uncompressedLen) {
                    dst.truncate(recordsAt);
                    dst.appendBytes(compressed);

                    int savings = uncompressedLen - compressed.length;
                    dst.patchInt32(nullableBytesLenAt, nullableBytesLen - savings);
                    dst.patchInt32(batchLenAt, batchLen - savings);
                    dst.patchInt16(attributesAt, (short) (attributes | compressor.getCodec().getAttributes()));
                } else if (compressed != null) {
                    Logger.debug("{} output for {} was {} bytes, not smaller than {}; sending uncompressed",
                            compressor.getCodec().getName(), batch.getTopicPartition(), compressed.length, uncompressedLen);
                }
            } finally {
                compressor.release(zipper);
            }
        }

        int crcFrom = crcAt + 4;
        long crc = Checksums.crc32c(dst.array(), crcFrom, dst.position() - crcFrom);
        dst.patchInt32(crcAt, (int) crc);
    }

    public byte[] encode(RecordBatch batch, CompressorPool compressor) {
        WireBuffer dst = new WireBuffer(batch.getWireLength());
        appendTo(dst, batch, compressor);
        return dst.toByteArray();
    }
}
