package producer;

import commons.compression.CompressionCodec;
import commons.compression.CompressionType;
import commons.compression.CompressorPool;
import commons.utils.Checksums;
import commons.utils.WireBuffer;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class RecordBatchEncoderTest {
    private static final int CRC_AT = 21;
    private static final int ATTRIBUTES_AT = 25;

    private final RecordBatchEncoder encoder = new RecordBatchEncoder();

    private static RecordBatch sealedBatch(ProducerRecord... records) {
        RecordBatch batch = new RecordBatch("events", 0);
        long now = 1_000L;
        for (ProducerRecord record : records) {
            assertTrue(batch.tryAppend(record, now));
            now += 10;
        }
        batch.seal();
        return batch;
    }

    private static RecordBatch compressibleBatch() {
        ProducerRecord[] records = new ProducerRecord[50];
        for (int i = 0; i < records.length; i++) {
            records[i] = ProducerRecord.of("events", "user-" + (i % 5), "{\"action\":\"click\",\"page\":\"/home\",\"n\":" + i + "}");
        }
        return sealedBatch(records);
    }

    private static RecordBatch randomBatch() {
        Random random = new Random(42);
        ProducerRecord[] records = new ProducerRecord[10];
        for (int i = 0; i < records.length; i++) {
            byte[] value = new byte[100];
            random.nextBytes(value);
            records[i] = new ProducerRecord("events", value);
        }
        return sealedBatch(records);
    }

    private static void assertConsistent(byte[] encoded, int recordCount) {
        ByteBuffer buf = ByteBuffer.wrap(encoded);
        int length = buf.getInt(0);
        int batchLength = buf.getInt(12);

        assertEquals(encoded.length - 4, length);
        assertEquals(batchLength + 12, length);
        assertEquals(recordCount, buf.getInt(RecordBatch.RECORD_BATCH_OVERHEAD - 4));

        long storedCrc = buf.getInt(CRC_AT) & 0xffffffffL;
        int crcFrom = CRC_AT + 4;
        assertEquals(Checksums.crc32c(encoded, crcFrom, encoded.length - crcFrom), storedCrc);
    }

    @Test
    public void testSingleRecordLayout() {
        RecordBatch batch = sealedBatch(ProducerRecord.of("events", "a", "b"));
        byte[] encoded = encoder.encode(batch, null);
        ByteBuffer buf = ByteBuffer.wrap(encoded);

        assertEquals(RecordBatch.RECORD_BATCH_OVERHEAD + 9, encoded.length);
        assertEquals(70, buf.getInt());        // length
        assertEquals(0L, buf.getLong());       // base offset
        assertEquals(58, buf.getInt());        // batch length
        assertEquals(-1, buf.getInt());        // leader epoch
        assertEquals(2, buf.get());            // magic
        buf.getInt();                          // crc
        assertEquals(0, buf.getShort());       // attributes
        assertEquals(0, buf.getInt());         // last offset delta
        assertEquals(1_000L, buf.getLong());   // first timestamp
        assertEquals(1_000L, buf.getLong());   // max timestamp
        assertEquals(-1L, buf.getLong());      // producer id
        assertEquals(-1, buf.getShort());      // producer epoch
        assertEquals(-1, buf.getInt());        // base sequence
        assertEquals(1, buf.getInt());         // record count

        byte[] record = Arrays.copyOfRange(encoded, buf.position(), encoded.length);
        assertArrayEquals(new byte[]{0x10, 0x00, 0x00, 0x00, 0x02, 0x61, 0x02, 0x62, 0x00}, record);
        assertConsistent(encoded, 1);
    }

    @Test
    public void testLastOffsetDeltaAndMaxTimestamp() {
        RecordBatch batch = sealedBatch(ProducerRecord.of("events", "a", "1"),
                ProducerRecord.of("events", "b", "2"), ProducerRecord.of("events", "c", "3"));
        byte[] encoded = encoder.encode(batch, null);
        ByteBuffer buf = ByteBuffer.wrap(encoded);

        assertEquals(2, buf.getInt(27));
        assertEquals(1_000L, buf.getLong(31));
        assertEquals(1_020L, buf.getLong(39));
        assertEquals(batch.getWireLength(), encoded.length);
        assertConsistent(encoded, 3);
    }

    @Test
    public void testCompressedBatchIsConsistent() throws IOException {
        for (CompressionType type : new CompressionType[]{CompressionType.GZIP, CompressionType.SNAPPY,
                CompressionType.LZ4, CompressionType.ZSTD}) {
            RecordBatch batch = compressibleBatch();
            byte[] plain = encoder.encode(batch, null);
            byte[] compressed = encoder.encode(batch, new CompressorPool(type));

            assertTrue(compressed.length < plain.length, type.getName() + " should shrink the batch");
            assertEquals(type.getAttributes(), ByteBuffer.wrap(compressed).getShort(ATTRIBUTES_AT));
            assertConsistent(compressed, 50);

            // the header up to the crc is untouched apart from the two lengths
            assertArrayEquals(Arrays.copyOfRange(plain, 16, CRC_AT), Arrays.copyOfRange(compressed, 16, CRC_AT));

            byte[] records = type.decompress(Arrays.copyOfRange(compressed, RecordBatch.RECORD_BATCH_OVERHEAD, compressed.length));
            assertArrayEquals(Arrays.copyOfRange(plain, RecordBatch.RECORD_BATCH_OVERHEAD, plain.length), records);
        }
    }

    @Test
    public void testCompressionNeverGrowsBatch() {
        for (CompressionType type : CompressionType.values()) {
            if (type == CompressionType.NONE) continue;

            RecordBatch batch = randomBatch();
            byte[] plain = encoder.encode(batch, null);
            byte[] encoded = encoder.encode(batch, new CompressorPool(type));

            assertTrue(encoded.length <= plain.length, type.getName() + " grew the batch");
            assertEquals(0, ByteBuffer.wrap(encoded).getShort(ATTRIBUTES_AT));
            assertArrayEquals(plain, encoded);
        }
    }

    @Test
    public void testCompressorReturnedToPool() {
        CompressorPool pool = new CompressorPool(CompressionType.GZIP);

        encoder.encode(compressibleBatch(), pool);
        encoder.encode(randomBatch(), pool);

        assertEquals(1, pool.created());
        assertEquals(1, pool.available());
    }

    @Test
    public void testFailingCodecFallsBackToUncompressed() {
        CompressorPool pool = new CompressorPool(new BrokenCodec());
        RecordBatch batch = compressibleBatch();

        byte[] encoded = encoder.encode(batch, pool);

        assertArrayEquals(encoder.encode(batch, null), encoded);
        assertEquals(1, pool.available());
    }

    @Test
    public void testEmptyBatchRejected() {
        RecordBatch batch = new RecordBatch("events", 0);
        batch.seal();
        assertThrows(IllegalArgumentException.class, () -> encoder.encode(batch, null));
    }

    @Test
    public void testUnsealedBatchRejected() {
        RecordBatch batch = new RecordBatch("events", 0);
        batch.tryAppend(ProducerRecord.of("events", "a", "b"));
        assertThrows(IllegalStateException.class, () -> encoder.encode(batch, null));
    }

    @Test
    public void testAppendsAfterExistingBytes() {
        RecordBatch batch = sealedBatch(ProducerRecord.of("events", "k", "v".repeat(200)));
        WireBuffer dst = new WireBuffer();
        dst.appendInt32(0xdeadbeef);

        encoder.appendTo(dst, batch, new CompressorPool(CompressionType.GZIP));

        byte[] written = dst.toByteArray();
        assertEquals(0xdeadbeef, ByteBuffer.wrap(written).getInt());
        assertConsistent(Arrays.copyOfRange(written, 4, written.length), 1);
        assertEquals(CompressionType.GZIP.getAttributes(), ByteBuffer.wrap(written).getShort(4 + ATTRIBUTES_AT));
    }

    private static class BrokenCodec implements CompressionCodec {
        @Override
        public String getName() {
            return "broken";
        }

        @Override
        public short getAttributes() {
            return 1;
        }

        @Override
        public short getMinProduceVersion() {
            return 0;
        }

        @Override
        public OutputStream wrap(OutputStream out) throws IOException {
            throw new IOException("no codec available");
        }

        @Override
        public InputStream unwrap(InputStream in) {
            return in;
        }
    }

    @Test
    public void testKeyAndValueBytesSurviveEncoding() {
        RecordBatch batch = sealedBatch(ProducerRecord.of("events", "ключ", "значение"));
        byte[] encoded = encoder.encode(batch, null);
        String tail = new String(encoded, RecordBatch.RECORD_BATCH_OVERHEAD, encoded.length - RecordBatch.RECORD_BATCH_OVERHEAD,
                StandardCharsets.UTF_8);
        assertTrue(tail.contains("ключ"));
        assertTrue(tail.contains("значение"));
    }
}
