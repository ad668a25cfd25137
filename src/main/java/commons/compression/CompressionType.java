package commons.compression;

import com.github.luben.zstd.ZstdInputStream;
import com.github.luben.zstd.ZstdOutputStream;
import net.jpountz.lz4.LZ4FrameInputStream;
import net.jpountz.lz4.LZ4FrameOutputStream;
import org.xerial.snappy.SnappyInputStream;
import org.xerial.snappy.SnappyOutputStream;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * The codecs a broker understands, identified by the id carried in the low bits of a record
 * batch's attributes word. Framing follows what brokers expect for magic v2 batches.
 */
public enum CompressionType implements CompressionCodec {
    NONE(0, "none", 0) {
        @Override
        public OutputStream wrap(OutputStream out) {
            return out;
        }

        @Override
        public InputStream unwrap(InputStream in) {
            return in;
        }
    },

    GZIP(1, "gzip", 0) {
        @Override
        public OutputStream wrap(OutputStream out) throws IOException {
            return new GZIPOutputStream(out, 8 * 1024);
        }

        @Override
        public InputStream unwrap(InputStream in) throws IOException {
            return new GZIPInputStream(in, 8 * 1024);
        }
    },

    SNAPPY(2, "snappy", 0) {
        @Override
        public OutputStream wrap(OutputStream out) {
            return new SnappyOutputStream(out);
        }

        @Override
        public InputStream unwrap(InputStream in) throws IOException {
            return new SnappyInputStream(in);
        }
    },

    LZ4(3, "lz4", 0) {
        @Override
        public OutputStream wrap(OutputStream out) throws IOException {
            // 64 KB independent blocks, the same frame layout the Java client writes
            return new LZ4FrameOutputStream(out, LZ4FrameOutputStream.BLOCKSIZE.SIZE_64KB);
        }

        @Override
        public InputStream unwrap(InputStream in) throws IOException {
            return new LZ4FrameInputStream(in);
        }
    },

    // Brokers only accept zstd from produce v7 (Kafka 2.1.0) onwards.
    ZSTD(4, "zstd", 7) {
        @Override
        public OutputStream wrap(OutputStream out) throws IOException {
            return new ZstdOutputStream(out);
        }

        @Override
        public InputStream unwrap(InputStream in) throws IOException {
            return new ZstdInputStream(in);
        }
    };

    private final int id;
    private final String name;
    private final short minProduceVersion;

    CompressionType(int id, String name, int minProduceVersion) {
        this.id = id;
        this.name = name;
        this.minProduceVersion = (short) minProduceVersion;
    }

    public int getId() {
        return id;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public short getAttributes() {
        return (short) id;
    }

    @Override
    public short getMinProduceVersion() {
        return minProduceVersion;
    }

    /**
     * Compresses a whole array. Null and empty input are returned as-is.
     */
    public byte[] compress(byte[] data) throws IOException {
        if (data == null || data.length == 0 || this == NONE) {
            return data;
        }
        ByteArrayOutputStream baos = new ByteArrayOutputStream(Math.max(32, data.length / 2));
        try (OutputStream out = wrap(baos)) {
            out.write(data);
        }
        return baos.toByteArray();
    }

    /**
     * Decompresses a whole array. Null and empty input are returned as-is.
     */
    public byte[] decompress(byte[] data) throws IOException {
        if (data == null || data.length == 0 || this == NONE) {
            return data;
        }
        try (InputStream in = unwrap(new ByteArrayInputStream(data))) {
            return in.readAllBytes();
        }
    }

    public static CompressionType fromId(int id) {
        for (CompressionType type : values()) {
            if (type.id == id) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown compression type id: " + id);
    }

    /**
     * Case-insensitive lookup by name; null maps to {@link #NONE}.
     */
    public static CompressionType fromName(String name) {
        if (name == null) {
            return NONE;
        }
        for (CompressionType type : values()) {
            if (type.name.equalsIgnoreCase(name.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException(
                "Unknown compression type: " + name + ". Supported types: none, gzip, snappy, lz4, zstd");
    }

    @Override
    public String toString() {
        return name;
    }
}
