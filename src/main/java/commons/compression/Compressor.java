package commons.compression;

import org.tinylog.Logger;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * A reusable compression worker bound to one codec. The scratch output buffer survives between
 * calls so repeated batches do not reallocate it.
 *
 * Instances are not thread-safe; share them through a {@link CompressorPool}.
 */
public class Compressor {
    private static final int INITIAL_SCRATCH_SIZE = 16 * 1024;

    private final CompressionCodec codec;
    private final ByteArrayOutputStream scratch;

    public Compressor(CompressionCodec codec) {
        this.codec = codec;
        this.scratch = new ByteArrayOutputStream(INITIAL_SCRATCH_SIZE);
    }

    public CompressionCodec getCodec() {
        return codec;
    }

    /**
     * Compresses {@code length} bytes of {@code src} starting at {@code offset}.
     *
     * @return the compressed bytes, or null if the codec failed
     */
    public byte[] compress(byte[] src, int offset, int length) {
        scratch.reset();
        try (OutputStream out = codec.wrap(scratch)) {
            out.write(src, offset, length);
        } catch (IOException | RuntimeException e) {
            Logger.warn("Compression with {} failed, leaving {} bytes uncompressed: {}",
                    codec.getName(), length, e.getMessage());
            return null;
        }
        return scratch.toByteArray();
    }

    public byte[] decompress(byte[] src, int offset, int length) throws IOException {
        try (InputStream in = codec.unwrap(new ByteArrayInputStream(src, offset, length))) {
            return in.readAllBytes();
        }
    }
}
