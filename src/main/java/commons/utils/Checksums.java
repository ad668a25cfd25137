package commons.utils;

import java.util.zip.CRC32C;

/**
 * CRC-32C (Castagnoli) checksums as used by record batches since magic v2.
 */
public final class Checksums {

    private Checksums() {
        throw new AssertionError("Cannot be instantiated.");
    }

    /**
     * Checksum over {@code length} bytes of {@code bytes} starting at {@code offset}, as an unsigned value.
     */
    public static long crc32c(byte[] bytes, int offset, int length) {
        CRC32C crc = new CRC32C();
        crc.update(bytes, offset, length);
        return crc.getValue();
    }
}
