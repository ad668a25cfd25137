package commons.utils;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Sizing and reading helpers for the variable-length integer encoding used by record batches.
 *
 * Varints are zig-zag encoded and written 7 bits at a time, least significant group first,
 * with the high bit of each byte marking a continuation. This matches Kafka's protobuf-style varints.
 */
public final class ByteUtils {

    private ByteUtils() {
        throw new AssertionError("Cannot be instantiated.");
    }

    public static int zigZag(int value) {
        return (value << 1) ^ (value >> 31);
    }

    public static long zigZag(long value) {
        return (value << 1) ^ (value >> 63);
    }

    /**
     * Number of bytes {@code value} takes when written as a zig-zag varint.
     */
    public static int sizeOfVarint(int value) {
        int v = zigZag(value);
        int bytes = 1;
        while ((v & 0xffffff80) != 0) {
            bytes++;
            v >>>= 7;
        }
        return bytes;
    }

    /**
     * Number of bytes {@code value} takes when written as a zig-zag varlong.
     */
    public static int sizeOfVarlong(long value) {
        long v = zigZag(value);
        int bytes = 1;
        while ((v & 0xffffffffffffff80L) != 0L) {
            bytes++;
            v >>>= 7;
        }
        return bytes;
    }

    /**
     * Size of a varint length prefix plus the bytes it prefixes. A null array is written as length -1.
     */
    public static int sizeOfVarintBytes(byte[] bytes) {
        if (bytes == null) {
            return sizeOfVarint(-1);
        }
        return sizeOfVarint(bytes.length) + bytes.length;
    }

    public static int sizeOfVarintString(String s) {
        if (s == null) {
            return sizeOfVarint(-1);
        }
        return sizeOfVarintBytes(s.getBytes(StandardCharsets.UTF_8));
    }

    public static int readVarint(ByteBuffer buffer) {
        int raw = 0;
        int shift = 0;
        byte b;
        do {
            if (shift > 28) {
                throw new IllegalArgumentException("Varint is too long, most significant bit in the 5th byte is set");
            }
            b = buffer.get();
            raw |= (b & 0x7f) << shift;
            shift += 7;
        } while ((b & 0x80) != 0);
        return (raw >>> 1) ^ -(raw & 1);
    }

    public static long readVarlong(ByteBuffer buffer) {
        long raw = 0L;
        int shift = 0;
        byte b;
        do {
            if (shift > 63) {
                throw new IllegalArgumentException("Varlong is too long, most significant bit in the 10th byte is set");
            }
            b = buffer.get();
            raw |= (long) (b & 0x7f) << shift;
            shift += 7;
        } while ((b & 0x80) != 0);
        return (raw >>> 1) ^ -(raw & 1);
    }

    /**
     * Reads a varint length-prefixed byte array, returning null for a negative length.
     */
    public static byte[] readVarintBytes(ByteBuffer buffer) {
        int length = readVarint(buffer);
        if (length < 0) {
            return null;
        }
        byte[] bytes = new byte[length];
        buffer.get(bytes);
        return bytes;
    }
}
