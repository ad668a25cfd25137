package commons.utils;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * A growable, append-only big-endian output buffer for building protocol messages.
 *
 * Callers that need to rewrite a field after later bytes are known (lengths, checksums, attributes)
 * remember {@link #position()} before appending the field and overwrite it afterwards with one of the
 * {@code patch*} methods. Patching never moves or resizes the buffer.
 *
 * Not thread-safe: one buffer belongs to one encoding call.
 */
public class WireBuffer {
    private static final int DEFAULT_INITIAL_CAPACITY = 512;

    private byte[] buf;
    private int size;

    public WireBuffer() {
        this(DEFAULT_INITIAL_CAPACITY);
    }

    public WireBuffer(int initialCapacity) {
        if (initialCapacity < 0) {
            throw new IllegalArgumentException("Initial capacity must be non-negative, got " + initialCapacity);
        }
        this.buf = new byte[initialCapacity];
        this.size = 0;
    }

    /**
     * Current write offset, which is also the number of bytes written so far.
     */
    public int position() {
        return size;
    }

    public WireBuffer appendInt8(byte v) {
        ensureRemaining(1);
        buf[size++] = v;
        return this;
    }

    public WireBuffer appendInt16(short v) {
        ensureRemaining(2);
        writeInt16At(size, v);
        size += 2;
        return this;
    }

    public WireBuffer appendInt32(int v) {
        ensureRemaining(4);
        writeInt32At(size, v);
        size += 4;
        return this;
    }

    public WireBuffer appendInt64(long v) {
        ensureRemaining(8);
        buf[size] = (byte) (v >>> 56);
        buf[size + 1] = (byte) (v >>> 48);
        buf[size + 2] = (byte) (v >>> 40);
        buf[size + 3] = (byte) (v >>> 32);
        buf[size + 4] = (byte) (v >>> 24);
        buf[size + 5] = (byte) (v >>> 16);
        buf[size + 6] = (byte) (v >>> 8);
        buf[size + 7] = (byte) v;
        size += 8;
        return this;
    }

    public WireBuffer appendVarint(int v) {
        int u = ByteUtils.zigZag(v);
        ensureRemaining(5);
        while ((u & 0xffffff80) != 0) {
            buf[size++] = (byte) ((u & 0x7f) | 0x80);
            u >>>= 7;
        }
        buf[size++] = (byte) u;
        return this;
    }

    public WireBuffer appendVarlong(long v) {
        long u = ByteUtils.zigZag(v);
        ensureRemaining(10);
        while ((u & 0xffffffffffffff80L) != 0L) {
            buf[size++] = (byte) ((u & 0x7f) | 0x80);
            u >>>= 7;
        }
        buf[size++] = (byte) u;
        return this;
    }

    public WireBuffer appendBytes(byte[] src) {
        return appendBytes(src, 0, src.length);
    }

    public WireBuffer appendBytes(byte[] src, int offset, int length) {
        ensureRemaining(length);
        System.arraycopy(src, offset, buf, size, length);
        size += length;
        return this;
    }

    /**
     * Varint length prefix followed by the bytes; null is written as length -1 with no body.
     */
    public WireBuffer appendVarintBytes(byte[] bytes) {
        if (bytes == null) {
            return appendVarint(-1);
        }
        appendVarint(bytes.length);
        return appendBytes(bytes);
    }

    public WireBuffer appendVarintString(String s) {
        if (s == null) {
            return appendVarint(-1);
        }
        return appendVarintBytes(s.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Int16 length prefix followed by the UTF-8 bytes.
     */
    public WireBuffer appendString(String s) {
        byte[] bytes = s.getBytes(StandardCharsets.UTF_8);
        if (bytes.length > Short.MAX_VALUE) {
            throw new IllegalArgumentException("String of " + bytes.length + " bytes does not fit an int16 length");
        }
        appendInt16((short) bytes.length);
        return appendBytes(bytes);
    }

    public WireBuffer appendNullableString(String s) {
        if (s == null) {
            return appendInt16((short) -1);
        }
        return appendString(s);
    }

    public WireBuffer appendArrayLen(int length) {
        return appendInt32(length);
    }

    public void patchInt16(int at, short v) {
        checkPatchable(at, 2);
        writeInt16At(at, v);
    }

    public void patchInt32(int at, int v) {
        checkPatchable(at, 4);
        writeInt32At(at, v);
    }

    /**
     * Drops everything written at or after {@code newSize}.
     */
    public void truncate(int newSize) {
        if (newSize < 0 || newSize > size) {
            throw new IndexOutOfBoundsException("Cannot truncate buffer of size " + size + " to " + newSize);
        }
        size = newSize;
    }

    /**
     * The backing array. Only the first {@link #position()} bytes are meaningful, and the array
     * may be replaced by a later append.
     */
    public byte[] array() {
        return buf;
    }

    public byte[] toByteArray() {
        return Arrays.copyOf(buf, size);
    }

    /**
     * A read-only view over the written bytes, positioned at zero.
     */
    public ByteBuffer asReadOnlyByteBuffer() {
        return ByteBuffer.wrap(buf, 0, size).asReadOnlyBuffer();
    }

    private void writeInt16At(int at, short v) {
        buf[at] = (byte) (v >>> 8);
        buf[at + 1] = (byte) v;
    }

    private void writeInt32At(int at, int v) {
        buf[at] = (byte) (v >>> 24);
        buf[at + 1] = (byte) (v >>> 16);
        buf[at + 2] = (byte) (v >>> 8);
        buf[at + 3] = (byte) v;
    }

    private void checkPatchable(int at, int width) {
        if (at < 0 || at + width > size) {
            throw new IndexOutOfBoundsException(
                    "Cannot patch " + width + " bytes at offset " + at + " in buffer of size " + size);
        }
    }

    private void ensureRemaining(int needed) {
        int required = size + needed;
        if (required <= buf.length) {
            return;
        }
        int newCapacity = Math.max(buf.length * 2, required);
        buf = Arrays.copyOf(buf, newCapacity);
    }
}
