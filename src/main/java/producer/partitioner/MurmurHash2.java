package producer.partitioner;

import java.nio.charset.StandardCharsets;

/**
 * 32-bit MurmurHash2 exactly as Kafka's Java client computes it, so keyed records land on the
 * same partitions as records produced by that client.
 */
public final class MurmurHash2 {
    private static final int SEED = 0x9747b28c;
    private static final int M = 0x5bd1e995;
    private static final int R = 24;

    private MurmurHash2() {
        throw new AssertionError("Cannot be instantiated.");
    }

    public static int hash(String data) {
        if (data == null) {
            return 0;
        }
        return hash(data.getBytes(StandardCharsets.UTF_8));
    }

    public static int hash(byte[] data) {
        int length = data.length;
        int h = SEED ^ length;
        int len4 = length >> 2;

        // Body: 4-byte blocks, assembled little-endian
        for (int i = 0; i < len4; i++) {
            int i4 = i << 2;
            int k = (data[i4] & 0xff)
                    | ((data[i4 + 1] & 0xff) << 8)
                    | ((data[i4 + 2] & 0xff) << 16)
                    | ((data[i4 + 3] & 0xff) << 24);
            k *= M;
            k ^= k >>> R;
            k *= M;
            h *= M;
            h ^= k;
        }

        // Tail: the last 1-3 bytes
        int tail = len4 << 2;
        switch (length - tail) {
            case 3:
                h ^= (data[tail + 2] & 0xff) << 16;
            case 2:
                h ^= (data[tail + 1] & 0xff) << 8;
            case 1:
                h ^= data[tail] & 0xff;
                h *= M;
        }

        h ^= h >>> 13;
        h *= M;
        h ^= h >>> 15;
        return h;
    }
}
