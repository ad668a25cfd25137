package commons.compression;

import org.tinylog.Logger;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A free list of {@link Compressor}s for a single codec.
 *
 * Any thread may acquire a compressor; when the free list is empty a new one is created, so
 * acquiring never blocks beyond the short list lock. Released compressors are kept for reuse,
 * which bounds the pool by the peak number of concurrent encoders.
 */
public class CompressorPool {
    private final CompressionCodec codec;
    private final ReentrantLock lock;
    private final Deque<Compressor> free;
    private int created;

    public CompressorPool(CompressionCodec codec) {
        this.codec = codec;
        this.lock = new ReentrantLock();
        this.free = new ArrayDeque<>();
        this.created = 0;
        Logger.info("Created compressor pool for codec {}", codec.getName());
    }

    public CompressionCodec getCodec() {
        return codec;
    }

    /**
     * Check out a compressor. Every acquire must be paired with a {@link #release(Compressor)},
     * typically in a finally block.
     */
    public Compressor acquire() {
        lock.lock();
        try {
            Compressor compressor = free.pollFirst();
            if (compressor != null) {
                return compressor;
            }
            created++;
        } finally {
            lock.unlock();
        }
        return new Compressor(codec);
    }

    public void release(Compressor compressor) {
        if (compressor.getCodec() != codec) {
            throw new IllegalArgumentException("Compressor for codec " + compressor.getCodec().getName()
                    + " cannot be returned to the pool for " + codec.getName());
        }
        lock.lock();
        try {
            free.addFirst(compressor);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Number of idle compressors waiting in the free list.
     */
    public int available() {
        lock.lock();
        try {
            return free.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Total compressors this pool has ever created.
     */
    public int created() {
        lock.lock();
        try {
            return created;
        } finally {
            lock.unlock();
        }
    }
}
