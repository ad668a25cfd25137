package commons.compression;

import com.google.common.collect.ImmutableList;
import org.tinylog.Logger;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Picks the codec for a produce request and owns the compressor pools.
 *
 * The preference list is walked in order and the first codec the negotiated produce version
 * supports wins. If none qualifies, or the winner is {@link CompressionType#NONE}, batches are
 * written uncompressed.
 *
 * Thread-safe. Pools are created lazily, once per codec, and reused across requests.
 */
public class CompressionNegotiator {
    private final List<CompressionCodec> preference;
    private final ConcurrentMap<CompressionCodec, CompressorPool> pools;

    public CompressionNegotiator(List<? extends CompressionCodec> preference) {
        this.preference = preference == null || preference.isEmpty()
                ? ImmutableList.of(CompressionType.NONE)
                : ImmutableList.copyOf(preference);
        this.pools = new ConcurrentHashMap<>();
    }

    public static CompressionNegotiator none() {
        return new CompressionNegotiator(ImmutableList.of(CompressionType.NONE));
    }

    public List<CompressionCodec> getPreference() {
        return preference;
    }

    /**
     * The codec to use for the given produce version, {@link CompressionType#NONE} if nothing fits.
     */
    public CompressionCodec select(short produceVersion) {
        for (CompressionCodec codec : preference) {
            if (codec.isSupportedBy(produceVersion)) {
                Logger.debug("Negotiated compression {} for produce v{}", codec.getName(), produceVersion);
                return codec;
            }
        }
        Logger.debug("No preferred codec supports produce v{}, writing uncompressed", produceVersion);
        return CompressionType.NONE;
    }

    /**
     * The compressor pool for the codec negotiated at {@code produceVersion}, or null when batches
     * should not be compressed.
     */
    public CompressorPool compressorFor(short produceVersion) {
        CompressionCodec codec = select(produceVersion);
        if (codec.getAttributes() == 0) {
            return null;
        }
        return pools.computeIfAbsent(codec, CompressorPool::new);
    }
}
