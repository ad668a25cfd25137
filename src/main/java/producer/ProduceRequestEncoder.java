package producer;

import com.google.common.base.Preconditions;
import commons.compression.CompressionNegotiator;
import commons.compression.CompressorPool;
import commons.utils.WireBuffer;
import exceptions.RequestTooLargeException;

import java.util.Map;

/**
 * Encodes the body of a produce request (versions 3 through 7) around already-built batches.
 *
 * <pre>
 *   transactionalId   nullable string   always null, this client is not transactional
 *   acks              int16
 *   timeoutMs         int32
 *   topics            [topic string, [partition int32, records nullable bytes]]
 * </pre>
 *
 * The codec is negotiated once per request from the request version, so every batch in a request
 * shares the same compression choice. A body larger than the max broker write size is rejected, as
 * the broker would refuse to read it.
 */
public class ProduceRequestEncoder {
    public static final short MIN_VERSION = 3;
    public static final short MAX_VERSION = 7;

    private final RequiredAcks acks;
    private final int timeoutMs;
    private final CompressionNegotiator negotiator;
    private final RecordBatchEncoder batchEncoder;
    private final int maxBrokerWriteBytes;

    public ProduceRequestEncoder(RequiredAcks acks, int timeoutMs, CompressionNegotiator negotiator) {
        this(acks, timeoutMs, negotiator, new RecordBatchEncoder(), ProducerConfig.DEFAULT_MAX_BROKER_WRITE_BYTES);
    }

    public ProduceRequestEncoder(RequiredAcks acks, int timeoutMs, CompressionNegotiator negotiator,
                                 RecordBatchEncoder batchEncoder, int maxBrokerWriteBytes) {
        Preconditions.checkArgument(maxBrokerWriteBytes > 0, "Max broker write bytes must be positive, got %s", maxBrokerWriteBytes);
        this.acks = acks;
        this.timeoutMs = timeoutMs;
        this.negotiator = negotiator;
        this.batchEncoder = batchEncoder;
        this.maxBrokerWriteBytes = maxBrokerWriteBytes;
    }

    public static ProduceRequestEncoder fromConfig(ProducerConfig config) {
        return new ProduceRequestEncoder(config.getAcks(), config.getRequestTimeoutMs(), config.createCompressionNegotiator(),
                new RecordBatchEncoder(), config.getMaxBrokerWriteBytes());
    }

    /**
     * Appends the request body for {@code batches} (topic, then partition, to sealed batch).
     * On failure {@code dst} is left as it was.
     *
     * @throws RequestTooLargeException if the body exceeds the max broker write size
     */
    public void appendTo(WireBuffer dst, short version, Map<String, Map<Integer, RecordBatch>> batches) {
        Preconditions.checkArgument(version >= MIN_VERSION && version <= MAX_VERSION,
                "Produce request version %s is outside supported range [%s, %s]", version, MIN_VERSION, MAX_VERSION);

        CompressorPool compressor = negotiator.compressorFor(version);

        int start = dst.position();
        dst.appendNullableString(null);
        dst.appendInt16(acks.getValue());
        dst.appendInt32(timeoutMs);
        dst.appendArrayLen(batches.size());
        for (Map.Entry<String, Map<Integer, RecordBatch>> topic : batches.entrySet()) {
            dst.appendString(topic.getKey());
            dst.appendArrayLen(topic.getValue().size());
            for (Map.Entry<Integer, RecordBatch> partition : topic.getValue().entrySet()) {
                dst.appendInt32(partition.getKey());
                batchEncoder.appendTo(dst, partition.getValue(), compressor);
            }
        }

        int written = dst.position() - start;
        if (written > maxBrokerWriteBytes) {
            dst.truncate(start);
            throw new RequestTooLargeException(written, maxBrokerWriteBytes);
        }
    }

    public byte[] encode(short version, Map<String, Map<Integer, RecordBatch>> batches) {
        WireBuffer dst = new WireBuffer();
        appendTo(dst, version, batches);
        return dst.toByteArray();
    }
}
