package producer;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import commons.compression.CompressionNegotiator;
import commons.compression.CompressionType;
import org.tinylog.Logger;
import producer.partitioner.MurmurHash2;
import producer.partitioner.Partitioner;
import producer.partitioner.PartitionerHasher;
import producer.partitioner.Partitioners;

import java.util.List;
import java.util.Properties;

/**
 * Configuration for batching, encoding and partitioning produced records.
 * Provides defaults for every setting.
 */
public class ProducerConfig {
    private final List<CompressionType> compressionPreference;
    private final String partitionerName;
    private final RequiredAcks acks;
    private final int requestTimeoutMs;
    private final int maxRecordBatchBytes;
    private final int maxBrokerWriteBytes;

    // Default values
    private static final List<CompressionType> DEFAULT_COMPRESSION_PREFERENCE = ImmutableList.of(CompressionType.NONE);
    private static final String DEFAULT_PARTITIONER = "sticky-key";
    private static final RequiredAcks DEFAULT_ACKS = RequiredAcks.LEADER;
    private static final int DEFAULT_REQUEST_TIMEOUT_MS = 30000; // 30 seconds
    private static final int DEFAULT_MAX_RECORD_BATCH_BYTES = 1_000_000;
    static final int DEFAULT_MAX_BROKER_WRITE_BYTES = 100 << 20; // 100MiB

    private static final int MIN_WRITE_BYTES = 1 << 10; // 1KiB
    private static final int MAX_BROKER_WRITE_BYTES = 1 << 30; // 1GiB

    private static final List<String> PARTITIONERS = ImmutableList.of(
            "manual", "round-robin", "sticky", "sticky-key", "sticky-key-sarama", "least-backup");

    /**
     * Create ProducerConfig with default values
     */
    public ProducerConfig() {
        this.compressionPreference = DEFAULT_COMPRESSION_PREFERENCE;
        this.partitionerName = DEFAULT_PARTITIONER;
        this.acks = DEFAULT_ACKS;
        this.requestTimeoutMs = DEFAULT_REQUEST_TIMEOUT_MS;
        this.maxRecordBatchBytes = DEFAULT_MAX_RECORD_BATCH_BYTES;
        this.maxBrokerWriteBytes = DEFAULT_MAX_BROKER_WRITE_BYTES;
    }

    /**
     * Create ProducerConfig from Properties
     * @param props Configuration properties
     */
    public ProducerConfig(Properties props) {
        this.compressionPreference = parseCompression(props.getProperty("compression.type"));

        this.partitionerName = validatePartitioner(props.getProperty("partitioner", DEFAULT_PARTITIONER));

        this.acks = RequiredAcks.fromConfig(props.getProperty("acks", "1"));
        this.requestTimeoutMs = Integer.parseInt(
                props.getProperty("request.timeout.ms", String.valueOf(DEFAULT_REQUEST_TIMEOUT_MS)).trim()
        );
        validateRequestTimeout(requestTimeoutMs);
        this.maxRecordBatchBytes = Integer.parseInt(
                props.getProperty("max.record.batch.bytes", String.valueOf(DEFAULT_MAX_RECORD_BATCH_BYTES)).trim()
        );
        this.maxBrokerWriteBytes = Integer.parseInt(
                props.getProperty("max.broker.write.bytes", String.valueOf(DEFAULT_MAX_BROKER_WRITE_BYTES)).trim()
        );
        validateWriteSizes(maxRecordBatchBytes, maxBrokerWriteBytes);
    }

    public ProducerConfig(List<CompressionType> compressionPreference, String partitionerName, RequiredAcks acks,
                          int requestTimeoutMs, int maxRecordBatchBytes, int maxBrokerWriteBytes) {
        validateRequestTimeout(requestTimeoutMs);
        validateWriteSizes(maxRecordBatchBytes, maxBrokerWriteBytes);
        this.compressionPreference = compressionPreference == null || compressionPreference.isEmpty()
                ? DEFAULT_COMPRESSION_PREFERENCE
                : ImmutableList.copyOf(compressionPreference);
        this.partitionerName = validatePartitioner(partitionerName != null ? partitionerName : DEFAULT_PARTITIONER);
        this.acks = acks != null ? acks : DEFAULT_ACKS;
        this.requestTimeoutMs = requestTimeoutMs;
        this.maxRecordBatchBytes = maxRecordBatchBytes;
        this.maxBrokerWriteBytes = maxBrokerWriteBytes;
    }

    public List<CompressionType> getCompressionPreference() {
        return compressionPreference;
    }

    public String getPartitionerName() {
        return partitionerName;
    }

    public RequiredAcks getAcks() {
        return acks;
    }

    public int getRequestTimeoutMs() {
        return requestTimeoutMs;
    }

    public int getMaxRecordBatchBytes() {
        return maxRecordBatchBytes;
    }

    public int getMaxBrokerWriteBytes() {
        return maxBrokerWriteBytes;
    }

    /**
     * A new partitioner for the configured strategy. Each call returns independent state.
     */
    public Partitioner createPartitioner() {
        switch (partitionerName) {
            case "manual":
                return Partitioners.manual();
            case "round-robin":
                return Partitioners.roundRobin();
            case "sticky":
                return Partitioners.sticky();
            case "sticky-key-sarama":
                return Partitioners.stickyKey(PartitionerHasher.sarama(MurmurHash2::hash));
            case "least-backup":
                return Partitioners.leastBackup();
            default:
                return Partitioners.stickyKey(null);
        }
    }

    public CompressionNegotiator createCompressionNegotiator() {
        return new CompressionNegotiator(compressionPreference);
    }

    /**
     * An empty batch for {@code topic}-{@code partition} holding at most max record batch bytes.
     */
    public RecordBatch newBatch(String topic, int partition) {
        return new RecordBatch(topic, partition, maxRecordBatchBytes);
    }

    private static List<CompressionType> parseCompression(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT_COMPRESSION_PREFERENCE;
        }
        ImmutableList.Builder<CompressionType> preference = ImmutableList.builder();
        for (String name : Splitter.on(',').trimResults().omitEmptyStrings().split(value)) {
            try {
                preference.add(CompressionType.fromName(name));
            } catch (IllegalArgumentException e) {
                Logger.warn("Ignoring unknown compression type '{}' in compression.type", name);
            }
        }
        List<CompressionType> parsed = preference.build();
        return parsed.isEmpty() ? DEFAULT_COMPRESSION_PREFERENCE : parsed;
    }

    private static String validatePartitioner(String name) {
        String partitioner = name.trim().toLowerCase();
        if (!PARTITIONERS.contains(partitioner)) {
            throw new IllegalArgumentException(
                    "Unknown partitioner: " + partitioner + ". Supported partitioners: " + String.join(", ", PARTITIONERS));
        }
        return partitioner;
    }

    private static void validateRequestTimeout(int requestTimeoutMs) {
        if (requestTimeoutMs <= 0) {
            throw new IllegalArgumentException("Request timeout must be positive, got " + requestTimeoutMs + " ms.");
        }
    }

    private void validateWriteSizes(int maxRecordBatchBytes, int maxBrokerWriteBytes) {
        if (maxRecordBatchBytes < MIN_WRITE_BYTES) {
            throw new IllegalArgumentException(
                    "Max record batch bytes must be at least " + MIN_WRITE_BYTES + " bytes, got " + maxRecordBatchBytes + ".");
        }
        if (maxBrokerWriteBytes < MIN_WRITE_BYTES) {
            throw new IllegalArgumentException(
                    "Max broker write bytes must be at least " + MIN_WRITE_BYTES + " bytes, got " + maxBrokerWriteBytes + ".");
        }
        if (maxBrokerWriteBytes < maxRecordBatchBytes) {
            throw new IllegalArgumentException(
                    "Max broker write bytes (" + maxBrokerWriteBytes + ") must be at least max record batch bytes ("
                            + maxRecordBatchBytes + ").");
        }
        if (maxBrokerWriteBytes > MAX_BROKER_WRITE_BYTES) {
            throw new IllegalArgumentException(
                    "Max broker write bytes must be at most " + MAX_BROKER_WRITE_BYTES + " bytes, got " + maxBrokerWriteBytes + ".");
        }
    }
}
