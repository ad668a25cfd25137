/*
A key/value pair to be produced to a topic.

The key and value are raw bytes and either may be null. They are held by reference: the producer
never copies them, so callers must not mutate the arrays until the record's batch has been sent.

The partition is only a hint that manual partitioning reads. Every other partitioner ignores it.

If no timestamp is given, the record is stamped with the wall-clock time when it is appended to a batch.
 */
package producer;

import com.google.common.collect.ImmutableList;
import commons.header.Header;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

public class ProducerRecord {
    private final String topic;
    private final Integer partition;
    private final Long timestamp;
    private final byte[] key;
    private final byte[] value;
    private final List<Header> headers;

    public ProducerRecord(String topic, Integer partition, Long timestamp, byte[] key, byte[] value, Iterable<Header> headers) {
        this.topic = Objects.requireNonNull(topic, "topic cannot be null");
        this.partition = partition;
        this.timestamp = timestamp;
        this.key = key;
        this.value = value;
        this.headers = headers == null ? ImmutableList.of() : ImmutableList.copyOf(headers);
    }

    public ProducerRecord(String topic, Integer partition, byte[] key, byte[] value) {
        this(topic, partition, null, key, value, null);
    }

    public ProducerRecord(String topic, byte[] key, byte[] value) {
        this(topic, null, null, key, value, null);
    }

    public ProducerRecord(String topic, byte[] value) {
        this(topic, null, null, null, value, null);
    }

    public static ProducerRecord of(String topic, String key, String value) {
        return new ProducerRecord(topic, utf8(key), utf8(value));
    }

    private static byte[] utf8(String s) {
        return s == null ? null : s.getBytes(StandardCharsets.UTF_8);
    }

    public String getTopic() {
        return topic;
    }

    public Integer getPartition() {
        return partition;
    }

    public Long getTimestamp() {
        return timestamp;
    }

    public byte[] getKey() {
        return key;
    }

    public byte[] getValue() {
        return value;
    }

    public List<Header> getHeaders() {
        return headers;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProducerRecord that = (ProducerRecord) o;
        return Objects.equals(topic, that.topic) &&
                Objects.equals(partition, that.partition) &&
                Objects.equals(timestamp, that.timestamp) &&
                Arrays.equals(key, that.key) &&
                Arrays.equals(value, that.value) &&
                Objects.equals(headers, that.headers);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(topic, partition, timestamp, headers);
        result = 31 * result + Arrays.hashCode(key);
        result = 31 * result + Arrays.hashCode(value);
        return result;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("Topic: ").append(topic).append("\n")
                .append("Partition: ").append(partition).append("\n")
                .append("Timestamp: ").append(timestamp).append("\n")
                .append("Key: ").append(key == null ? "null" : key.length + " bytes").append("\n")
                .append("Value: ").append(value == null ? "null" : value.length + " bytes").append("\n")
                .append("Headers: ").append(headers);
        return sb.toString();
    }
}
