package producer;

import java.util.Objects;

/**
 * A topic and partition pair identifying where a batch is headed.
 */
public record TopicPartition(String topic, int partition) {

    public TopicPartition {
        Objects.requireNonNull(topic, "topic cannot be null");
    }

    @Override
    public String toString() {
        return topic + "-" + partition;
    }
}
