package producer.partitioner;

/**
 * Creates the per-topic partitioners that route records to partitions.
 *
 * {@link #forTopic(String)} is called once per topic, and the returned partitioner lives as long
 * as the topic does.
 */
@FunctionalInterface
public interface Partitioner {

    TopicPartitioner forTopic(String topic);
}
