package consumer.direct;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableMap;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * What to consume without a group: whole topics at a starting offset, individual partitions
 * pinned to their own offsets, or both.
 *
 * Pinned partitions take precedence over the offset of their topic. In regex mode every
 * configured topic is a pattern, tried in the order it was configured.
 */
public class DirectConsumeConfig {
    private final ImmutableMap<String, Offset> topics;
    private final ImmutableMap<String, ImmutableMap<Integer, Offset>> partitions;
    private final boolean regexTopics;

    private DirectConsumeConfig(Builder builder) {
        this.topics = ImmutableMap.copyOf(builder.topics);
        ImmutableMap.Builder<String, ImmutableMap<Integer, Offset>> pins = ImmutableMap.builder();
        for (Map.Entry<String, Map<Integer, Offset>> entry : builder.partitions.entrySet()) {
            pins.put(entry.getKey(), ImmutableMap.copyOf(entry.getValue()));
        }
        this.partitions = pins.build();
        this.regexTopics = builder.regexTopics;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads {@code consume.topics} (comma-separated), {@code consume.offset} ({@code earliest},
     * {@code latest} or an exact offset, default {@code earliest}) and {@code consume.regex}
     * ({@code true} to treat the topics as patterns).
     */
    public static DirectConsumeConfig fromProperties(Properties props) {
        Builder builder = builder();
        String topicList = props.getProperty("consume.topics", "");
        Offset offset = Offset.parse(props.getProperty("consume.offset", "earliest"));
        String[] topics = Splitter.on(',').trimResults().omitEmptyStrings()
                .splitToList(topicList).toArray(new String[0]);
        if (topics.length > 0) {
            builder.consumeTopics(offset, topics);
        }
        if (Boolean.parseBoolean(props.getProperty("consume.regex", "false").trim())) {
            builder.consumeTopicsRegex();
        }
        return builder.build();
    }

    /**
     * Topic (or pattern, in regex mode) to starting offset, in configured order.
     */
    public Map<String, Offset> getTopics() {
        return topics;
    }

    public Map<String, ImmutableMap<Integer, Offset>> getPartitions() {
        return partitions;
    }

    public boolean isRegexTopics() {
        return regexTopics;
    }

    /**
     * True when neither topics nor partitions were configured; nothing will be consumed.
     */
    public boolean isEmpty() {
        return topics.isEmpty() && partitions.isEmpty();
    }

    @Override
    public String toString() {
        return "DirectConsumeConfig{topics=" + topics + ", partitions=" + partitions + ", regexTopics=" + regexTopics + "}";
    }

    public static class Builder {
        private final Map<String, Offset> topics = new LinkedHashMap<>();
        private final Map<String, Map<Integer, Offset>> partitions = new LinkedHashMap<>();
        private boolean regexTopics;

        private Builder() {
        }

        /**
         * Consume every partition of {@code topics}, including ones added later, from {@code offset}.
         * Replaces topics set by an earlier call.
         */
        public Builder consumeTopics(Offset offset, String... topics) {
            if (offset == null) {
                throw new IllegalArgumentException("Offset cannot be null");
            }
            this.topics.clear();
            for (String topic : topics) {
                if (topic == null || topic.isEmpty()) {
                    throw new IllegalArgumentException("Topic cannot be null or empty");
                }
                this.topics.put(topic, offset);
            }
            return this;
        }

        /**
         * Consume exactly these partitions from these offsets. Replaces partitions set by an
         * earlier call.
         */
        public Builder consumePartitions(Map<String, ? extends Map<Integer, Offset>> partitions) {
            for (Map.Entry<String, ? extends Map<Integer, Offset>> entry : partitions.entrySet()) {
                if (entry.getKey() == null || entry.getKey().isEmpty()) {
                    throw new IllegalArgumentException("Topic cannot be null or empty");
                }
                if (entry.getValue() == null) {
                    throw new IllegalArgumentException("Partitions of topic " + entry.getKey() + " cannot be null");
                }
                for (Map.Entry<Integer, Offset> pin : entry.getValue().entrySet()) {
                    if (pin.getKey() == null || pin.getValue() == null) {
                        throw new IllegalArgumentException(
                                "Partition and offset cannot be null, got " + pin.getKey() + "=" + pin.getValue()
                                        + " for topic " + entry.getKey());
                    }
                }
            }
            this.partitions.clear();
            for (Map.Entry<String, ? extends Map<Integer, Offset>> entry : partitions.entrySet()) {
                this.partitions.put(entry.getKey(), new LinkedHashMap<>(entry.getValue()));
            }
            return this;
        }

        /**
         * Treat every topic given to {@link #consumeTopics} as a regular expression.
         */
        public Builder consumeTopicsRegex() {
            this.regexTopics = true;
            return this;
        }

        public DirectConsumeConfig build() {
            if (regexTopics) {
                for (String pattern : topics.keySet()) {
                    try {
                        Pattern.compile(pattern);
                    } catch (PatternSyntaxException e) {
                        throw new IllegalArgumentException("Invalid topic pattern: " + pattern, e);
                    }
                }
            }
            return new DirectConsumeConfig(this);
        }
    }
}
