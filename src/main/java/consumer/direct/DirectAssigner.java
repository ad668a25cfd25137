package consumer.direct;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import metadata.snapshots.ClusterSnapshot;
import metadata.snapshots.TopicMetadata;
import org.tinylog.Logger;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Works out which partitions to start consuming each time cluster metadata changes.
 *
 * Each {@link #reconcile} stages every partition of every wanted topic at the topic's offset,
 * lays pinned partitions over that, and hands out whatever is not already in use. Handed-out
 * partitions are remembered and never offered again, even if their topic later disappears from
 * metadata and comes back.
 *
 * In regex mode a topic is wanted if any configured pattern matches it; patterns are tried in
 * configured order and the first match decides the offset. Each topic name is matched at most
 * once, the result (match or not) is kept for later reconciliations.
 *
 * Not thread-safe. Callers serialize reconciliations, typically under the consumer's lock.
 */
public class DirectAssigner {
    private final DirectConsumeConfig config;
    private final TopicMatcher matcher;

    private final Map<String, Offset> reTopics;
    private final Set<String> reIgnore;
    private final Map<String, Set<Integer>> using;

    public DirectAssigner(DirectConsumeConfig config) {
        this(config, new RegexTopicMatcher());
    }

    public DirectAssigner(DirectConsumeConfig config, TopicMatcher matcher) {
        this.config = config;
        this.matcher = matcher;
        this.reTopics = new HashMap<>();
        this.reIgnore = new HashSet<>();
        this.using = new HashMap<>();
    }

    /**
     * Topics whose metadata must be fetched for this assigner to make progress. Empty in regex
     * mode, where every topic the cluster reports is a candidate.
     */
    public Set<String> topicsToTrack() {
        if (config.isRegexTopics()) {
            return ImmutableSet.of();
        }
        Set<String> topics = new LinkedHashSet<>(config.getTopics().keySet());
        topics.addAll(config.getPartitions().keySet());
        return ImmutableSet.copyOf(topics);
    }

    /**
     * Partitions handed out so far, by topic.
     */
    public Map<String, Set<Integer>> using() {
        ImmutableMap.Builder<String, Set<Integer>> copy = ImmutableMap.builder();
        using.forEach((topic, partitions) -> copy.put(topic, ImmutableSet.copyOf(partitions)));
        return copy.build();
    }

    /**
     * Returns the partitions of {@code snapshot} that are wanted and not yet in use, with their
     * starting offsets, and marks them as in use. Returns {@link AssignmentDelta#NONE} when there
     * is nothing new.
     */
    public AssignmentDelta reconcile(ClusterSnapshot snapshot) {
        Map<String, Map<Integer, Offset>> toUse = new HashMap<>();

        for (TopicMetadata topic : snapshot.topics().values()) {
            String topicName = topic.topicName();
            Offset topicOffset = wantedAt(topicName);

            if (topicOffset != null) {
                Map<Integer, Offset> staged = new HashMap<>();
                for (int partition : topic.partitions()) {
                    staged.put(partition, topicOffset);
                }
                toUse.put(topicName, staged);
            }

            Map<Integer, Offset> pins = config.getPartitions().get(topicName);
            if (pins != null && !pins.isEmpty()) {
                toUse.computeIfAbsent(topicName, t -> new HashMap<>()).putAll(pins);
            }
        }

        Iterator<Map.Entry<String, Map<Integer, Offset>>> it = toUse.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, Map<Integer, Offset>> entry = it.next();
            if (entry.getValue().isEmpty()) {
                it.remove(); // wanted, but no partitions yet
                continue;
            }
            Set<Integer> inUse = using.get(entry.getKey());
            if (inUse == null) {
                continue;
            }
            if (inUse.containsAll(entry.getValue().keySet())) {
                it.remove();
                continue;
            }
            entry.getValue().keySet().removeAll(inUse);
        }

        if (toUse.isEmpty()) {
            return AssignmentDelta.NONE;
        }

        for (Map.Entry<String, Map<Integer, Offset>> entry : toUse.entrySet()) {
            using.computeIfAbsent(entry.getKey(), t -> new HashSet<>()).addAll(entry.getValue().keySet());
        }

        AssignmentDelta delta = AssignmentDelta.of(toUse);
        Logger.debug("Direct consumer assigning {} new partitions: {}", delta.size(), delta);
        return delta;
    }

    /**
     * Offset to consume {@code topic} from, or null if the topic is not wanted as a whole.
     */
    private Offset wantedAt(String topic) {
        if (!config.isRegexTopics()) {
            return config.getTopics().get(topic);
        }

        Offset matched = reTopics.get(topic);
        if (matched != null) {
            return matched;
        }
        if (reIgnore.contains(topic)) {
            return null;
        }

        for (Map.Entry<String, Offset> pattern : config.getTopics().entrySet()) {
            if (matcher.matches(pattern.getKey(), topic)) {
                Logger.debug("Topic {} matched pattern {}", topic, pattern.getKey());
                reTopics.put(topic, pattern.getValue());
                return pattern.getValue();
            }
        }
        Logger.debug("Topic {} matched no pattern, ignoring it from now on", topic);
        reIgnore.add(topic);
        return null;
    }
}
