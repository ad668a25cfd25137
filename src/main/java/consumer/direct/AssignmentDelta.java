package consumer.direct;

import com.google.common.collect.ImmutableMap;

import java.util.Map;
import java.util.Set;

/**
 * Partitions newly handed out by a reconciliation, each with the offset to start consuming from.
 *
 * Iteration order carries no meaning.
 */
public final class AssignmentDelta {
    public static final AssignmentDelta NONE = new AssignmentDelta(ImmutableMap.of());

    private final ImmutableMap<String, ImmutableMap<Integer, Offset>> assignments;

    private AssignmentDelta(ImmutableMap<String, ImmutableMap<Integer, Offset>> assignments) {
        this.assignments = assignments;
    }

    /**
     * Copies {@code assignments}, dropping topics without partitions.
     */
    public static AssignmentDelta of(Map<String, ? extends Map<Integer, Offset>> assignments) {
        ImmutableMap.Builder<String, ImmutableMap<Integer, Offset>> copy = ImmutableMap.builder();
        for (Map.Entry<String, ? extends Map<Integer, Offset>> entry : assignments.entrySet()) {
            if (!entry.getValue().isEmpty()) {
                copy.put(entry.getKey(), ImmutableMap.copyOf(entry.getValue()));
            }
        }
        ImmutableMap<String, ImmutableMap<Integer, Offset>> built = copy.build();
        return built.isEmpty() ? NONE : new AssignmentDelta(built);
    }

    public boolean isEmpty() {
        return assignments.isEmpty();
    }

    public Set<String> topics() {
        return assignments.keySet();
    }

    public Set<Integer> partitions(String topic) {
        ImmutableMap<Integer, Offset> partitions = assignments.get(topic);
        return partitions == null ? Set.of() : partitions.keySet();
    }

    /**
     * Starting offset of {@code topic}-{@code partition}, or null if it is not part of this delta.
     */
    public Offset offsetFor(String topic, int partition) {
        ImmutableMap<Integer, Offset> partitions = assignments.get(topic);
        return partitions == null ? null : partitions.get(partition);
    }

    /**
     * Number of (topic, partition) pairs.
     */
    public int size() {
        int size = 0;
        for (ImmutableMap<Integer, Offset> partitions : assignments.values()) {
            size += partitions.size();
        }
        return size;
    }

    public Map<String, ImmutableMap<Integer, Offset>> asMap() {
        return assignments;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AssignmentDelta)) return false;
        return assignments.equals(((AssignmentDelta) o).assignments);
    }

    @Override
    public int hashCode() {
        return assignments.hashCode();
    }

    @Override
    public String toString() {
        return "AssignmentDelta" + assignments;
    }
}
