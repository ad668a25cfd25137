package consumer.direct;

/**
 * Tests topic names against configured topic patterns.
 */
@FunctionalInterface
public interface TopicMatcher {

    /**
     * Whether {@code topic} matches {@code pattern} anywhere in the name.
     */
    boolean matches(String pattern, String topic);
}
