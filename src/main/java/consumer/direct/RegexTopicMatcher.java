package consumer.direct;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.regex.Pattern;

/**
 * {@link TopicMatcher} backed by {@link java.util.regex}. Patterns are compiled once and kept.
 *
 * Matching is unanchored: {@code "foo"} matches {@code "my-foo-topic"}. Anchor the pattern with
 * {@code ^...$} to match whole names only.
 */
public class RegexTopicMatcher implements TopicMatcher {
    private final ConcurrentMap<String, Pattern> compiled = new ConcurrentHashMap<>();

    @Override
    public boolean matches(String pattern, String topic) {
        return compiled.computeIfAbsent(pattern, Pattern::compile).matcher(topic).find();
    }
}
