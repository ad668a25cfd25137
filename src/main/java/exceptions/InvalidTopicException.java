package exceptions;

public class InvalidTopicException extends RuntimeException {
    public InvalidTopicException(String topicName) {
        super("Topic \"%s\" currently has no known partitions.".formatted(topicName));
    }
}
