package exceptions;

public class RequestTooLargeException extends RuntimeException {

    public RequestTooLargeException(int requestSizeInBytes, int maxBrokerWriteBytes) {
        super("Produce request of " + requestSizeInBytes + " bytes exceeds the max broker write size of "
                + maxBrokerWriteBytes + " bytes");
    }
}
