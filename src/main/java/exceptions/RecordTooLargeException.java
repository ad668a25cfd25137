package exceptions;

public class RecordTooLargeException extends RuntimeException {

    public RecordTooLargeException(int recordSizeInBytes, int maxBatchSizeInBytes) {
        super("Record of " + recordSizeInBytes + " bytes is too large to fit in a batch of at most "
                + maxBatchSizeInBytes + " bytes");
    }
}
