package exceptions;

/**
 * Thrown when a partitioner breaks the framework contract, such as reading buffered counts
 * more often than there are partitions. This is a bug in the partitioner, not a runtime condition.
 */
public class PartitionerMisuseException extends RuntimeException {

    public PartitionerMisuseException(String exceptionMsg) {
        super(exceptionMsg);
    }
}
