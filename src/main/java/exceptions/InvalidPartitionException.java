package exceptions;

public class InvalidPartitionException extends RuntimeException {

    public InvalidPartitionException(String exceptionMsg) {
        super(exceptionMsg);
    }

    public InvalidPartitionException(int invalidPartition, String topicName, int numPartitions) {
        super("Partition index " + invalidPartition + " is out of range [0, " + numPartitions + ") for topic = {" + topicName + "}");
    }
}
