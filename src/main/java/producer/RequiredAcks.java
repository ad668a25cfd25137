package producer;

/**
 * How many replicas must acknowledge a produce request before the leader replies.
 */
public enum RequiredAcks {
    /**
     * Records count as sent once written to the wire; the leader does not reply.
     */
    NONE((short) 0),

    /**
     * The leader replies after writing locally, without waiting on in-sync replicas.
     */
    LEADER((short) 1),

    /**
     * The leader replies only after every in-sync replica has the records.
     */
    ALL((short) -1);

    private final short value;

    RequiredAcks(short value) {
        this.value = value;
    }

    public short getValue() {
        return value;
    }

    /**
     * Parses the {@code acks} config value: {@code 0}, {@code 1}, {@code all} or {@code -1}.
     */
    public static RequiredAcks fromConfig(String acks) {
        switch (acks.trim().toLowerCase()) {
            case "0":
                return NONE;
            case "1":
                return LEADER;
            case "all":
            case "-1":
                return ALL;
            default:
                throw new IllegalArgumentException("Invalid acks value: " + acks + ". Expected one of 0, 1, all, -1");
        }
    }
}
