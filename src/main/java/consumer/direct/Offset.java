package consumer.direct;

/**
 * Where to start consuming a partition.
 *
 * {@code at} is either an exact offset or one of the two sentinels understood by list-offsets
 * requests: {@link #EARLIEST} (-2) and {@link #LATEST} (-1). {@code relative} shifts the resolved
 * position, e.g. {@code Offset.latest().relative(-10)} starts ten records before the end.
 */
public record Offset(long at, long relative) {
    public static final long EARLIEST = -2L;
    public static final long LATEST = -1L;

    public Offset {
        if (at < EARLIEST) {
            throw new IllegalArgumentException("Invalid offset " + at + ", must be >= 0, -1 (latest) or -2 (earliest)");
        }
    }

    public static Offset earliest() {
        return new Offset(EARLIEST, 0L);
    }

    public static Offset latest() {
        return new Offset(LATEST, 0L);
    }

    public static Offset at(long offset) {
        if (offset < 0) {
            throw new IllegalArgumentException("Exact offset must not be negative, got " + offset);
        }
        return new Offset(offset, 0L);
    }

    /**
     * This position moved by {@code delta} records once resolved.
     */
    public Offset relative(long delta) {
        return new Offset(at, delta);
    }

    public boolean isEarliest() {
        return at == EARLIEST;
    }

    public boolean isLatest() {
        return at == LATEST;
    }

    /**
     * Parses {@code earliest}, {@code latest} or an exact non-negative offset.
     */
    public static Offset parse(String value) {
        String trimmed = value.trim().toLowerCase();
        switch (trimmed) {
            case "earliest":
                return earliest();
            case "latest":
                return latest();
            default:
                try {
                    return at(Long.parseLong(trimmed));
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException(
                            "Invalid offset: " + value + ". Expected earliest, latest or a non-negative number", e);
                }
        }
    }

    @Override
    public String toString() {
        String base = isEarliest() ? "earliest" : isLatest() ? "latest" : String.valueOf(at);
        if (relative == 0) {
            return base;
        }
        return base + (relative > 0 ? "+" : "") + relative;
    }
}
