package net.spookly.kvproxy.routing;

/**
 * How many replica acknowledgements make a write successful.
 */
public enum WriteQuorum {
    /**
     * Every replica must acknowledge.
     */
    ALL("all"),
    /**
     * The first acknowledgement completes the write; the rest finish best-effort.
     */
    ONE("one");

    private final String configValue;

    WriteQuorum(String configValue) {
        this.configValue = configValue;
    }

    public int required(int replicas) {
        return this == ALL ? replicas : Math.min(1, replicas);
    }

    public static WriteQuorum fromConfig(String value) {
        if (value == null) {
            return ALL;
        }
        for (WriteQuorum quorum : values()) {
            if (quorum.configValue.equalsIgnoreCase(value)) {
                return quorum;
            }
        }
        return ALL;
    }
}
