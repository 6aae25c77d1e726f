package net.spookly.kvproxy.routing;

/**
 * Outcome of one reload trigger.
 */
public enum ReloadStatus {
    /**
     * A new scheduler was published.
     */
    SUCCESS,
    /**
     * The candidate version does not advance the active one; nothing changed.
     */
    ALREADY_CURRENT,
    /**
     * The description could not be parsed or validated; the active scheduler stays in force.
     */
    MALFORMED,
    /**
     * Another reload was in progress. Not queued.
     */
    BUSY,
    /**
     * The description was valid but its scheduler could not be built; nothing was published.
     */
    FAILED;

    public boolean changed() {
        return this == SUCCESS;
    }
}
