package net.spookly.kvproxy.routing;

/**
 * The two operation shapes a scheduler executes.
 */
public enum OperationKind {
    /**
     * Ranked replicas tried one at a time until one answers.
     */
    READ,
    /**
     * Issued to every replica; success decided by the {@link WriteQuorum}.
     */
    WRITE
}
