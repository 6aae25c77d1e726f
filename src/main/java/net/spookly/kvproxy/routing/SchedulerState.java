package net.spookly.kvproxy.routing;

/**
 * Scheduler lifecycle. Transitions only move forward.
 */
public enum SchedulerState {
    /**
     * Published; reachable by new requests.
     */
    ACTIVE,
    /**
     * Superseded by a reload; still serves requests that already hold it.
     */
    DRAINING,
    /**
     * Backend connections released; dispatch is rejected.
     */
    CLOSED
}
