package net.spookly.kvproxy.routing;

/**
 * A key resolved to no replicas, or no route table is loaded. This is a configuration defect,
 * not an operational failure, and is never retried.
 */
public class NoReplicasConfiguredException extends DispatchException {
    public NoReplicasConfiguredException(String message) {
        super(message);
    }
}
