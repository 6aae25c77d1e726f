package net.spookly.kvproxy.routing;

/**
 * Dispatch reached a scheduler whose backend connections were already released.
 */
public class SchedulerClosedException extends DispatchException {
    public SchedulerClosedException(long tableVersion) {
        super("scheduler for route version " + tableVersion + " is closed");
    }
}
