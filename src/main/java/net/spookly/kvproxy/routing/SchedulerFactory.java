package net.spookly.kvproxy.routing;

import net.spookly.kvproxy.route.RouteTable;

/**
 * Builds the scheduler bound to a freshly loaded route table.
 */
@FunctionalInterface
public interface SchedulerFactory {
    Scheduler create(RouteTable table);
}
