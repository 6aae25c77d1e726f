package net.spookly.kvproxy.route;

import net.spookly.kvproxy.config.ConfigException;

/**
 * Raised when a route description cannot be turned into a valid {@link RouteTable}.
 */
public class MalformedRouteException extends ConfigException {
    public MalformedRouteException(String message) {
        super(message);
    }

    public MalformedRouteException(String message, Throwable cause) {
        super(message, cause);
    }
}
