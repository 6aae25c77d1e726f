package net.spookly.kvproxy.route;

import java.io.IOException;

/**
 * Supplies the current route description text.
 */
public interface RouteSource {
    String read() throws IOException;

    /**
     * Human-readable origin used in log lines.
     */
    String describe();
}
