package net.spookly.kvproxy.route;

import java.util.List;
import java.util.Map;

/**
 * Raw route description as written by operator tooling.
 * <p>
 * Either {@link #buckets} (per-partition replica lists) or {@link #main} (per-server bucket lists)
 * is set, never both.
 */
public class RouteDescription {
    public Long version;
    public Integer numbucket;
    public Map<Integer, List<String>> buckets;
    public List<ServerEntry> main;

    public static class ServerEntry {
        public String addr;
        public List<Integer> buckets;
    }
}
