package net.spookly.kvproxy.route;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Parses YAML route descriptions into {@link RouteTable}s and renders tables back for display.
 */
public final class RouteTableParser {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);

    private final int replicaCount;

    /**
     * @param replicaCount proxy-wide replication factor every bucket must match
     */
    public RouteTableParser(int replicaCount) {
        if (replicaCount <= 0) {
            throw new IllegalArgumentException("replica count must be greater than 0");
        }
        this.replicaCount = replicaCount;
    }

    public int replicaCount() {
        return replicaCount;
    }

    /**
     * Parse a route description.
     *
     * @throws MalformedRouteException when the text is not a valid description
     */
    public RouteTable parse(String text) {
        if (text == null || text.isBlank()) {
            throw new MalformedRouteException("route description is empty");
        }
        Object raw;
        try {
            raw = new Yaml().load(text);
        } catch (YAMLException e) {
            throw new MalformedRouteException("route description is not valid YAML: " + e.getMessage(), e);
        }
        if (!(raw instanceof Map)) {
            throw new MalformedRouteException("route description must be a mapping");
        }
        RouteDescription description;
        try {
            description = MAPPER.convertValue(raw, RouteDescription.class);
        } catch (IllegalArgumentException e) {
            throw new MalformedRouteException("route description has an invalid structure: " + e.getMessage(), e);
        }
        return toTable(description);
    }

    RouteTable toTable(RouteDescription description) {
        if (description.version == null) {
            throw new MalformedRouteException("route version is required");
        }
        boolean perBucket = description.buckets != null;
        boolean perServer = description.main != null;
        if (perBucket == perServer) {
            throw new MalformedRouteException("route description must set exactly one of: buckets, main");
        }
        List<List<String>> partitions = perBucket
                ? fromBuckets(description.buckets, description.numbucket)
                : fromServers(description.main, description.numbucket);
        return RouteTable.of(description.version, replicaCount, partitions);
    }

    private List<List<String>> fromBuckets(Map<Integer, List<String>> buckets, Integer numbucket) {
        int bucketCount = numbucket != null ? numbucket : buckets.size();
        requireBucketCount(bucketCount);
        List<List<String>> partitions = emptyPartitions(bucketCount);
        for (Map.Entry<Integer, List<String>> entry : buckets.entrySet()) {
            int bucket = requireBucket(entry.getKey(), bucketCount);
            if (entry.getValue() != null) {
                partitions.get(bucket).addAll(entry.getValue());
            }
        }
        return partitions;
    }

    private List<List<String>> fromServers(List<RouteDescription.ServerEntry> servers, Integer numbucket) {
        if (numbucket == null) {
            throw new MalformedRouteException("numbucket is required with the per-server form");
        }
        requireBucketCount(numbucket);
        List<List<String>> partitions = emptyPartitions(numbucket);
        for (RouteDescription.ServerEntry server : servers) {
            if (server == null || server.addr == null || server.addr.isBlank()) {
                throw new MalformedRouteException("every server entry needs an addr");
            }
            if (server.buckets == null) {
                continue;
            }
            for (Integer bucket : server.buckets) {
                partitions.get(requireBucket(bucket, numbucket)).add(server.addr);
            }
        }
        return partitions;
    }

    private static List<List<String>> emptyPartitions(int bucketCount) {
        List<List<String>> partitions = new ArrayList<>(bucketCount);
        for (int i = 0; i < bucketCount; i++) {
            partitions.add(new ArrayList<>());
        }
        return partitions;
    }

    private static void requireBucketCount(int bucketCount) {
        if (!Partitioner.isValidBucketCount(bucketCount)) {
            throw new MalformedRouteException("numbucket must be a power of two between 1 and "
                    + Partitioner.MAX_BUCKETS + ": " + bucketCount);
        }
    }

    private static int requireBucket(Integer bucket, int bucketCount) {
        if (bucket == null || bucket < 0 || bucket >= bucketCount) {
            throw new MalformedRouteException("bucket out of range [0, " + bucketCount + "): " + bucket);
        }
        return bucket;
    }

    /**
     * Render a table in the per-partition form accepted by {@link #parse(String)}.
     */
    public static String toYaml(RouteTable table) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("version", table.version());
        data.put("numbucket", table.bucketCount());
        Map<Integer, List<String>> buckets = new LinkedHashMap<>();
        for (int bucket = 0; bucket < table.bucketCount(); bucket++) {
            buckets.put(bucket, table.replicas(bucket));
        }
        data.put("buckets", buckets);
        return new Yaml().dump(data);
    }
}
