package net.spookly.kvproxy.route;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import net.spookly.kvproxy.util.NodeAddress;

/**
 * Immutable, versioned mapping from bucket to its ordered replica node addresses.
 * <p>
 * Every bucket maps to exactly {@link #replicaCount()} distinct addresses. Reconfiguration
 * always produces a new instance; tables are compared by {@link #version()} only.
 */
public final class RouteTable {
    private final long version;
    private final int replicaCount;
    private final Partitioner partitioner;
    private final List<List<String>> partitions;
    private final Set<String> nodes;

    private RouteTable(long version, int replicaCount, Partitioner partitioner,
                       List<List<String>> partitions, Set<String> nodes) {
        this.version = version;
        this.replicaCount = replicaCount;
        this.partitioner = partitioner;
        this.partitions = partitions;
        this.nodes = nodes;
    }

    /**
     * Build a table from per-bucket replica lists, where list index is the bucket id.
     *
     * @throws MalformedRouteException when the shape violates the table invariants
     */
    public static RouteTable of(long version, int replicaCount, List<List<String>> partitions) {
        if (version < 0) {
            throw new MalformedRouteException("route version must not be negative: " + version);
        }
        if (replicaCount <= 0) {
            throw new MalformedRouteException("replica count must be greater than 0: " + replicaCount);
        }
        if (partitions == null || !Partitioner.isValidBucketCount(partitions.size())) {
            throw new MalformedRouteException("bucket count must be a power of two between 1 and "
                    + Partitioner.MAX_BUCKETS + ": " + (partitions == null ? 0 : partitions.size()));
        }
        List<List<String>> copy = new ArrayList<>(partitions.size());
        Set<String> nodes = new TreeSet<>();
        for (int bucket = 0; bucket < partitions.size(); bucket++) {
            List<String> replicas = partitions.get(bucket);
            if (replicas == null || replicas.size() != replicaCount) {
                throw new MalformedRouteException("bucket " + bucket + " must have exactly " + replicaCount
                        + " replicas, found " + (replicas == null ? 0 : replicas.size()));
            }
            Set<String> seen = new HashSet<>();
            List<String> normalized = new ArrayList<>(replicaCount);
            for (String replica : replicas) {
                String address = normalizeAddress(bucket, replica);
                if (!seen.add(address)) {
                    throw new MalformedRouteException("bucket " + bucket + " lists " + address + " more than once");
                }
                normalized.add(address);
            }
            copy.add(List.copyOf(normalized));
            nodes.addAll(normalized);
        }
        return new RouteTable(version, replicaCount, new Partitioner(partitions.size()),
                List.copyOf(copy), Collections.unmodifiableSet(nodes));
    }

    public long version() {
        return version;
    }

    public int replicaCount() {
        return replicaCount;
    }

    public int bucketCount() {
        return partitions.size();
    }

    public int bucketOf(String key) {
        return partitioner.bucketOf(key);
    }

    /**
     * Ordered replica addresses serving {@code key}.
     */
    public List<String> lookup(String key) {
        return partitions.get(partitioner.bucketOf(key));
    }

    public List<String> replicas(int bucket) {
        if (bucket < 0 || bucket >= partitions.size()) {
            throw new IllegalArgumentException("bucket out of range: " + bucket);
        }
        return partitions.get(bucket);
    }

    /**
     * Distinct node addresses referenced by any bucket, sorted.
     */
    public Set<String> nodes() {
        return nodes;
    }

    public boolean isNewerThan(long otherVersion) {
        return version > otherVersion;
    }

    private static String normalizeAddress(int bucket, String replica) {
        try {
            return NodeAddress.parse(replica).toString();
        } catch (IllegalArgumentException e) {
            throw new MalformedRouteException("bucket " + bucket + " has an invalid address: " + e.getMessage(), e);
        }
    }

    @Override
    public String toString() {
        return "RouteTable{version=" + version + ", buckets=" + partitions.size()
                + ", replicas=" + replicaCount + ", nodes=" + nodes.size() + "}";
    }
}
