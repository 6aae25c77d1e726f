package net.spookly.kvproxy.route;

import java.nio.charset.StandardCharsets;

/**
 * Maps keys onto buckets: FNV-1a 32-bit hash, top bits select the bucket.
 */
public final class Partitioner {
    private static final int FNV_OFFSET_BASIS = 0x811c9dc5;
    private static final int FNV_PRIME = 0x01000193;
    public static final int MAX_BUCKETS = 1 << 16;

    private final int bucketCount;
    private final int shift;

    public Partitioner(int bucketCount) {
        if (!isValidBucketCount(bucketCount)) {
            throw new IllegalArgumentException("bucket count must be a power of two between 1 and "
                    + MAX_BUCKETS + ": " + bucketCount);
        }
        this.bucketCount = bucketCount;
        this.shift = 32 - Integer.numberOfTrailingZeros(bucketCount);
    }

    public static boolean isValidBucketCount(int bucketCount) {
        return bucketCount >= 1 && bucketCount <= MAX_BUCKETS && Integer.bitCount(bucketCount) == 1;
    }

    public int bucketCount() {
        return bucketCount;
    }

    public int bucketOf(String key) {
        if (bucketCount == 1) {
            return 0;
        }
        return hash(key) >>> shift;
    }

    static int hash(String key) {
        int hash = FNV_OFFSET_BASIS;
        for (byte element : key.getBytes(StandardCharsets.UTF_8)) {
            hash ^= (element & 0xff);
            hash *= FNV_PRIME;
        }
        return hash;
    }
}
