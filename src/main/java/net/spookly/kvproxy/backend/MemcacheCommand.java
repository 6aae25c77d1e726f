package net.spookly.kvproxy.backend;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * One memcached text protocol request.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class MemcacheCommand {
    public enum Type {
        GET,
        SET
    }

    private final Type type;
    private final String key;
    private final byte[] value;

    public static MemcacheCommand get(String key) {
        return new MemcacheCommand(Type.GET, key, null);
    }

    public static MemcacheCommand set(String key, byte[] value) {
        return new MemcacheCommand(Type.SET, key, value == null ? new byte[0] : value);
    }
}
