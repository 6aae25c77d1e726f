package net.spookly.kvproxy.backend;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * One complete reply decoded from a storage node.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class MemcacheReply {
    public enum Kind {
        VALUE,
        MISS,
        STORED,
        NOT_STORED,
        ERROR
    }

    private final Kind kind;
    private final int flags;
    private final byte[] data;
    private final String message;

    static MemcacheReply value(int flags, byte[] data) {
        return new MemcacheReply(Kind.VALUE, flags, data, null);
    }

    static MemcacheReply miss() {
        return new MemcacheReply(Kind.MISS, 0, null, null);
    }

    static MemcacheReply stored() {
        return new MemcacheReply(Kind.STORED, 0, null, null);
    }

    static MemcacheReply notStored() {
        return new MemcacheReply(Kind.NOT_STORED, 0, null, null);
    }

    static MemcacheReply error(String message) {
        return new MemcacheReply(Kind.ERROR, 0, null, message);
    }
}
