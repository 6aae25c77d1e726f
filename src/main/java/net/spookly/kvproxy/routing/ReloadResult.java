package net.spookly.kvproxy.routing;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;

@Getter
@Accessors(fluent = true)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ReloadResult {
    private final ReloadStatus status;
    /**
     * Candidate version, or -1 when the description never produced a table.
     */
    private final long version;
    /**
     * Version active before the reload, or -1 when nothing was loaded.
     */
    private final long previousVersion;
    private final String message;

    static ReloadResult success(long version, long previousVersion) {
        return new ReloadResult(ReloadStatus.SUCCESS, version, previousVersion,
                "route version " + version + " is active");
    }

    static ReloadResult alreadyCurrent(long version, long activeVersion) {
        return new ReloadResult(ReloadStatus.ALREADY_CURRENT, version, activeVersion,
                "route version " + version + " does not advance active version " + activeVersion);
    }

    static ReloadResult malformed(long activeVersion, String message) {
        return new ReloadResult(ReloadStatus.MALFORMED, -1L, activeVersion, message);
    }

    static ReloadResult busy(long activeVersion) {
        return new ReloadResult(ReloadStatus.BUSY, -1L, activeVersion, "reload already in progress");
    }

    static ReloadResult failed(long version, long activeVersion, String message) {
        return new ReloadResult(ReloadStatus.FAILED, version, activeVersion, message);
    }

    @Override
    public String toString() {
        return status + " (version " + version + ", previous " + previousVersion + "): " + message;
    }
}
