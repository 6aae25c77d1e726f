package net.spookly.kvproxy.route;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads the route description from a file on every call.
 */
public final class FileRouteSource implements RouteSource {
    private final Path path;

    public FileRouteSource(Path path) {
        this.path = Objects.requireNonNull(path, "path");
    }

    @Override
    public String read() throws IOException {
        return Files.readString(path, StandardCharsets.UTF_8);
    }

    @Override
    public String describe() {
        return path.toString();
    }
}
