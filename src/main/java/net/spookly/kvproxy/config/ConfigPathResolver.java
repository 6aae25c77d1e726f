package net.spookly.kvproxy.config;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Resolves relative file path settings against the config directory.
 */
final class ConfigPathResolver {
    private ConfigPathResolver() {
    }

    static void resolve(KvproxyConfig config, Path baseDir) {
        if (config == null || baseDir == null) {
            return;
        }
        if (config.route != null) {
            config.route.file = resolvePath(baseDir, config.route.file);
        }
    }

    private static String resolvePath(Path baseDir, String rawValue) {
        if (rawValue == null || rawValue.isBlank()) {
            return rawValue;
        }
        try {
            Path path = Paths.get(rawValue);
            if (!path.isAbsolute()) {
                path = baseDir.resolve(path).normalize();
            }
            return path.toString();
        } catch (InvalidPathException e) {
            throw new ConfigException("Invalid path value: " + rawValue, e);
        }
    }
}
