package net.spookly.kvproxy.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Expands {@code env:NAME}, {@code env:NAME|fallback} and {@code path:file} string values
 * in a raw YAML tree before it is mapped onto {@link KvproxyConfig}.
 */
final class EnvExpander {
    private static final String ENV_PREFIX = "env:";
    private static final String PATH_PREFIX = "path:";
    private static final char FALLBACK_SEPARATOR = '|';

    private EnvExpander() {
    }

    static Object expand(Object value, Path baseDir) {
        return expand(value, baseDir, System::getenv);
    }

    static Object expand(Object value, Path baseDir, Function<String, String> environment) {
        if (value instanceof Map) {
            return expandMap((Map<?, ?>) value, baseDir, environment);
        }
        if (value instanceof List) {
            return expandList((List<?>) value, baseDir, environment);
        }
        if (value instanceof String) {
            return expandString((String) value, baseDir, environment);
        }
        return value;
    }

    private static Map<Object, Object> expandMap(Map<?, ?> raw, Path baseDir, Function<String, String> environment) {
        Map<Object, Object> expanded = new LinkedHashMap<>();
        raw.forEach((key, item) -> expanded.put(key, expand(item, baseDir, environment)));
        return expanded;
    }

    private static List<Object> expandList(List<?> raw, Path baseDir, Function<String, String> environment) {
        List<Object> expanded = new ArrayList<>(raw.size());
        for (Object item : raw) {
            expanded.add(expand(item, baseDir, environment));
        }
        return expanded;
    }

    private static Object expandString(String raw, Path baseDir, Function<String, String> environment) {
        if (raw.startsWith(ENV_PREFIX)) {
            String spec = raw.substring(ENV_PREFIX.length());
            int separator = spec.indexOf(FALLBACK_SEPARATOR);
            String key = separator < 0 ? spec : spec.substring(0, separator);
            String envValue = environment.apply(key);
            if (envValue != null) {
                return envValue;
            }
            if (separator >= 0) {
                return spec.substring(separator + 1);
            }
            throw new ConfigException("Missing required environment variable: " + key);
        }
        if (raw.startsWith(PATH_PREFIX)) {
            return readPathValue(raw.substring(PATH_PREFIX.length()), baseDir);
        }
        return raw;
    }

    private static String readPathValue(String location, Path baseDir) {
        if (location.isBlank()) {
            throw new ConfigException("Path value is empty");
        }
        Path resolved;
        try {
            Path path = Paths.get(location);
            resolved = baseDir != null && !path.isAbsolute() ? baseDir.resolve(path).normalize() : path;
        } catch (InvalidPathException e) {
            throw new ConfigException("Invalid path value: " + location, e);
        }
        try {
            String content = Files.readString(resolved, StandardCharsets.UTF_8).strip();
            if (content.isEmpty()) {
                throw new ConfigException("Path value is empty: " + resolved);
            }
            return content;
        } catch (IOException e) {
            throw new ConfigException("Failed to read config path: " + resolved, e);
        }
    }
}
