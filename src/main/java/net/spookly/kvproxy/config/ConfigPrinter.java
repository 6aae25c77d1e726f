package net.spookly.kvproxy.config;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

/**
 * Renders the effective configuration, omitting unset values.
 */
public final class ConfigPrinter {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private ConfigPrinter() {
    }

    @SuppressWarnings("unchecked")
    public static String toYaml(KvproxyConfig config) {
        Map<String, Object> data = MAPPER.convertValue(config, Map.class);
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        return new Yaml(options).dump(data);
    }
}
