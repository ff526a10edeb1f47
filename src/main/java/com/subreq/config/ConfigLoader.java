package com.subreq.config;

import com.subreq.exception.ConfigurationException;
import com.subreq.io.ResourceLocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Loads run configuration from YAML files.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     */
    public static RunConfig load(String path) {
        log.info("Loading run configuration from: {}", path);

        try {
            Resource resource = ResourceLocator.getResource(path);
            try (InputStream inputStream = resource.getInputStream()) {
                return parseYaml(inputStream);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    @SuppressWarnings("unchecked")
    static RunConfig parseYaml(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Map<String, Object> root = yaml.load(inputStream);

        if (root == null) {
            throw new ConfigurationException("Configuration file is empty");
        }

        // The run section may sit at the root or under 'subreq'
        Map<String, Object> runConfig = root.containsKey("subreq")
                ? (Map<String, Object>) root.get("subreq")
                : root;

        String name = getString(runConfig, "name", "default-run");
        InputsConfig inputs = parseInputs((Map<String, Object>) runConfig.get("inputs"));
        String output = getString(runConfig, "output", null);
        BatchConfig batch = parseBatch((Map<String, Object>) runConfig.get("batch"));

        RunConfig config = new RunConfig(name, inputs, output, batch);

        log.info("Loaded run configuration: {} with output {}, parallelism {}",
                name, output, batch.parallelism());

        return config;
    }

    private static InputsConfig parseInputs(Map<String, Object> map) {
        if (map == null) {
            log.warn("No inputs section configured");
            return null;
        }
        return new InputsConfig(
                getString(map, "crosswalk", null),
                getString(map, "sub-requirements", null),
                getString(map, "offered-courses", null));
    }

    private static BatchConfig parseBatch(Map<String, Object> map) {
        if (map == null) {
            return BatchConfig.defaults();
        }
        int parallelism = getInt(map, "parallelism", BatchConfig.defaults().parallelism());
        if (parallelism < 1) {
            throw new ConfigurationException("batch.parallelism must be at least 1, got " + parallelism);
        }
        return new BatchConfig(parallelism);
    }

    // Helper methods

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).intValue();
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("'" + key + "' must be a number, got '" + value + "'", e);
        }
    }
}
