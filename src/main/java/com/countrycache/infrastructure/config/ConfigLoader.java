package com.countrycache.infrastructure.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import io.vertx.core.json.JsonObject;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Locale;
import java.util.Map;

/**
 * Loads application.yml from the classpath into a Vert.x config object.
 * Any leaf key can be overridden by an environment variable named
 * COUNTRY_API_ followed by the upper-snake key path, e.g. COUNTRY_API_HTTP_PORT.
 */
@Slf4j
public final class ConfigLoader {

    public static final String DEFAULT_RESOURCE = "application.yml";
    public static final String ENV_PREFIX = "COUNTRY_API_";

    private ConfigLoader() {
    }

    public static JsonObject load() {
        return load(DEFAULT_RESOURCE, System.getenv());
    }

    public static JsonObject load(String resource, Map<String, String> env) {
        try (InputStream is = ConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IllegalStateException(resource + " not found in classpath");
            }

            JsonNode tree = new YAMLMapper().readTree(is);
            if (tree == null || !tree.isObject()) {
                throw new IllegalStateException(resource + " must contain a mapping at the top level");
            }

            JsonObject config = new JsonObject(tree.toString());
            applyOverrides(config, ENV_PREFIX, env);
            log.info("Loaded configuration from {}", resource);
            return config;

        } catch (IOException e) {
            log.error("Failed to load {}: {}", resource, e.getMessage());
            throw new IllegalStateException("Configuration error: " + resource + " could not be read", e);
        }
    }

    private static void applyOverrides(JsonObject node, String prefix, Map<String, String> env) {
        for (String key : new ArrayList<>(node.fieldNames())) {
            String envName = prefix + key.toUpperCase(Locale.ROOT).replace('-', '_').replace('.', '_');
            Object value = node.getValue(key);

            if (value instanceof JsonObject) {
                applyOverrides((JsonObject) value, envName + "_", env);
            } else if (env.containsKey(envName)) {
                node.put(key, coerce(value, env.get(envName)));
                log.info("Configuration key {} overridden by {}", key, envName);
            }
        }
    }

    /**
     * Keep the type of the value from application.yml
     */
    private static Object coerce(Object current, String override) {
        try {
            if (current instanceof Integer) {
                return Integer.parseInt(override.trim());
            }
            if (current instanceof Long) {
                return Long.parseLong(override.trim());
            }
            if (current instanceof Number) {
                return Double.parseDouble(override.trim());
            }
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Expected a number but got '" + override + "'", e);
        }
        if (current instanceof Boolean) {
            return Boolean.parseBoolean(override.trim());
        }
        return override;
    }
}
