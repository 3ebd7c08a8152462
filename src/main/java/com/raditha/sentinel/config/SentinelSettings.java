package com.raditha.sentinel.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.raditha.sentinel.rule.BuiltInRules;
import com.raditha.sentinel.rule.InvariantRule;
import com.raditha.sentinel.scanner.EntryPointScanner;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads Sentinel configuration from YAML with CLI overrides.
 * <p>
 * Configuration priority: CLI arguments > config file (or the bundled {@code sentinel.yml}) > defaults.
 * When no invariants are configured the {@link BuiltInRules} are used.
 */
public final class SentinelSettings {

    static final String DEFAULT_CONFIG_RESOURCE = "sentinel.yml";
    private static final String ENTRY_POINTS_KEY = "entry_points";
    private static final String INVARIANTS_KEY = "invariants";

    private static final Logger logger = LoggerFactory.getLogger(SentinelSettings.class);
    private static final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

    private SentinelSettings() {
    }

    /**
     * Read a YAML file into a raw map. An empty file yields an empty map.
     */
    public static Map<String, Object> loadConfigMap(Path configFile) throws IOException {
        if (!Files.exists(configFile)) {
            throw new IllegalArgumentException("Config file not found: " + configFile);
        }
        try (InputStream in = Files.newInputStream(configFile)) {
            return readMap(in);
        }
    }

    /**
     * Read the bundled default configuration, or an empty map if it is not on the classpath.
     */
    public static Map<String, Object> loadDefaultConfigMap() throws IOException {
        try (InputStream in = SentinelSettings.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {
            if (in == null) {
                logger.debug("No {} on the classpath, using defaults", DEFAULT_CONFIG_RESOURCE);
                return new HashMap<>();
            }
            return readMap(in);
        }
    }

    /**
     * Load the effective configuration.
     *
     * @param configFile  YAML file to read, null for the bundled default
     * @param prefixCLI   CLI entry point prefix (null = use YAML/default)
     */
    public static SentinelConfig loadConfig(@Nullable Path configFile, @Nullable String prefixCLI) throws IOException {
        Map<String, Object> yaml = configFile != null ? loadConfigMap(configFile) : loadDefaultConfigMap();
        return fromMap(yaml, prefixCLI);
    }

    /**
     * Build the configuration from an already-read YAML map.
     */
    public static SentinelConfig fromMap(Map<String, Object> yaml, @Nullable String prefixCLI) {
        Map<String, Object> entryPoints = getMap(yaml, ENTRY_POINTS_KEY);
        String prefix = prefixCLI != null ? prefixCLI
                : getString(entryPoints, "prefix", EntryPointScanner.DEFAULT_PREFIX);
        boolean enabled = getBoolean(entryPoints, "enabled", true);

        List<InvariantRule> rules;
        Object definitions = yaml.get(INVARIANTS_KEY);
        if (definitions instanceof List<?> list && !list.isEmpty()) {
            rules = RuleDefinitionParser.parseAll(list);
        } else {
            logger.debug("No invariants configured, using built-in rules");
            rules = BuiltInRules.all();
        }
        return new SentinelConfig(prefix, enabled, rules);
    }

    private static Map<String, Object> readMap(InputStream in) throws IOException {
        JsonNode root = mapper.readTree(in);
        if (root == null || root.isMissingNode() || root.isNull()) {
            return new HashMap<>();
        }
        if (!root.isObject()) {
            throw new IllegalArgumentException("Configuration root must be a mapping");
        }
        return mapper.convertValue(root, new TypeReference<Map<String, Object>>() {
        });
    }

    private static Map<String, Object> getMap(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof Map<?, ?> nested) {
            return RuleDefinitionParser.asStringMap(nested);
        }
        return Map.of();
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return defaultValue;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        if (value != null) {
            return value.toString();
        }
        return defaultValue;
    }
}
