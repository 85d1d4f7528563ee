package com.raditha.xnos.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.raditha.xnos.model.TokenType;
import com.raditha.xnos.refs.NameTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Loads the filter configuration from xnos.yml with CLI overrides.
 * <p>
 * Configuration priority: CLI arguments > xnos.yml > defaults
 */
public class FilterSettings {

    private static final Logger logger = LoggerFactory.getLogger(FilterSettings.class);

    private static final String CONFIG_KEY = "xnos";
    private static final String DEFAULT_RESOURCE = "xnos.yml";

    private FilterSettings() {
    }

    /**
     * Read a YAML file, or the bundled {@code xnos.yml} when {@code configFile} is null.
     *
     * @return the top-level mapping, empty if there is none
     * @throws IOException if the file cannot be read or is not valid YAML
     */
    public static Map<String, Object> loadConfigMap(Path configFile) throws IOException {
        if (configFile != null) {
            logger.debug("Reading configuration from {}", configFile);
            try (InputStream in = Files.newInputStream(configFile)) {
                return readYaml(in);
            }
        }
        try (InputStream in = FilterSettings.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                logger.debug("No {} on the classpath, using defaults", DEFAULT_RESOURCE);
                return Map.of();
            }
            return readYaml(in);
        }
    }

    private static Map<String, Object> readYaml(InputStream in) throws IOException {
        Map<String, Object> map = new YAMLMapper().readValue(in, new TypeReference<Map<String, Object>>() {
        });
        return map == null ? Map.of() : map;
    }

    /**
     * Build the run configuration.
     *
     * @param configMap       top-level YAML mapping
     * @param warningLevelCLI CLI warning level (null = use YAML/default)
     * @param cleverefCLI     CLI {@code --cleveref} (false = use YAML/default)
     * @param noFakeryCLI     CLI {@code --no-fakery} (false = use YAML/default)
     * @return complete filter configuration
     * @throws IllegalArgumentException if a value is invalid
     */
    public static FilterConfig loadConfig(Map<String, Object> configMap, Integer warningLevelCLI,
            boolean cleverefCLI, boolean noFakeryCLI) {
        Object yamlConfigRaw = configMap.get(CONFIG_KEY);
        if (yamlConfigRaw != null && !(yamlConfigRaw instanceof Map)) {
            throw new IllegalArgumentException("'" + CONFIG_KEY + "' must be a mapping");
        }

        @SuppressWarnings("unchecked")
        Map<String, Object> config = yamlConfigRaw == null ? Map.of() : (Map<String, Object>) yamlConfigRaw;
        FilterConfig defaults = FilterConfig.defaults();

        int warningLevel = warningLevelCLI != null ? warningLevelCLI
                : getInt(config, "warning_level", defaults.warningLevel());
        boolean cleveref = cleverefCLI || getBoolean(config, "cleveref", defaults.cleveref());
        boolean fakery = !noFakeryCLI && getBoolean(config, "cleveref_fakery", defaults.cleverefFakery());
        boolean bySection = getBoolean(config, "number_by_section", defaults.numberBySection());
        boolean implicit = getBoolean(config, "implicit_labels", defaults.implicitLabels());

        List<TargetKindConfig> targets = buildTargets(config);
        if (targets.isEmpty()) {
            targets = FilterConfig.defaultTargets();
        }
        return new FilterConfig(warningLevel, cleveref, fakery, bySection, implicit, targets);
    }

    private static List<TargetKindConfig> buildTargets(Map<String, Object> config) {
        List<TargetKindConfig> targets = new ArrayList<>();
        Object targetsObj = config.get("targets");
        if (!(targetsObj instanceof List<?> list)) {
            return targets;
        }
        for (Object item : list) {
            if (!(item instanceof Map)) {
                throw new IllegalArgumentException("Each entry of 'targets' must be a mapping, got: " + item);
            }
            @SuppressWarnings("unchecked")
            Map<String, Object> entry = (Map<String, Object>) item;
            String prefix = getString(entry, "prefix", null);
            targets.add(new TargetKindConfig(
                    TokenType.fromString(getString(entry, "kind", null)),
                    prefix,
                    getNames(entry, "plus_name", prefix + "."),
                    getNames(entry, "star_name", prefix),
                    getBoolean(entry, "eqref", false),
                    getBoolean(entry, "allow_space", false)));
        }
        return targets;
    }

    private static NameTable getNames(Map<String, Object> map, String key, String fallback) {
        List<String> names = getListString(map, key);
        if (names.isEmpty()) {
            return new NameTable(fallback, fallback);
        }
        return new NameTable(names.get(0), names.size() > 1 ? names.get(1) : names.get(0));
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value != null) {
            throw new IllegalArgumentException(key + " must be a number, got: " + value);
        }
        return defaultValue;
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value != null) {
            throw new IllegalArgumentException(key + " must be true or false, got: " + value);
        }
        return defaultValue;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static List<String> getListString(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof List<?> list) {
            return list.stream().map(Object::toString).toList();
        }
        if (value instanceof String s) {
            return List.of(s);
        }
        return List.of();
    }
}
