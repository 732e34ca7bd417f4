package loci.imagestats.utilities;

import java.io.ByteArrayInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * EngineConfigManager
 *
 * <p>Loads the engine YAML configuration and answers typed lookups by key path:
 *   - The bundled {@code imagestats-defaults.yml} is always loaded first.
 *   - A user file, if given, is merged over it section by section.
 *   - Getters return null for missing or mistyped values; the {@code OrDefault}
 *     variants log and fall back instead.
 *
 * <p>Example:</p>
 * <pre>{@code
 * EngineConfigManager config = EngineConfigManager.load(Path.of("imagestats.yml"));
 * int port = config.getIntegerOrDefault(21734, "listener", "port");
 * }</pre>
 */
public class EngineConfigManager {
    private static final Logger logger = LoggerFactory.getLogger(EngineConfigManager.class);

    /** Classpath resource holding every key with its default value. */
    public static final String DEFAULTS_RESOURCE = "/imagestats-defaults.yml";

    private final Map<String, Object> configData;
    private final String source;

    private EngineConfigManager(Map<String, Object> configData, String source) {
        this.configData = configData;
        this.source = source;
    }

    /**
     * Configuration consisting of the bundled defaults only.
     */
    public static EngineConfigManager loadDefaults() {
        return new EngineConfigManager(loadDefaultData(), DEFAULTS_RESOURCE);
    }

    /**
     * Loads a YAML file over the bundled defaults.
     *
     * @param path YAML file
     * @throws IOException if the file is missing or is not a YAML mapping
     */
    public static EngineConfigManager load(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new FileNotFoundException("Configuration file not found: " + path);
        }
        Map<String, Object> user;
        try (InputStream in = Files.newInputStream(path)) {
            user = parse(in, path.toString());
        }
        Map<String, Object> merged = loadDefaultData();
        deepMerge(merged, user);
        logger.info("Loaded configuration from {}", path);
        return new EngineConfigManager(merged, path.toString());
    }

    /**
     * Parses YAML text over the bundled defaults.
     *
     * @throws IOException if the text is not a YAML mapping
     */
    public static EngineConfigManager fromYaml(String yamlText) throws IOException {
        Map<String, Object> merged = loadDefaultData();
        try (InputStream in = new ByteArrayInputStream(yamlText.getBytes(StandardCharsets.UTF_8))) {
            deepMerge(merged, parse(in, "<inline>"));
        }
        return new EngineConfigManager(merged, "<inline>");
    }

    private static Map<String, Object> loadDefaultData() {
        try (InputStream in = EngineConfigManager.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                logger.error("Bundled defaults {} not found on the class path", DEFAULTS_RESOURCE);
                return new LinkedHashMap<>();
            }
            return parse(in, DEFAULTS_RESOURCE);
        } catch (IOException e) {
            logger.error("Error reading bundled defaults {}", DEFAULTS_RESOURCE, e);
            return new LinkedHashMap<>();
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> parse(InputStream in, String name) throws IOException {
        Object loaded;
        try {
            loaded = new Yaml().load(in);
        } catch (YAMLException e) {
            throw new IOException("Error parsing YAML " + name + ": " + e.getMessage(), e);
        }
        if (loaded == null) {
            return new LinkedHashMap<>();
        }
        if (!(loaded instanceof Map)) {
            throw new IOException("YAML root is not a map: " + name);
        }
        return new LinkedHashMap<>((Map<String, Object>) loaded);
    }

    @SuppressWarnings("unchecked")
    private static void deepMerge(Map<String, Object> target, Map<String, Object> overrides) {
        for (Map.Entry<String, Object> entry : overrides.entrySet()) {
            Object existing = target.get(entry.getKey());
            if (existing instanceof Map<?, ?> existingMap && entry.getValue() instanceof Map<?, ?> overrideMap) {
                Map<String, Object> copy = new LinkedHashMap<>((Map<String, Object>) existingMap);
                deepMerge(copy, (Map<String, Object>) overrideMap);
                target.put(entry.getKey(), copy);
            } else {
                target.put(entry.getKey(), entry.getValue());
            }
        }
    }

    /** Where the configuration was loaded from. */
    public String getSource() {
        return source;
    }

    public Map<String, Object> getAllConfig() {
        return Collections.unmodifiableMap(configData);
    }

    /**
     * Walks a key path through nested sections.
     *
     * @param keys sequence of keys, e.g. {@code "listener", "port"}
     * @return the value at the end of the path, or null if not found
     */
    public Object getConfigItem(String... keys) {
        Object current = configData;
        for (int i = 0; i < keys.length; i++) {
            if (current instanceof Map<?, ?> map && map.containsKey(keys[i])) {
                current = map.get(keys[i]);
                continue;
            }
            logger.debug("Key '{}' (index {}) not found in {}", keys[i], i, Arrays.toString(keys));
            return null;
        }
        return current;
    }

    public String getString(String... keys) {
        Object v = getConfigItem(keys);
        return (v instanceof String) ? (String) v : null;
    }

    public Integer getInteger(String... keys) {
        Object v = getConfigItem(keys);
        if (v instanceof Number n) return n.intValue();
        try {
            return (v != null) ? Integer.parseInt(v.toString().trim()) : null;
        } catch (NumberFormatException e) {
            logger.warn("Expected int at {} but got {}", String.join("/", keys), v);
            return null;
        }
    }

    public Long getLong(String... keys) {
        Object v = getConfigItem(keys);
        if (v instanceof Number n) return n.longValue();
        try {
            return (v != null) ? Long.parseLong(v.toString().trim()) : null;
        } catch (NumberFormatException e) {
            logger.warn("Expected long at {} but got {}", String.join("/", keys), v);
            return null;
        }
    }

    public Double getDouble(String... keys) {
        Object v = getConfigItem(keys);
        if (v instanceof Number n) return n.doubleValue();
        try {
            return (v != null) ? Double.parseDouble(v.toString().trim()) : null;
        } catch (NumberFormatException e) {
            logger.warn("Expected double at {} but got {}", String.join("/", keys), v);
            return null;
        }
    }

    public Boolean getBoolean(String... keys) {
        Object v = getConfigItem(keys);
        if (v instanceof Boolean b) return b;
        return v != null ? Boolean.parseBoolean(v.toString().trim()) : null;
    }

    @SuppressWarnings("unchecked")
    public List<Object> getList(String... keys) {
        Object v = getConfigItem(keys);
        return (v instanceof List<?>) ? (List<Object>) v : null;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> getSection(String... keys) {
        Object v = getConfigItem(keys);
        return (v instanceof Map<?, ?>) ? (Map<String, Object>) v : null;
    }

    public String getStringOrDefault(String fallback, String... keys) {
        return orDefault(getString(keys), fallback, keys);
    }

    public int getIntegerOrDefault(int fallback, String... keys) {
        return orDefault(getInteger(keys), fallback, keys);
    }

    public long getLongOrDefault(long fallback, String... keys) {
        return orDefault(getLong(keys), fallback, keys);
    }

    public double getDoubleOrDefault(double fallback, String... keys) {
        return orDefault(getDouble(keys), fallback, keys);
    }

    public boolean getBooleanOrDefault(boolean fallback, String... keys) {
        return orDefault(getBoolean(keys), fallback, keys);
    }

    private static <T> T orDefault(T value, T fallback, String... keys) {
        if (value == null) {
            logger.info("No value at {}, using default {}", String.join("/", keys), fallback);
            return fallback;
        }
        return value;
    }

    /**
     * Checks that each key path resolves to a value.
     *
     * @param requiredPaths nested key paths
     * @return the missing paths, empty if all are present
     */
    public Set<String[]> validateRequiredKeys(Set<String[]> requiredPaths) {
        Set<String[]> missing = new LinkedHashSet<>();
        for (String[] path : requiredPaths) {
            if (getConfigItem(path) == null) missing.add(path);
        }
        if (!missing.isEmpty()) {
            logger.error("Missing required configuration keys: {}",
                    missing.stream()
                            .map(p -> String.join("/", p))
                            .collect(Collectors.toList())
            );
        }
        return missing;
    }
}
