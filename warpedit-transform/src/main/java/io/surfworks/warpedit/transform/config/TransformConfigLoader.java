package io.surfworks.warpedit.transform.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads and saves TransformConfig.
 *
 * <p>Values missing from the config file fall back to {@link TransformConfig#defaults()}.
 * A file that cannot be parsed is ignored with a warning.
 */
public final class TransformConfigLoader {

    private static final Logger LOG = Logger.getLogger(TransformConfigLoader.class.getName());

    private static final ObjectMapper JSON = new ObjectMapper();

    private TransformConfigLoader() {
    }

    /**
     * Loads configuration from the default config file.
     *
     * @return the loaded configuration, or defaults if the file doesn't exist
     */
    public static TransformConfig load() {
        return load(TransformConfig.configFile());
    }

    /**
     * Loads configuration from a specific file.
     *
     * @param configFile path to the config file
     * @return the loaded configuration
     */
    public static TransformConfig load(Path configFile) {
        TransformConfig config = TransformConfig.defaults();
        if (Files.exists(configFile)) {
            config = loadFromFile(configFile, config);
        }
        return config;
    }

    /**
     * Saves configuration to the default config file.
     *
     * @param config the configuration to save
     * @throws IOException if saving fails
     */
    public static void save(TransformConfig config) throws IOException {
        save(config, TransformConfig.configFile());
    }

    /**
     * Saves configuration to a specific file.
     *
     * @param config     the configuration to save
     * @param configFile path to write the config
     * @throws IOException if saving fails
     */
    public static void save(TransformConfig config, Path configFile) throws IOException {
        Path parent = configFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        ObjectNode root = JSON.createObjectNode();
        root.put("copyShape", config.copyShape());
        root.put("keepControlInputsIfPossible", config.keepControlInputsIfPossible());
        root.put("keepOriginalOpIfPossible", config.keepOriginalOpIfPossible());
        root.put("placeholderPrefix", config.placeholderPrefix());
        root.put("reuseDstScope", config.reuseDstScope());

        JSON.writerWithDefaultPrettyPrinter().writeValue(configFile.toFile(), root);
    }

    private static TransformConfig loadFromFile(Path configFile, TransformConfig base) {
        try {
            JsonNode root = JSON.readTree(configFile.toFile());
            if (root == null || !root.isObject()) {
                LOG.warning("Ignoring " + configFile + ": expected a JSON object");
                return base;
            }
            return new TransformConfig(
                    getBooleanOrDefault(root, "copyShape", base.copyShape()),
                    getBooleanOrDefault(root, "keepControlInputsIfPossible", base.keepControlInputsIfPossible()),
                    getBooleanOrDefault(root, "keepOriginalOpIfPossible", base.keepOriginalOpIfPossible()),
                    getStringOrDefault(root, "placeholderPrefix", base.placeholderPrefix()),
                    getBooleanOrDefault(root, "reuseDstScope", base.reuseDstScope())
            );
        } catch (IOException | IllegalArgumentException e) {
            LOG.log(Level.WARNING, "Ignoring unreadable config " + configFile, e);
            return base;
        }
    }

    private static String getStringOrDefault(JsonNode node, String field, String defaultValue) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : defaultValue;
    }

    private static boolean getBooleanOrDefault(JsonNode node, String field, boolean defaultValue) {
        JsonNode value = node.get(field);
        return value != null && value.isBoolean() ? value.asBoolean() : defaultValue;
    }
}
