package io.surfworks.warpedit.transform.config;

import io.surfworks.warpedit.core.edit.Placeholders;
import io.surfworks.warpedit.core.util.Scopes;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Tunables for the default transform policies.
 *
 * <p>Loaded from {@code ~/.config/warpedit/transform.json} by {@link TransformConfigLoader};
 * callers may also build one directly.
 *
 * @param copyShape                   copied tensors keep their static shape (otherwise unknown)
 * @param keepControlInputsIfPossible control inputs outside the subgraph are kept when
 *                                    editing within one graph
 * @param keepOriginalOpIfPossible    original-op links outside the subgraph are kept when
 *                                    editing within one graph
 * @param placeholderPrefix           prefix of generated placeholder names
 * @param reuseDstScope               use the destination scope as given instead of making it unique
 */
public record TransformConfig(
        boolean copyShape,
        boolean keepControlInputsIfPossible,
        boolean keepOriginalOpIfPossible,
        String placeholderPrefix,
        boolean reuseDstScope
) {

    /** Default prefix of generated placeholders */
    public static final String DEFAULT_PLACEHOLDER_PREFIX = Placeholders.DEFAULT_PREFIX;

    /** Config directory */
    public static final Path CONFIG_DIR = Path.of(
            System.getProperty("user.home"), ".config", "warpedit"
    );

    /** Config file name */
    public static final String CONFIG_FILE = "transform.json";

    public TransformConfig {
        Objects.requireNonNull(placeholderPrefix, "placeholderPrefix cannot be null");
        if (placeholderPrefix.isBlank()) {
            throw new IllegalArgumentException("placeholderPrefix cannot be blank");
        }
        if (placeholderPrefix.indexOf(Scopes.SEPARATOR) >= 0) {
            throw new IllegalArgumentException("placeholderPrefix cannot contain '/': " + placeholderPrefix);
        }
    }

    /**
     * Returns the default configuration: shapes copied, outside references kept when possible.
     */
    public static TransformConfig defaults() {
        return new TransformConfig(true, true, true, DEFAULT_PLACEHOLDER_PREFIX, false);
    }

    /**
     * Returns the path of the default config file.
     */
    public static Path configFile() {
        return CONFIG_DIR.resolve(CONFIG_FILE);
    }

    public TransformConfig withCopyShape(boolean copyShape) {
        return new TransformConfig(copyShape, keepControlInputsIfPossible, keepOriginalOpIfPossible,
                placeholderPrefix, reuseDstScope);
    }

    public TransformConfig withKeepControlInputsIfPossible(boolean keep) {
        return new TransformConfig(copyShape, keep, keepOriginalOpIfPossible, placeholderPrefix, reuseDstScope);
    }

    public TransformConfig withKeepOriginalOpIfPossible(boolean keep) {
        return new TransformConfig(copyShape, keepControlInputsIfPossible, keep, placeholderPrefix, reuseDstScope);
    }

    public TransformConfig withPlaceholderPrefix(String prefix) {
        return new TransformConfig(copyShape, keepControlInputsIfPossible, keepOriginalOpIfPossible,
                prefix, reuseDstScope);
    }

    public TransformConfig withReuseDstScope(boolean reuse) {
        return new TransformConfig(copyShape, keepControlInputsIfPossible, keepOriginalOpIfPossible,
                placeholderPrefix, reuse);
    }
}
