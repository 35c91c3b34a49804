package com.dtsxarchitect.core.renderer;

import java.util.Map;
import java.util.Objects;

/**
 * Destination and settings for one render call.
 *
 * @param outputDirectory target directory; ignored by renderers that do not write files
 * @param settings renderer-specific settings, keyed by {@code <rendererId>.<name>}
 */
public record RenderContext(
    String outputDirectory,
    Map<String, String> settings
) {
    /**
     * Compact constructor with validation.
     */
    public RenderContext {
        Objects.requireNonNull(outputDirectory, "outputDirectory must not be null");
        settings = settings == null ? Map.of() : Map.copyOf(settings);
    }

    /**
     * Gets a setting value.
     *
     * @param key setting key
     * @return setting value or null
     */
    public String getSetting(String key) {
        return settings.get(key);
    }

    /**
     * Gets a setting with a default.
     *
     * @param key setting key
     * @param defaultValue default value
     * @return setting value or default
     */
    public String getSettingOrDefault(String key, String defaultValue) {
        return settings.getOrDefault(key, defaultValue);
    }

    /**
     * Reads a boolean setting, accepting "true" in any case.
     *
     * @param key setting key
     * @param defaultValue value used when the key is absent
     * @return parsed flag
     */
    public boolean getFlag(String key, boolean defaultValue) {
        String value = settings.get(key);
        return value == null ? defaultValue : Boolean.parseBoolean(value.trim());
    }
}
