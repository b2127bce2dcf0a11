package com.hcltech.dawg.common;

import java.util.Objects;
import java.util.Properties;

/**
 * Abstraction for reading environment variables or configuration values.
 * <p>
 * Used to avoid direct calls to {@link System#getenv(String)} in code,
 * so that unit tests can provide their own environment source.
 */
@FunctionalInterface
public interface IEnvGetter {
    /**
     * Default implementation backed by {@link System#getenv(String)}.
     */
    IEnvGetter env = System::getenv;

    /**
     * Returns the value of the given variable, or {@code null} if unset.
     */
    String get(String name);

    /**
     * Reads dotted property keys ({@code dawg.lexicon}) from a {@link Properties} instance.
     */
    static IEnvGetter fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties");
        return properties::getProperty;
    }

    /**
     * Looks a key up in {@code this} first and falls back to {@code other} when unset or blank.
     */
    default IEnvGetter orElse(IEnvGetter other) {
        Objects.requireNonNull(other, "other");
        return name -> {
            String value = get(name);
            return (value != null && !value.isBlank()) ? value : other.get(name);
        };
    }

    /**
     * Maps a dotted property key to its environment variable name: {@code dawg.progress.step -> DAWG_PROGRESS_STEP}.
     */
    static String toEnvKey(String key) {
        return key.toUpperCase().replace('.', '_').replace('-', '_');
    }

    // ------------------------------------------------------------------------
    // Required getters (throw if missing or blank)
    // ------------------------------------------------------------------------

    /**
     * Returns the value of the variable, throwing if missing or blank.
     */
    static String getString(IEnvGetter env, String name) {
        String value = env.get(name);
        if (value == null || value.isBlank()) {
            throw new IllegalStateException("Missing required environment variable: " + name);
        }
        return value;
    }

    // ------------------------------------------------------------------------
    // Optional getters (default fallback)
    // ------------------------------------------------------------------------

    static boolean getBooleanOr(IEnvGetter env, String name, boolean defaultValue) {
        String value = env.get(name);
        return (value != null && !value.isBlank()) ? Boolean.parseBoolean(value.trim()) : defaultValue;
    }

    static double getDoubleOr(IEnvGetter env, String name, double defaultValue) {
        String value = env.get(name);
        if (value == null || value.isBlank()) return defaultValue;
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid number for environment variable: " + name + " = '" + value + "'", e);
        }
    }
}
