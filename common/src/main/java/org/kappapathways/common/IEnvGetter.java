package org.kappapathways.common;

import java.util.Arrays;
import java.util.List;

/**
 * Abstraction for reading environment variables.
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
     * Returns the value of the given environment variable, or {@code null} if unset.
     */
    String get(String name);

    static String getStringOr(IEnvGetter env, String name, String defaultValue) {
        String value = env.get(name);
        return (value != null && !value.isBlank()) ? value.trim() : defaultValue;
    }

    static boolean getBooleanOr(IEnvGetter env, String name, boolean defaultValue) {
        String value = env.get(name);
        return (value != null && !value.isBlank()) ? Boolean.parseBoolean(value.trim()) : defaultValue;
    }

    static int getIntOr(IEnvGetter env, String name, int defaultValue) {
        String value = env.get(name);
        if (value == null || value.isBlank()) return defaultValue;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid integer for environment variable: " + name + " = '" + value + "'", e);
        }
    }

    /** Case-insensitive enum lookup; an unknown constant fails naming the allowed values. */
    static <E extends Enum<E>> E getEnumOr(IEnvGetter env, String name, Class<E> type, E defaultValue) {
        String value = env.get(name);
        if (value == null || value.isBlank()) return defaultValue;
        for (E constant : type.getEnumConstants()) {
            if (constant.name().equalsIgnoreCase(value.trim())) return constant;
        }
        throw new IllegalStateException("Invalid value for environment variable: " + name + " = '" + value
                + "', expected one of " + Arrays.toString(type.getEnumConstants()));
    }

    /** Comma separated list; blank entries are dropped. */
    static List<String> getListOr(IEnvGetter env, String name, List<String> defaultValue) {
        String value = env.get(name);
        if (value == null || value.isBlank()) return defaultValue;
        return Arrays.stream(value.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();
    }
}
