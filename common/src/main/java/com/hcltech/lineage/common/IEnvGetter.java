package com.hcltech.lineage.common;

/**
 * Abstraction for reading environment variables.
 * <p>
 * Used to avoid direct calls to {@link System#getenv(String)} so that tests can supply their own values.
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

    /**
     * Only the case-insensitive string "true" is considered true; a missing or blank value gives the default.
     */
    static boolean getBooleanOr(IEnvGetter env, String name, boolean defaultValue) {
        String value = env.get(name);
        return (value != null && !value.isBlank()) ? Boolean.parseBoolean(value.trim()) : defaultValue;
    }

    /**
     * Parses the variable as a constant of {@code type}, ignoring case.
     *
     * @throws IllegalStateException if the value names no constant
     */
    static <E extends Enum<E>> E getEnumOr(IEnvGetter env, String name, Class<E> type, E defaultValue) {
        String value = env.get(name);
        if (value == null || value.isBlank()) return defaultValue;
        for (E constant : type.getEnumConstants()) {
            if (constant.name().equalsIgnoreCase(value.trim())) return constant;
        }
        throw new IllegalStateException("Invalid value for environment variable: " + name + " = '" + value + "'");
    }
}
