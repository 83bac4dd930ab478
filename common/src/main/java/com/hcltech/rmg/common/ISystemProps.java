package com.hcltech.rmg.common;

import java.util.Map;
import java.util.Optional;

/**
 * Read access to JVM system properties.
 * <p>
 * Code asks this interface instead of calling {@link System#getProperty(String)} so tests can
 * supply their own properties with {@link #mock(Map)}.
 */
public interface ISystemProps {
    String getProperty(String key);

    String getProperty(String key, String defaultValue);

    /**
     * Returns the long value of the property, or empty when unset or blank.
     *
     * @throws IllegalStateException if the property is set but not a valid long
     */
    static Optional<Long> getOptionalLong(ISystemProps props, String key) {
        String value = props.getProperty(key);
        if (value == null || value.isBlank()) return Optional.empty();
        try {
            return Optional.of(Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid long for system property: " + key + " = '" + value + "'", e);
        }
    }

    static ISystemProps mock(Map<String, String> map) {
        return new ISystemProps() {
            @Override
            public String getProperty(String key) {
                return map.get(key);
            }

            @Override
            public String getProperty(String key, String defaultValue) {
                return map.getOrDefault(key, defaultValue);
            }
        };
    }

    ISystemProps real = new ISystemProps() {
        @Override
        public String getProperty(String key) {
            return System.getProperty(key);
        }

        @Override
        public String getProperty(String key, String defaultValue) {
            return System.getProperty(key, defaultValue);
        }
    };
}
