package com.pulselog.core;

import com.pulselog.api.LogConfigurationException;

import java.io.IOException;
import java.io.StringReader;
import java.util.Properties;

/**
 * Flat key/value view over a logger configuration string.
 *
 * <pre>
 *   receiver = FILE
 *   level = INFO
 *   file = logs/app.log
 *   rotate.mode = size
 *   rotate.size = 100
 * </pre>
 *
 * One {@code key = value} per line, {@link Properties} syntax. Values may be
 * wrapped in double quotes.
 */
public final class LogConfig {

    private final Properties properties;

    private LogConfig(Properties properties) {
        this.properties = properties;
    }

    public static LogConfig parse(String config) {
        Properties properties = new Properties();
        try {
            properties.load(new StringReader(config));
        } catch (IOException | IllegalArgumentException e) {
            throw new LogConfigurationException("unable to parse logger config", e);
        }
        return new LogConfig(properties);
    }

    /**
     * @return the value, or null when the key is absent
     */
    public String string(String key) {
        String value = properties.getProperty(key);
        return value == null ? null : unquote(value.trim());
    }

    public String stringDefault(String key, String defaultValue) {
        String value = string(key);
        return value == null ? defaultValue : value;
    }

    public int intDefault(String key, int defaultValue) {
        String value = string(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new LogConfigurationException("'" + key + "' must be an integer: " + value, e);
        }
    }

    public boolean boolDefault(String key, boolean defaultValue) {
        String value = string(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        if ("true".equalsIgnoreCase(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new LogConfigurationException("'" + key + "' must be true or false: " + value);
    }

    private static String unquote(String value) {
        if (value.length() >= 2 && value.charAt(0) == '"' && value.charAt(value.length() - 1) == '"') {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }
}
