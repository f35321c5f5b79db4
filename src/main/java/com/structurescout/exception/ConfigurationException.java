package com.structurescout.exception;

import java.util.Map;

/**
 * A configured value is missing or out of range. Thrown while the beans are being built so the
 * application refuses to start instead of trading with a bad limit.
 */
public class ConfigurationException extends BaseException {

    public ConfigurationException(String property, Object value, String reason) {
        super(
                ErrorCode.CONFIGURATION_ERROR,
                String.format("Invalid configuration %s=%s: %s", property, value, reason),
                detailsOf(property, value));
    }

    private static Map<String, Object> detailsOf(String property, Object value) {
        return Map.of("property", property, "value", String.valueOf(value));
    }
}
