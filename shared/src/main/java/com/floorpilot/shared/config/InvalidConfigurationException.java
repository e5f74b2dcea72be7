package com.floorpilot.shared.config;

/**
 * Raised when a factory or learning configuration cannot produce a
 * well-defined simulation. Always thrown at construction time.
 */
public class InvalidConfigurationException extends IllegalArgumentException {

    public InvalidConfigurationException(String message) {
        super(message);
    }
}
