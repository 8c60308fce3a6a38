package com.entity.dedup.api;

/**
 * Thrown when a deduplicator is configured inconsistently. Always raised before any record
 * is scored, so a run either starts with a valid configuration or not at all.
 */
public class ConfigurationException extends IllegalArgumentException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
