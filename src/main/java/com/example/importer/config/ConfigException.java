package com.example.importer.config;

/**
 * Invalid run configuration. Raised before any file is processed and fatal to the whole run.
 */
public class ConfigException extends RuntimeException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
