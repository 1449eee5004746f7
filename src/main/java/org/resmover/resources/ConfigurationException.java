package org.resmover.resources;

/**
 * Thrown when a move or remove run is configured inconsistently, before any file is touched.
 */
public class ConfigurationException extends IllegalArgumentException {

    public ConfigurationException(String message) {
        super(message);
    }
}
