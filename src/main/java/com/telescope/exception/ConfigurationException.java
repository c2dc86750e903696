package com.telescope.exception;

/**
 * Raised when a telescope or atmosphere is built from parameters outside their valid domain.
 * Nothing is ever computed from an invalid configuration.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
