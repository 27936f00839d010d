package com.airouter.config;

/**
 * Raised at startup when the provider registry cannot be built. Never thrown at call time.
 */
public class RouterConfigurationException extends RuntimeException {

    public RouterConfigurationException(String message) {
        super(message);
    }
}
