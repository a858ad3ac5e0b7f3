package io.tributary.distributor.calc;

/**
 * Raised when the supplied loads and beams cannot be distributed at all.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
