package kubi.core.model.common;

/**
 * Thrown at startup when configuration is missing or malformed.
 *
 * <p>Aborts startup. The service never runs half-configured.
 */
public class ConfigurationInvalidException extends RuntimeException {

    public ConfigurationInvalidException(String message) {
        super(message);
    }

    public ConfigurationInvalidException(String message, Throwable cause) {
        super(message, cause);
    }
}
