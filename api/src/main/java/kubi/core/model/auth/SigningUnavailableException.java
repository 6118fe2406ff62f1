package kubi.core.model.auth;

/**
 * Thrown when tokens cannot be signed because no usable key is loaded.
 *
 * <p>Startup validation makes this unreachable while the service is serving.
 */
public class SigningUnavailableException extends RuntimeException {

    public SigningUnavailableException(String message) {
        super(message);
    }

    public SigningUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
