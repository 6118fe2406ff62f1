package kubi.core.model.auth;

/**
 * Per-request authentication failure.
 *
 * <p>Mapped to a 401 response with a generic message. The {@link #reason()} is
 * for logs only.
 */
public class KubiAuthenticationException extends RuntimeException {

    private final AuthFailure reason;

    public KubiAuthenticationException(AuthFailure reason) {
        super(reason.name());
        this.reason = reason;
    }

    public KubiAuthenticationException(AuthFailure reason, Throwable cause) {
        super(reason.name(), cause);
        this.reason = reason;
    }

    public AuthFailure reason() {
        return reason;
    }
}
