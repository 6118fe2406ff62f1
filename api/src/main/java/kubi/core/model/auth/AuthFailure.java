package kubi.core.model.auth;

/**
 * Reasons a request can fail to authenticate.
 *
 * <p>These are only ever logged. Callers receive a generic 401 so the
 * response never reveals which check failed.
 */
public enum AuthFailure {
    INVALID_CREDENTIALS_FORMAT,
    AUTHENTICATION_FAILED,
    DIRECTORY_UNAVAILABLE,
    MALFORMED_TOKEN,
    INVALID_SIGNATURE,
    TOKEN_EXPIRED,
    MISSING_OR_MALFORMED_BEARER
}
