package kubi.core.model.auth;

import java.security.MessageDigest;
import java.util.Arrays;

/**
 * Symmetric secret used to sign and verify tokens with HS512.
 *
 * <p>Immutable. The bytes are copied on the way in and on the way out, and
 * {@link #toString()} never prints them.
 */
public final class SigningKey {

    /**
     * HS512 needs a key at least as long as its 512-bit output.
     */
    public static final int MIN_LENGTH_BYTES = 64;

    private final byte[] secret;

    private SigningKey(byte[] secret) {
        this.secret = secret;
    }

    /**
     * Create a signing key from raw secret bytes.
     *
     * @param secret the secret, at least {@link #MIN_LENGTH_BYTES} long
     * @return the key
     * @throws IllegalArgumentException if the secret is missing or too short
     */
    public static SigningKey of(byte[] secret) {
        if (secret == null || secret.length < MIN_LENGTH_BYTES) {
            throw new IllegalArgumentException("Signing key must be at least " + MIN_LENGTH_BYTES + " bytes");
        }
        return new SigningKey(secret.clone());
    }

    public byte[] bytes() {
        return secret.clone();
    }

    public int length() {
        return secret.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SigningKey other)) {
            return false;
        }
        return MessageDigest.isEqual(secret, other.secret);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(secret);
    }

    @Override
    public String toString() {
        return "SigningKey[" + secret.length + " bytes]";
    }
}
