package kubi.core.port.out;

import kubi.core.model.auth.TokenClaims;

/**
 * Port producing the signed compact form of a set of claims.
 */
public interface TokenSigner {

    /**
     * Whether the signer holds a usable key.
     */
    boolean isAvailable();

    /**
     * Sign the claims.
     *
     * @param claims the claims to embed
     * @return the JWS compact serialization
     * @throws kubi.core.model.auth.SigningUnavailableException if no usable key is loaded
     */
    String sign(TokenClaims claims);
}
