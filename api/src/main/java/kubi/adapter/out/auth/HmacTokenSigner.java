package kubi.adapter.out.auth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.keys.HmacKey;
import org.jose4j.lang.JoseException;

import kubi.core.model.auth.SigningKey;
import kubi.core.model.auth.SigningUnavailableException;
import kubi.core.model.auth.TokenClaims;
import kubi.core.model.common.ServiceContext;
import kubi.core.port.out.TokenSigner;

/**
 * HS512 (HMAC with SHA-512) token signer.
 *
 * <p>Signs with the process-wide {@link SigningKey} from the {@link ServiceContext}.
 */
@ApplicationScoped
public class HmacTokenSigner implements TokenSigner {

    private static final Logger LOG = Logger.getLogger(HmacTokenSigner.class);

    private final HmacKey key;

    @Inject
    public HmacTokenSigner(ServiceContext context) {
        this(context.signingKey());
    }

    HmacTokenSigner(SigningKey signingKey) {
        this.key = signingKey == null ? null : new HmacKey(signingKey.bytes());
        if (key != null) {
            LOG.infov("HS512 token signer initialized with a {0}-byte key", signingKey.length());
        }
    }

    @Override
    public boolean isAvailable() {
        return key != null;
    }

    @Override
    public String sign(TokenClaims claims) {
        if (!isAvailable()) {
            throw new SigningUnavailableException("HMAC signing key not configured");
        }

        final var jws = new JsonWebSignature();
        jws.setPayload(JwtClaimsMapper.toJwtClaims(claims).toJson());
        jws.setKey(key);
        jws.setAlgorithmHeaderValue(AlgorithmIdentifiers.HMAC_SHA512);
        jws.setHeader("typ", "JWT");

        try {
            return jws.getCompactSerialization();
        } catch (JoseException e) {
            throw new SigningUnavailableException("Failed to sign token: " + e.getMessage(), e);
        }
    }
}
