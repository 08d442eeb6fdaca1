package com.keystone.security.token;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jose.crypto.RSASSAVerifier;

import java.nio.charset.StandardCharsets;

import static com.keystone.security.token.TokenVerificationException.Reason.INVALID_SIGNATURE;
import static com.keystone.security.token.TokenVerificationException.Reason.UNKNOWN_SIGNING_KEY;

/**
 * How a token's signature is checked, chosen once from its {@code alg} header.
 */
public sealed interface SigningScheme permits SigningScheme.Rs256, SigningScheme.Hs256 {

    /**
     * Produces the verifier for a specific token header.
     *
     * @throws TokenVerificationException if no key can be selected for the header
     */
    JWSVerifier verifierFor(JWSHeader header);

    /**
     * Primary scheme: RSA signature against the published key set.
     */
    record Rs256(KeyMaterialCache keys) implements SigningScheme {

        @Override
        public JWSVerifier verifierFor(JWSHeader header) {
            String kid = header.getKeyID();
            if (kid == null || kid.isBlank()) {
                throw new TokenVerificationException(UNKNOWN_SIGNING_KEY, "Token header has no kid");
            }
            if (keys == null) {
                throw new TokenVerificationException(UNKNOWN_SIGNING_KEY, "No key set is configured");
            }
            SigningKey key;
            try {
                key = keys.find(kid).orElseThrow(() ->
                        new TokenVerificationException(UNKNOWN_SIGNING_KEY, "No signing key with kid " + kid));
            } catch (KeySetUnavailableException e) {
                throw new TokenVerificationException(UNKNOWN_SIGNING_KEY, "Key set is unavailable", e);
            }
            return new RSASSAVerifier(key.toPublicKey());
        }
    }

    /**
     * Legacy compatibility scheme: HMAC with a shared secret. A missing secret rejects every
     * token rather than skipping the check.
     */
    record Hs256(String secret) implements SigningScheme {

        @Override
        public JWSVerifier verifierFor(JWSHeader header) {
            if (secret == null || secret.isBlank()) {
                throw new TokenVerificationException(INVALID_SIGNATURE, "Legacy signing secret is not configured");
            }
            try {
                return new MACVerifier(secret.getBytes(StandardCharsets.UTF_8));
            } catch (JOSEException e) {
                throw new TokenVerificationException(INVALID_SIGNATURE, "Legacy signing secret is unusable", e);
            }
        }

        @Override
        public String toString() {
            return "Hs256[secret=" + (secret == null ? "<unset>" : "<set>") + "]";
        }
    }
}
