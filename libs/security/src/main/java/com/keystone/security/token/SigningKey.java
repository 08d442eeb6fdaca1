package com.keystone.security.token;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jose.util.Base64URL;

import java.math.BigInteger;
import java.security.interfaces.RSAPublicKey;

/**
 * An RSA public key from the identity provider's key set.
 *
 * @param kid       key id matched against the token header
 * @param algorithm declared algorithm, {@code RS256} when the key set omits it
 * @param modulus   RSA modulus
 * @param exponent  RSA public exponent
 */
public record SigningKey(String kid, String algorithm, BigInteger modulus, BigInteger exponent) {

    public static final String RS256 = "RS256";

    public SigningKey {
        if (kid == null || kid.isBlank()) {
            throw new IllegalArgumentException("kid must not be blank");
        }
        if (modulus == null || exponent == null) {
            throw new IllegalArgumentException("modulus and exponent are required");
        }
        if (algorithm == null) {
            algorithm = RS256;
        }
    }

    /**
     * Builds a signing key from a JWK entry.
     */
    public static SigningKey from(RSAKey jwk) {
        String alg = jwk.getAlgorithm() != null ? jwk.getAlgorithm().getName() : RS256;
        return new SigningKey(jwk.getKeyID(), alg,
                jwk.getModulus().decodeToBigInteger(), jwk.getPublicExponent().decodeToBigInteger());
    }

    /**
     * The JCA public key for signature verification.
     */
    public RSAPublicKey toPublicKey() {
        try {
            return new RSAKey.Builder(Base64URL.encode(modulus), Base64URL.encode(exponent))
                    .keyID(kid)
                    .build()
                    .toRSAPublicKey();
        } catch (JOSEException e) {
            throw new IllegalStateException("Signing key " + kid + " is not a valid RSA public key", e);
        }
    }
}
