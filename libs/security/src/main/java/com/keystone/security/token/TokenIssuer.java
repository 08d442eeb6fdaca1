package com.keystone.security.token;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JOSEObjectType;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSSigner;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jose.crypto.RSASSASigner;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.KeyUse;
import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jose.jwk.gen.RSAKeyGenerator;
import com.nimbusds.jwt.SignedJWT;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.UUID;

/**
 * Signs tokens for the identity-provider role.
 * <p>
 * Tokens are compact JWS ({@code header.payload.signature}, unpadded base64url) signed
 * RS256 with the configured private key; the header carries the key's {@code kid}.
 * Missing {@code jti}, {@code csrf} and {@code iat} values are filled in.
 */
public class TokenIssuer {

    private final RSAKey signingKey;
    private final Clock clock;

    /**
     * @param signingKey RSA key pair with a key id
     * @param clock      time source for {@code iat}
     */
    public TokenIssuer(RSAKey signingKey, Clock clock) {
        if (signingKey == null || !signingKey.isPrivate()) {
            throw new IllegalArgumentException("signingKey must include the private key");
        }
        if (signingKey.getKeyID() == null) {
            throw new IllegalArgumentException("signingKey must have a key id");
        }
        this.signingKey = signingKey;
        this.clock = clock;
    }

    /**
     * Generates a fresh 2048-bit RSA signing key.
     */
    public static RSAKey generateSigningKey(String kid) {
        try {
            return new RSAKeyGenerator(2048)
                    .keyID(kid)
                    .keyUse(KeyUse.SIGNATURE)
                    .algorithm(JWSAlgorithm.RS256)
                    .generate();
        } catch (JOSEException e) {
            throw new IllegalStateException("RSA key generation failed", e);
        }
    }

    /**
     * Signs claims with RS256.
     *
     * @param claims claims to sign; {@code expiresAt} is required
     * @return the compact token
     */
    public String issue(TokenClaims claims) {
        JWSHeader header = new JWSHeader.Builder(JWSAlgorithm.RS256)
                .keyID(signingKey.getKeyID())
                .type(JOSEObjectType.JWT)
                .build();
        try {
            return sign(header, complete(claims), new RSASSASigner(signingKey));
        } catch (JOSEException e) {
            throw new IllegalStateException("RS256 signing failed", e);
        }
    }

    /**
     * Signs claims with the legacy HS256 scheme, for compatibility tooling only.
     *
     * @param claims claims to sign
     * @param secret shared secret of at least 32 bytes
     * @return the compact token
     */
    public String issueLegacy(TokenClaims claims, String secret) {
        JWSHeader header = new JWSHeader.Builder(JWSAlgorithm.HS256).type(JOSEObjectType.JWT).build();
        try {
            return sign(header, complete(claims), new MACSigner(secret.getBytes(StandardCharsets.UTF_8)));
        } catch (JOSEException e) {
            throw new IllegalArgumentException("Legacy secret cannot sign HS256 tokens", e);
        }
    }

    /**
     * The public half of the signing key, as published at {@code /.well-known/jwks.json}.
     */
    public JWKSet jwkSet() {
        return new JWKSet(signingKey.toPublicJWK());
    }

    public String keyId() {
        return signingKey.getKeyID();
    }

    private TokenClaims complete(TokenClaims claims) {
        if (claims.expiresAt() == null) {
            throw new IllegalArgumentException("claims must carry an expiry");
        }
        TokenClaims completed = claims;
        if (claims.issuedAt() == null) {
            completed = completed.withTimes(clock.instant(), claims.expiresAt());
        }
        if (claims.jwtId() == null || claims.csrf() == null) {
            completed = completed.withIds(
                    claims.jwtId() != null ? claims.jwtId() : UUID.randomUUID().toString(),
                    claims.csrf() != null ? claims.csrf() : UUID.randomUUID().toString());
        }
        return completed;
    }

    private static String sign(JWSHeader header, TokenClaims claims, JWSSigner signer)
            throws JOSEException {
        SignedJWT jwt = new SignedJWT(header, claims.toClaimsSet());
        jwt.sign(signer);
        return jwt.serialize();
    }
}
