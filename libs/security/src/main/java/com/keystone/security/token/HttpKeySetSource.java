package com.keystone.security.token;

import com.keystone.observability.SpanHelper;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.KeyUse;
import com.nimbusds.jose.jwk.RSAKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.text.ParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Fetches the identity provider's JWKS document ({@code {issuer}/.well-known/jwks.json}).
 * <p>
 * Only RSA keys meant for signatures with {@code RS256} (or no declared algorithm) are kept.
 * Timeouts come from the {@link RestClient}'s request factory.
 */
public class HttpKeySetSource implements KeySetSource {

    private static final Logger log = LoggerFactory.getLogger(HttpKeySetSource.class);

    public static final String WELL_KNOWN_PATH = "/.well-known/jwks.json";

    private final RestClient restClient;
    private final String jwksUrl;
    private final SpanHelper spanHelper;

    public HttpKeySetSource(RestClient restClient, String jwksUrl, SpanHelper spanHelper) {
        if (jwksUrl == null || jwksUrl.isBlank()) {
            throw new IllegalArgumentException("jwksUrl must not be blank");
        }
        this.restClient = restClient;
        this.jwksUrl = jwksUrl;
        this.spanHelper = spanHelper;
    }

    /**
     * Builds the conventional JWKS location for an issuer base URL.
     */
    public static String jwksUrlFor(String issuer) {
        String base = issuer.endsWith("/") ? issuer.substring(0, issuer.length() - 1) : issuer;
        return base + WELL_KNOWN_PATH;
    }

    @Override
    public List<SigningKey> fetch() {
        return spanHelper.inClientSpan("jwks.fetch", Map.of("http.url", jwksUrl), this::fetchNow);
    }

    private List<SigningKey> fetchNow() {
        String body;
        try {
            body = restClient.get().uri(jwksUrl).retrieve().body(String.class);
        } catch (RestClientException e) {
            throw new KeySetUnavailableException("Key set request to " + jwksUrl + " failed", e);
        }
        if (body == null || body.isBlank()) {
            throw new KeySetUnavailableException("Key set response from " + jwksUrl + " was empty");
        }

        JWKSet jwkSet;
        try {
            jwkSet = JWKSet.parse(body);
        } catch (ParseException e) {
            throw new KeySetUnavailableException("Key set from " + jwksUrl + " is not a valid JWKS", e);
        }

        List<SigningKey> keys = new ArrayList<>();
        for (JWK jwk : jwkSet.getKeys()) {
            if (!(jwk instanceof RSAKey rsaKey) || rsaKey.getKeyID() == null) {
                log.debug("Skipping non-RSA or unnamed key in key set");
                continue;
            }
            if (rsaKey.getKeyUse() != null && !KeyUse.SIGNATURE.equals(rsaKey.getKeyUse())) {
                continue;
            }
            if (rsaKey.getAlgorithm() != null && !JWSAlgorithm.RS256.equals(rsaKey.getAlgorithm())) {
                continue;
            }
            keys.add(SigningKey.from(rsaKey));
        }
        log.info("Fetched {} signing key(s) from {}", keys.size(), jwksUrl);
        return List.copyOf(keys);
    }
}
