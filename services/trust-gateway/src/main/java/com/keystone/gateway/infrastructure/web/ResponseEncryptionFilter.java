package com.keystone.gateway.infrastructure.web;

import com.keystone.crypto.CipherEngine;
import com.keystone.crypto.EnvelopeCodec;
import com.keystone.observability.MetricFactory;
import com.keystone.security.AuthResult;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingResponseWrapper;

/**
 * Encrypts successful JSON responses with the caller's own bearer credential.
 *
 * <p>The response is buffered; once the handler is done the body is replaced by a v5 envelope
 * ({@link EnvelopeCodec}) keyed by the raw token, with content type {@value
 * #ENVELOPE_CONTENT_TYPE} and {@code X-Encrypted: true}. Everything else passes through with
 * {@code X-Encrypted: false}:
 *
 * <ul>
 *   <li>no principal (public routes, failed authentication)
 *   <li>credential sent as the HttpOnly cookie, which the browser cannot read back
 *   <li>non-2xx status or a body that is not JSON
 * </ul>
 *
 * <p>If encryption itself fails the plaintext is dropped and the caller gets a bare 500.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class ResponseEncryptionFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(ResponseEncryptionFilter.class);

    public static final String ENCRYPTED_HEADER = "X-Encrypted";
    public static final String ENVELOPE_CONTENT_TYPE = "application/vnd.keystone.envelope";

    private final CipherEngine cipherEngine;
    private final MetricFactory metrics;

    public ResponseEncryptionFilter(CipherEngine cipherEngine, MetricFactory metrics) {
        this.cipherEngine = cipherEngine;
        this.metrics = metrics;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        var buffered = new ContentCachingResponseWrapper(response);
        filterChain.doFilter(request, buffered);

        AuthResult principal = AuthenticationInterceptor.principalOf(request);
        if (!shouldEncrypt(principal, buffered)) {
            response.setHeader(ENCRYPTED_HEADER, "false");
            metrics.recordResponseEncryption(false);
            buffered.copyBodyToResponse();
            return;
        }

        byte[] sealed;
        try {
            sealed =
                    EnvelopeCodec.encode(
                            cipherEngine.encrypt(
                                    buffered.getContentAsByteArray(), principal.rawToken(), true));
        } catch (RuntimeException e) {
            log.error("Response encryption failed for {}: {}", principal.customerId(), e.getMessage());
            response.setStatus(HttpServletResponse.SC_INTERNAL_SERVER_ERROR);
            response.setHeader(ENCRYPTED_HEADER, "false");
            response.setContentLength(0);
            return;
        }

        response.setHeader(ENCRYPTED_HEADER, "true");
        response.setContentType(ENVELOPE_CONTENT_TYPE);
        response.setContentLength(sealed.length);
        response.getOutputStream().write(sealed);
        metrics.recordResponseEncryption(true);
    }

    static boolean shouldEncrypt(AuthResult principal, ContentCachingResponseWrapper response) {
        if (principal == null || !principal.transport().callerHoldsCredential()) {
            return false;
        }
        int status = response.getStatus();
        if (status < 200 || status >= 300 || response.getContentSize() == 0) {
            return false;
        }
        return isJson(response.getContentType());
    }

    private static boolean isJson(String contentType) {
        if (contentType == null) {
            return false;
        }
        try {
            MediaType type = MediaType.parseMediaType(contentType);
            return "json".equals(type.getSubtype()) || "json".equals(type.getSubtypeSuffix());
        } catch (InvalidMediaTypeException e) {
            return false;
        }
    }
}
