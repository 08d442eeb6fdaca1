package com.keystone.gateway.infrastructure.web;

import com.keystone.observability.CorrelationContextHolder;
import com.keystone.observability.SensitiveDataRedactor;
import com.keystone.security.AuthExtractor;
import com.keystone.security.AuthResult;
import com.keystone.security.BearerTokenExtractor;
import com.keystone.security.access.AccessDeniedException;
import com.keystone.security.access.AdminLevel;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.util.WebUtils;

/**
 * Authenticates requests to handlers marked {@link Authenticated} or {@link
 * RequiresAdminLevel}.
 *
 * <p>The verified {@link AuthResult} is stored under {@link #PRINCIPAL_ATTRIBUTE}, where
 * controllers ({@code @RequestAttribute}) and {@link ResponseEncryptionFilter} pick it up.
 * Verification failures propagate to {@link GlobalExceptionHandler}; a missing credential is
 * {@code UNAUTHENTICATED}.
 */
@Component
public class AuthenticationInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(AuthenticationInterceptor.class);

    public static final String PRINCIPAL_ATTRIBUTE = "com.keystone.gateway.infrastructure.web.AuthenticationInterceptor.principal";

    private final AuthExtractor authExtractor;

    public AuthenticationInterceptor(AuthExtractor authExtractor) {
        this.authExtractor = authExtractor;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!(handler instanceof HandlerMethod method) || !requiresPrincipal(method)) {
            return true;
        }

        Cookie cookie = WebUtils.getCookie(request, BearerTokenExtractor.AUTH_COOKIE);
        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        AuthResult principal = authExtractor
                .authenticate(cookie != null ? cookie.getValue() : null, authorization)
                .orElseThrow(() -> new AccessDeniedException(
                        AccessDeniedException.Reason.UNAUTHENTICATED, requiredLevel(method)));

        request.setAttribute(PRINCIPAL_ATTRIBUTE, principal);
        CorrelationContextHolder.bindCustomer(principal.customerId());
        log.debug("Authenticated {} via {} ({})", principal.customerId(), principal.transport(),
                SensitiveDataRedactor.hint(principal.rawToken()));
        return true;
    }

    /** The principal stored for this request, or null. */
    public static AuthResult principalOf(HttpServletRequest request) {
        return (AuthResult) request.getAttribute(PRINCIPAL_ATTRIBUTE);
    }

    static AdminLevel requiredLevel(HandlerMethod method) {
        RequiresAdminLevel level = method.getMethodAnnotation(RequiresAdminLevel.class);
        if (level == null) {
            level = AnnotatedElementUtils.findMergedAnnotation(method.getBeanType(), RequiresAdminLevel.class);
        }
        return level != null ? level.value() : null;
    }

    private static boolean requiresPrincipal(HandlerMethod method) {
        return requiredLevel(method) != null
                || method.hasMethodAnnotation(Authenticated.class)
                || AnnotatedElementUtils.hasAnnotation(method.getBeanType(), Authenticated.class);
    }
}
