package com.keystone.gateway.infrastructure.web;

import com.keystone.security.access.AdminLevel;
import com.keystone.security.access.RouteProtector;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Enforces {@link RequiresAdminLevel} with the {@link RouteProtector}. Registered after
 * {@link AuthenticationInterceptor}, so the principal is already in place.
 */
@Component
public class RouteProtectionInterceptor implements HandlerInterceptor {

    private final RouteProtector routeProtector;

    public RouteProtectionInterceptor(RouteProtector routeProtector) {
        this.routeProtector = routeProtector;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!(handler instanceof HandlerMethod method)) {
            return true;
        }
        AdminLevel required = AuthenticationInterceptor.requiredLevel(method);
        if (required == null) {
            return true;
        }
        routeProtector.require(AuthenticationInterceptor.principalOf(request), required);
        return true;
    }
}
