package com.keystone.gateway.config;

import com.keystone.gateway.infrastructure.web.AuthenticationInterceptor;
import com.keystone.gateway.infrastructure.web.RouteProtectionInterceptor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Registers the trust interceptors on the API. Authentication runs before route protection.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final AuthenticationInterceptor authenticationInterceptor;
    private final RouteProtectionInterceptor routeProtectionInterceptor;

    public WebConfig(
            AuthenticationInterceptor authenticationInterceptor,
            RouteProtectionInterceptor routeProtectionInterceptor) {
        this.authenticationInterceptor = authenticationInterceptor;
        this.routeProtectionInterceptor = routeProtectionInterceptor;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(authenticationInterceptor).addPathPatterns("/api/**").order(0);
        registry.addInterceptor(routeProtectionInterceptor).addPathPatterns("/api/**").order(1);
    }
}
