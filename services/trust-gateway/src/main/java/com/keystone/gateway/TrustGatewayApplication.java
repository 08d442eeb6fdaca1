package com.keystone.gateway;

import com.keystone.gateway.config.TrustLayerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Keystone Trust Gateway: a reference service running every trust-layer component in one
 * HTTP pipeline.
 *
 * <p>Request path:
 *
 * <ol>
 *   <li>{@code CorrelationIdFilter} binds the correlation id to MDC
 *   <li>{@code ResponseEncryptionFilter} buffers the response
 *   <li>{@code AuthenticationInterceptor} verifies the cookie or bearer credential
 *   <li>{@code RouteProtectionInterceptor} enforces admin levels
 *   <li>controllers; errors become RFC 7807 problems in {@code GlobalExceptionHandler}
 * </ol>
 */
@SpringBootApplication
@EnableConfigurationProperties(TrustLayerProperties.class)
public class TrustGatewayApplication {

    private static final Logger log = LoggerFactory.getLogger(TrustGatewayApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(TrustGatewayApplication.class, args);
        log.info("Keystone Trust Gateway started");
    }
}
