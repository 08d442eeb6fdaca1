package com.keystone.security.access;

import com.keystone.observability.MetricFactory;
import com.keystone.observability.SpanHelper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Role lookup over HTTP: {@code GET /access/{customerId}} with the service key header,
 * answering {@code {"roles": [...]}}. A 404 means the customer has no roles.
 * <p>
 * The {@link RestClient} is expected to carry the base URL and bounded timeouts. Without a
 * service key the header is omitted.
 */
public class HttpRoleLookupClient implements RoleLookupClient {

    private static final Logger log = LoggerFactory.getLogger(HttpRoleLookupClient.class);

    public static final String SERVICE_KEY_HEADER = "X-Service-Key";

    record RolesResponse(List<String> roles) {
    }

    private final RestClient restClient;
    private final String serviceKey;
    private final SpanHelper spanHelper;
    private final MetricFactory metrics;

    public HttpRoleLookupClient(RestClient restClient, String serviceKey, SpanHelper spanHelper, MetricFactory metrics) {
        this.restClient = restClient;
        this.serviceKey = serviceKey;
        this.spanHelper = spanHelper;
        this.metrics = metrics;
    }

    @Override
    public Set<String> rolesFor(String customerId) {
        return metrics.timer(MetricFactory.ROLE_LOOKUP_DURATION, "Role lookup latency")
                .record(() -> spanHelper.inClientSpan("role.lookup", Map.of("customer.lookup.id", customerId),
                        () -> fetch(customerId)));
    }

    private Set<String> fetch(String customerId) {
        RolesResponse response;
        try {
            response = restClient.get()
                    .uri("/access/{customerId}", customerId)
                    .headers(headers -> {
                        if (serviceKey != null && !serviceKey.isBlank()) {
                            headers.set(SERVICE_KEY_HEADER, serviceKey);
                        }
                    })
                    .retrieve()
                    .body(RolesResponse.class);
        } catch (HttpClientErrorException.NotFound e) {
            log.debug("No access record for customer {}", customerId);
            return Set.of();
        } catch (RestClientException e) {
            throw new RoleLookupException("Role lookup for customer " + customerId + " failed", e);
        }
        if (response == null || response.roles() == null) {
            return Set.of();
        }
        return Set.copyOf(response.roles());
    }
}
