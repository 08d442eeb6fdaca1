package com.keystone.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

/**
 * Factory for the trust layer's Micrometer meters.
 * <p>
 * Every meter carries a {@code service} tag. Failure counters are tagged with the
 * fine-grained error kind, which is deliberately kept out of HTTP responses; metrics and
 * logs are the only place it surfaces.
 */
public final class MetricFactory {

    /** Tag key for service name. */
    public static final String TAG_SERVICE = "service";

    /** Tag key for a failure kind (e.g. TOKEN_EXPIRED). */
    public static final String TAG_KIND = "kind";

    /** Tag key for an outcome (success, failure, fallback). */
    public static final String TAG_OUTCOME = "outcome";

    /** Authentication and authorization failures, tagged by kind. */
    public static final String AUTH_FAILURES = "keystone.auth.failures";

    /** Key-set fetches, tagged by outcome. */
    public static final String JWKS_FETCHES = "keystone.jwks.fetches";

    /** Responses passed through the confidentiality wrapper, tagged by outcome. */
    public static final String RESPONSES_ENCRYPTED = "keystone.responses.encrypted";

    /** Latency of outbound role lookups. */
    public static final String ROLE_LOOKUP_DURATION = "keystone.role.lookup.duration";

    private final MeterRegistry registry;
    private final String serviceName;

    /**
     * Creates a MetricFactory bound to the given registry and service name.
     *
     * @param registry    the Micrometer meter registry
     * @param serviceName logical service name included as a default tag
     */
    public MetricFactory(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
    }

    /**
     * Creates (or returns the existing) counter with the service tag plus extra tags.
     *
     * @param name        metric name
     * @param description human-readable description
     * @param tags        additional tags (key-value pairs)
     * @return the counter
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    /**
     * Creates (or returns the existing) timer with the service tag plus extra tags.
     */
    public Timer timer(String name, String description, String... tags) {
        return Timer.builder(name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    /**
     * Counts one authentication or authorization failure of the given kind.
     */
    public void recordAuthFailure(String kind) {
        counter(AUTH_FAILURES, "Rejected requests by failure kind", TAG_KIND, kind).increment();
    }

    /**
     * Counts one key-set fetch with the given outcome.
     */
    public void recordKeySetFetch(String outcome) {
        counter(JWKS_FETCHES, "Key-set endpoint fetches", TAG_OUTCOME, outcome).increment();
    }

    /**
     * Counts one response that was encrypted ({@code true}) or passed through ({@code false}).
     */
    public void recordResponseEncryption(boolean encrypted) {
        counter(RESPONSES_ENCRYPTED, "Responses seen by the confidentiality wrapper",
                TAG_OUTCOME, encrypted ? "encrypted" : "skipped").increment();
    }

    private Tags baseTags(String... extraTags) {
        Tags tags = Tags.of(TAG_SERVICE, serviceName);
        if (extraTags.length > 0) {
            tags = tags.and(extraTags);
        }
        return tags;
    }
}
