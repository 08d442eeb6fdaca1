package com.keystone.gateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.keystone.crypto.CipherEngine;
import com.keystone.crypto.MultiStageCipher;
import com.keystone.crypto.privacy.TieredFieldPrivacyEncoder;
import com.keystone.gateway.domain.InMemoryProfileDirectory;
import com.keystone.gateway.domain.ProfileDirectory;
import com.keystone.observability.MetricFactory;
import com.keystone.observability.SpanHelper;
import com.keystone.security.AuthExtractor;
import com.keystone.security.access.HttpRoleLookupClient;
import com.keystone.security.access.RoleLookupClient;
import com.keystone.security.access.RouteProtector;
import com.keystone.security.access.SuperAdminKeyVerifier;
import com.keystone.security.token.HttpKeySetSource;
import com.keystone.security.token.KeyMaterialCache;
import com.keystone.security.token.KeySetSource;
import com.keystone.security.token.TokenVerifier;
import com.keystone.sharing.DataSharingRequestManager;
import com.keystone.sharing.InMemorySharingRequestStore;
import com.keystone.sharing.RequestKeyGenerator;
import com.keystone.sharing.SharingRequestStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Wires the trust-layer libraries into Spring beans.
 *
 * <p>The libraries stay framework-free; every collaborator (clock, HTTP client, meter
 * registry, tracer) is handed in here.
 */
@Configuration
public class TrustLayerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, TrustLayerProperties properties) {
        return new MetricFactory(registry, properties.serviceName());
    }

    @Bean
    public SpanHelper spanHelper(TrustLayerProperties properties) {
        return new SpanHelper(GlobalOpenTelemetry.getTracer("keystone." + properties.serviceName()));
    }

    // --- token verification ---

    @Bean
    public KeySetSource keySetSource(
            RestClient.Builder builder, TrustLayerProperties properties, SpanHelper spanHelper) {
        RestClient client = builder.requestFactory(requestFactory(properties)).build();
        return new HttpKeySetSource(client, properties.jwksUrl(), spanHelper);
    }

    @Bean
    public KeyMaterialCache keyMaterialCache(
            KeySetSource source, Clock clock, TrustLayerProperties properties, MetricFactory metrics) {
        return new KeyMaterialCache(
                source,
                clock,
                properties.keyCacheTtl(),
                properties.keyStalenessBudget(),
                properties.keyMinRefreshInterval(),
                metrics);
    }

    @Bean
    public TokenVerifier tokenVerifier(
            KeyMaterialCache keys, TrustLayerProperties properties, Clock clock) {
        return new TokenVerifier(keys, properties.legacySecret(), clock);
    }

    @Bean
    public SuperAdminKeyVerifier superAdminKeyVerifier(TrustLayerProperties properties) {
        return new SuperAdminKeyVerifier(properties.superAdminApiKey());
    }

    @Bean
    public AuthExtractor authExtractor(TokenVerifier verifier, SuperAdminKeyVerifier serviceKeys) {
        return new AuthExtractor(verifier, serviceKeys);
    }

    // --- route protection ---

    @Bean
    public RoleLookupClient roleLookupClient(
            RestClient.Builder builder,
            TrustLayerProperties properties,
            SpanHelper spanHelper,
            MetricFactory metrics) {
        RestClient client =
                builder.baseUrl(properties.accessUrl())
                        .requestFactory(requestFactory(properties))
                        .build();
        return new HttpRoleLookupClient(client, properties.superAdminApiKey(), spanHelper, metrics);
    }

    @Bean
    public RouteProtector routeProtector(RoleLookupClient roleLookup) {
        return new RouteProtector(roleLookup);
    }

    // --- confidentiality ---

    @Bean
    public CipherEngine cipherEngine() {
        return new CipherEngine();
    }

    @Bean
    public TieredFieldPrivacyEncoder tieredFieldPrivacyEncoder(
            CipherEngine engine, ObjectMapper objectMapper) {
        return new TieredFieldPrivacyEncoder(new MultiStageCipher(engine), objectMapper);
    }

    // --- data sharing ---

    @Bean
    public SharingRequestStore sharingRequestStore() {
        return new InMemorySharingRequestStore();
    }

    @Bean
    public DataSharingRequestManager dataSharingRequestManager(
            SharingRequestStore store, Clock clock, TrustLayerProperties properties) {
        return new DataSharingRequestManager(
                store, new RequestKeyGenerator(), clock, properties.sharingRequestTtl());
    }

    @Bean
    public ProfileDirectory profileDirectory() {
        return new InMemoryProfileDirectory();
    }

    private static SimpleClientHttpRequestFactory requestFactory(TrustLayerProperties properties) {
        var factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(properties.httpTimeout());
        factory.setReadTimeout(properties.httpTimeout());
        return factory;
    }
}
