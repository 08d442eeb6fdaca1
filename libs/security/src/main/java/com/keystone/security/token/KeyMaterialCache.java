package com.keystone.security.token;

import com.keystone.observability.MetricFactory;
import com.keystone.observability.SensitiveDataRedactor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the identity provider's signing keys.
 * <p>
 * The cached {@link Snapshot} is replaced wholesale, never edited. A snapshot older than
 * the TTL is refreshed on the next lookup; concurrent callers that find it stale join the
 * one in-flight fetch instead of issuing their own. A failed fetch falls back to the last
 * snapshot while it is younger than the staleness budget, and fails closed after that.
 * <p>
 * A lookup for an unknown {@code kid} forces one refresh, but only when the last fetch
 * attempt, successful or not, is older than the minimum refresh interval. A lookup never
 * makes more than one fetch attempt.
 */
public class KeyMaterialCache {

    private static final Logger log = LoggerFactory.getLogger(KeyMaterialCache.class);

    public static final Duration DEFAULT_TTL = Duration.ofMinutes(10);
    public static final Duration DEFAULT_STALENESS_BUDGET = Duration.ofHours(1);
    public static final Duration DEFAULT_MIN_REFRESH_INTERVAL = Duration.ofSeconds(30);

    /**
     * An immutable copy of the key set and when it was fetched.
     */
    public record Snapshot(List<SigningKey> keys, Instant fetchedAt) {

        public Snapshot {
            keys = List.copyOf(keys);
        }

        public Optional<SigningKey> find(String kid) {
            return keys.stream().filter(k -> k.kid().equals(kid)).findFirst();
        }
    }

    private final KeySetSource source;
    private final Clock clock;
    private final Duration ttl;
    private final Duration stalenessBudget;
    private final Duration minRefreshInterval;
    private final MetricFactory metrics;

    private final AtomicReference<Snapshot> current = new AtomicReference<>();
    private final AtomicReference<CompletableFuture<Snapshot>> inFlight = new AtomicReference<>();
    private final AtomicReference<Instant> lastAttempt = new AtomicReference<>();

    public KeyMaterialCache(KeySetSource source, Clock clock, MetricFactory metrics) {
        this(source, clock, DEFAULT_TTL, DEFAULT_STALENESS_BUDGET, DEFAULT_MIN_REFRESH_INTERVAL, metrics);
    }

    public KeyMaterialCache(KeySetSource source, Clock clock, Duration ttl, Duration stalenessBudget,
                            Duration minRefreshInterval, MetricFactory metrics) {
        if (source == null || clock == null) {
            throw new IllegalArgumentException("source and clock must not be null");
        }
        this.source = source;
        this.clock = clock;
        this.ttl = ttl;
        this.stalenessBudget = stalenessBudget;
        this.minRefreshInterval = minRefreshInterval;
        this.metrics = metrics;
    }

    /**
     * Finds the signing key with the given id, refreshing the key set when needed.
     *
     * @param kid key id from the token header
     * @return the key, or empty if the (possibly refreshed) key set does not contain it
     * @throws KeySetUnavailableException if no usable key set can be obtained
     */
    public Optional<SigningKey> find(String kid) {
        Snapshot snapshot = freshSnapshot();
        Optional<SigningKey> key = snapshot.find(kid);
        if (key.isPresent()) {
            return key;
        }
        if (!attemptOlderThan(minRefreshInterval)) {
            return Optional.empty();
        }
        log.info("Unknown signing key id '{}', refreshing key set", kid);
        return refresh().find(kid);
    }

    /**
     * The current snapshot, refreshed first if it is missing or older than the TTL.
     */
    public Snapshot freshSnapshot() {
        Snapshot snapshot = current.get();
        if (snapshot != null && !isOlderThan(snapshot, ttl)) {
            return snapshot;
        }
        return refresh();
    }

    /**
     * The cached snapshot without triggering a fetch.
     */
    public Optional<Snapshot> peek() {
        return Optional.ofNullable(current.get());
    }

    /**
     * Fetches the key set now, or joins a fetch that is already running.
     */
    public Snapshot refresh() {
        CompletableFuture<Snapshot> mine = new CompletableFuture<>();
        CompletableFuture<Snapshot> running = inFlight.compareAndExchange(null, mine);
        if (running != null) {
            return awaitOrFallback(running);
        }

        lastAttempt.set(clock.instant());
        try {
            Snapshot fetched = new Snapshot(source.fetch(), clock.instant());
            current.set(fetched);
            record("success");
            mine.complete(fetched);
        } catch (RuntimeException e) {
            mine.completeExceptionally(e);
        } finally {
            inFlight.compareAndSet(mine, null);
        }
        return awaitOrFallback(mine);
    }

    private Snapshot awaitOrFallback(CompletableFuture<Snapshot> fetch) {
        try {
            return fetch.join();
        } catch (CompletionException e) {
            return fallback(e.getCause() != null ? e.getCause() : e);
        }
    }

    private Snapshot fallback(Throwable failure) {
        Snapshot last = current.get();
        if (last != null && !isOlderThan(last, stalenessBudget)) {
            log.warn("Key set refresh failed, using keys fetched at {}: {}", last.fetchedAt(),
                    SensitiveDataRedactor.scrub(failure.getMessage()));
            record("fallback");
            return last;
        }
        log.error("Key set refresh failed and no usable cached keys remain: {}",
                SensitiveDataRedactor.scrub(failure.getMessage()));
        record("failure");
        if (failure instanceof KeySetUnavailableException unavailable) {
            throw unavailable;
        }
        throw new KeySetUnavailableException("Key set could not be fetched", failure);
    }

    private boolean isOlderThan(Snapshot snapshot, Duration age) {
        return !clock.instant().isBefore(snapshot.fetchedAt().plus(age));
    }

    private boolean attemptOlderThan(Duration age) {
        Instant attempted = lastAttempt.get();
        return attempted == null || !clock.instant().isBefore(attempted.plus(age));
    }

    private void record(String outcome) {
        if (metrics != null) {
            metrics.recordKeySetFetch(outcome);
        }
    }
}
