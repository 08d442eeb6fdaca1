package com.keystone.sharing;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;

/**
 * {@link SharingRequestStore} backed by a {@link ConcurrentHashMap}. Status changes run
 * inside {@code compute}, which serializes them per key.
 */
public class InMemorySharingRequestStore implements SharingRequestStore {

    private final Map<String, SharingRequest> requests = new ConcurrentHashMap<>();

    @Override
    public Optional<SharingRequest> find(String requestId) {
        return Optional.ofNullable(requests.get(requestId));
    }

    @Override
    public void insert(SharingRequest request) {
        SharingRequest existing = requests.putIfAbsent(request.requestId(), request);
        if (existing != null) {
            throw new IllegalStateException("Sharing request " + request.requestId() + " already exists");
        }
    }

    @Override
    public Optional<SharingRequest> compareAndSetStatus(String requestId, SharingStatus expected,
                                                        SharingStatus next, Instant decidedAt) {
        AtomicReference<SharingRequest> swapped = new AtomicReference<>();
        requests.computeIfPresent(requestId, (id, current) -> {
            if (current.status() != expected) {
                return current;
            }
            SharingRequest updated = current.decided(next, decidedAt);
            swapped.set(updated);
            return updated;
        });
        return Optional.ofNullable(swapped.get());
    }

    @Override
    public List<SharingRequest> findByOwner(String ownerId) {
        return matching(r -> r.ownerId().equals(ownerId));
    }

    @Override
    public List<SharingRequest> findByRequester(String requesterId) {
        return matching(r -> r.requesterId().equals(requesterId));
    }

    public int size() {
        return requests.size();
    }

    private List<SharingRequest> matching(Predicate<SharingRequest> filter) {
        return requests.values().stream().filter(filter).toList();
    }
}
