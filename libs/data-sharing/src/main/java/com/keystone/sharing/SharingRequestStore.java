package com.keystone.sharing;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for sharing requests.
 * <p>
 * Implementations must make {@link #compareAndSetStatus} atomic per request id: of two
 * concurrent calls expecting the same status, at most one succeeds.
 */
public interface SharingRequestStore {

    Optional<SharingRequest> find(String requestId);

    /**
     * Stores a new request.
     *
     * @throws IllegalStateException if a request with the same id exists
     */
    void insert(SharingRequest request);

    /**
     * Moves a request from {@code expected} to {@code next} if its stored status is still
     * {@code expected}.
     *
     * @return the updated request, or empty when the request is missing or its status differs
     */
    Optional<SharingRequest> compareAndSetStatus(String requestId, SharingStatus expected,
                                                 SharingStatus next, Instant decidedAt);

    List<SharingRequest> findByOwner(String ownerId);

    List<SharingRequest> findByRequester(String requesterId);
}
