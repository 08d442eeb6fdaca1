package com.keystone.sharing;

import java.time.Instant;

/**
 * What callers get to see of a {@link SharingRequest}: everything but the request key,
 * with the status evaluated at read time.
 */
public record SharingRequestView(
        String requestId,
        String ownerId,
        String requesterId,
        SharingStatus status,
        String dataType,
        String reason,
        Instant createdAt,
        Instant decidedAt,
        Instant expiresAt) {

    public static SharingRequestView of(SharingRequest request, Instant now) {
        return new SharingRequestView(request.requestId(), request.ownerId(), request.requesterId(),
                request.statusAt(now), request.dataType(), request.reason(), request.createdAt(),
                request.decidedAt(), request.expiresAt());
    }
}
