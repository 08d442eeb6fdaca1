package com.keystone.sharing;

import java.time.Instant;

/**
 * A request by one party to read another party's private fields.
 *
 * @param requestId   {@code req_<epochMillis>_<16 hex>}
 * @param ownerId     customer whose data is requested; the only party that may decide
 * @param requesterId customer asking for the data; the only party that may resolve the key
 * @param requestKey  capability secret minted at creation, never changed
 * @param status      stored status; see {@link #statusAt(Instant)} for the effective one
 * @param dataType    what is being requested, e.g. {@code email}
 * @param reason      free text shown to the owner
 * @param createdAt   creation time
 * @param decidedAt   approval or rejection time, null while pending
 * @param expiresAt   after this a pending request reads as {@link SharingStatus#EXPIRED}
 */
public record SharingRequest(
        String requestId,
        String ownerId,
        String requesterId,
        String requestKey,
        SharingStatus status,
        String dataType,
        String reason,
        Instant createdAt,
        Instant decidedAt,
        Instant expiresAt) {

    public SharingRequest {
        requireText(requestId, "requestId");
        requireText(ownerId, "ownerId");
        requireText(requesterId, "requesterId");
        requireText(requestKey, "requestKey");
        requireText(dataType, "dataType");
        if (status == null || createdAt == null || expiresAt == null) {
            throw new IllegalArgumentException("status, createdAt and expiresAt are required");
        }
        if (status == SharingStatus.EXPIRED) {
            throw new IllegalArgumentException("EXPIRED is derived, not stored");
        }
        reason = reason == null ? "" : reason;
    }

    /**
     * The status as seen at {@code now}: a pending request past its expiry is expired.
     */
    public SharingStatus statusAt(Instant now) {
        if (status == SharingStatus.PENDING && !now.isBefore(expiresAt)) {
            return SharingStatus.EXPIRED;
        }
        return status;
    }

    public SharingRequest decided(SharingStatus next, Instant at) {
        return new SharingRequest(requestId, ownerId, requesterId, requestKey, next, dataType, reason,
                createdAt, at, expiresAt);
    }

    public boolean isParty(String customerId) {
        return ownerId.equals(customerId) || requesterId.equals(customerId);
    }

    @Override
    public String toString() {
        return "SharingRequest[requestId=%s, ownerId=%s, requesterId=%s, status=%s, dataType=%s]"
                .formatted(requestId, ownerId, requesterId, status, dataType);
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }
}
