package com.keystone.sharing;

/**
 * Thrown when a party tries an action the request's state or their role does not allow.
 */
public class InvalidRequestTransitionException extends RuntimeException {

    public enum Reason {
        /** Only the data owner may approve or reject. */
        NOT_OWNER,
        /** Only the requester may resolve the request key. */
        NOT_REQUESTER,
        /** The request already reached a different terminal state, or expired. */
        ALREADY_DECIDED,
        /** The request key is only released once approved. */
        NOT_APPROVED
    }

    private final String requestId;
    private final SharingStatus currentStatus;
    private final Reason reason;

    public InvalidRequestTransitionException(String requestId, SharingStatus currentStatus, Reason reason) {
        super("Sharing request '%s' (%s): %s".formatted(requestId, currentStatus, reason));
        this.requestId = requestId;
        this.currentStatus = currentStatus;
        this.reason = reason;
    }

    public String requestId() {
        return requestId;
    }

    public SharingStatus currentStatus() {
        return currentStatus;
    }

    public Reason reason() {
        return reason;
    }
}
