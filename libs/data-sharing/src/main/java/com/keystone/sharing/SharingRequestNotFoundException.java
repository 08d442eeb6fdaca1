package com.keystone.sharing;

/**
 * Thrown when a sharing request id is unknown, or unknown to the calling party.
 */
public class SharingRequestNotFoundException extends RuntimeException {

    private final String requestId;

    public SharingRequestNotFoundException(String requestId) {
        super("Sharing request '%s' not found".formatted(requestId));
        this.requestId = requestId;
    }

    public String requestId() {
        return requestId;
    }
}
