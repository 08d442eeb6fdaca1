package com.keystone.sharing;

/**
 * Lifecycle of a data sharing request. Only {@link #PENDING} can change.
 */
public enum SharingStatus {

    PENDING,
    APPROVED,
    REJECTED,
    /** A pending request whose expiry has passed. Never stored, only derived on read. */
    EXPIRED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
