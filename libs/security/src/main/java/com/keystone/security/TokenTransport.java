package com.keystone.security;

/**
 * How the caller presented its credential.
 */
public enum TokenTransport {

    /** HttpOnly {@code auth_token} cookie; the browser cannot read the token back. */
    COOKIE,

    /** {@code Authorization: Bearer} header carrying a signed token. */
    BEARER_HEADER,

    /** {@code Authorization: Bearer} header carrying the super-admin service API key. */
    SERVICE_KEY;

    /**
     * Whether the caller holds the raw credential and can therefore decrypt responses keyed by it.
     */
    public boolean callerHoldsCredential() {
        return this != COOKIE;
    }
}
