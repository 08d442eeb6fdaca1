package com.keystone.crypto.privacy;

/**
 * Field visibility tiers.
 */
public enum Visibility {
    /** Protected only by whole-response encryption. */
    PUBLIC,
    /** Additionally sealed with the owner's token and a per-request key. */
    PRIVATE
}
