package com.keystone.security.token;

import java.util.List;

/**
 * Where the public key set comes from.
 */
@FunctionalInterface
public interface KeySetSource {

    /**
     * Fetches the complete current key set.
     *
     * @return every usable signing key
     * @throws KeySetUnavailableException if the key set cannot be retrieved or parsed
     */
    List<SigningKey> fetch();
}
