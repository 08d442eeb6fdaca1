package com.keystone.gateway.domain;

import java.util.Optional;

/** Where profiles live. The storage technology is outside the trust layer. */
public interface ProfileDirectory {

    Optional<Profile> find(String customerId);

    Profile save(Profile profile);
}
