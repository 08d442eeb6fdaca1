package com.keystone.gateway.domain;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Process-local {@link ProfileDirectory}. */
public class InMemoryProfileDirectory implements ProfileDirectory {

    private final Map<String, Profile> profiles = new ConcurrentHashMap<>();

    @Override
    public Optional<Profile> find(String customerId) {
        return Optional.ofNullable(profiles.get(customerId));
    }

    @Override
    public Profile save(Profile profile) {
        profiles.put(profile.customerId(), profile);
        return profile;
    }
}
