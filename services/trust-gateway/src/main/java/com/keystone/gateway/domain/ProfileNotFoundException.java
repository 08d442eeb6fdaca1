package com.keystone.gateway.domain;

public class ProfileNotFoundException extends RuntimeException {

    private final String customerId;

    public ProfileNotFoundException(String customerId) {
        super("No profile stored for customer '%s'".formatted(customerId));
        this.customerId = customerId;
    }

    public String customerId() {
        return customerId;
    }
}
