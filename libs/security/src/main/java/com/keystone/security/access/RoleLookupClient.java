package com.keystone.security.access;

import java.util.Set;

/**
 * Resolves the role names granted to a customer.
 */
@FunctionalInterface
public interface RoleLookupClient {

    /**
     * @param customerId the customer to look up
     * @return role names, empty when the customer has none or is unknown
     * @throws RoleLookupException if the lookup service is unreachable or answers with an error
     */
    Set<String> rolesFor(String customerId);
}
