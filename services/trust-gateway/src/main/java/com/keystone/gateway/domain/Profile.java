package com.keystone.gateway.domain;

import com.keystone.crypto.privacy.FieldPrivacy;
import com.keystone.crypto.privacy.Visibility;

/**
 * A customer's profile. The email is private: it only leaves the service sealed for an
 * approved sharing request.
 */
public record Profile(
        String customerId,
        String displayName,
        @FieldPrivacy(Visibility.PRIVATE) String email,
        String plan) {}
