package com.keystone.gateway.api;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.keystone.crypto.privacy.TieredFieldPrivacyEncoder;
import com.keystone.gateway.domain.Profile;
import com.keystone.gateway.domain.ProfileDirectory;
import com.keystone.gateway.domain.ProfileNotFoundException;
import com.keystone.gateway.infrastructure.web.Authenticated;
import com.keystone.gateway.infrastructure.web.AuthenticationInterceptor;
import com.keystone.security.AuthResult;
import com.keystone.sharing.DataSharingRequestManager;
import com.keystone.sharing.SharingRequestView;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Data owner side of data sharing: review, approve or reject requests, and seal one's own
 * profile for an approved request.
 *
 * <p>The sealed profile's private fields need both the owner's token and the request key to
 * open. The owner hands the result to the requester out of band.
 */
@RestController
@RequestMapping("/api/customer/data-requests")
@Authenticated
public class CustomerDataRequestController {

    private final DataSharingRequestManager manager;
    private final ProfileDirectory profiles;
    private final TieredFieldPrivacyEncoder encoder;

    public CustomerDataRequestController(
            DataSharingRequestManager manager,
            ProfileDirectory profiles,
            TieredFieldPrivacyEncoder encoder) {
        this.manager = manager;
        this.profiles = profiles;
        this.encoder = encoder;
    }

    @GetMapping
    public List<SharingRequestView> incoming(
            @RequestAttribute(AuthenticationInterceptor.PRINCIPAL_ATTRIBUTE) AuthResult principal) {
        return manager.listForOwner(principal.customerId());
    }

    @GetMapping("/{requestId}")
    public SharingRequestView get(
            @RequestAttribute(AuthenticationInterceptor.PRINCIPAL_ATTRIBUTE) AuthResult principal,
            @PathVariable String requestId) {
        return manager.getAs(requestId, principal.customerId());
    }

    @PostMapping("/{requestId}/approve")
    public SharingRequestView approve(
            @RequestAttribute(AuthenticationInterceptor.PRINCIPAL_ATTRIBUTE) AuthResult principal,
            @PathVariable String requestId) {
        return manager.approve(requestId, principal.customerId());
    }

    @PostMapping("/{requestId}/reject")
    public SharingRequestView reject(
            @RequestAttribute(AuthenticationInterceptor.PRINCIPAL_ATTRIBUTE) AuthResult principal,
            @PathVariable String requestId) {
        return manager.reject(requestId, principal.customerId());
    }

    @GetMapping("/{requestId}/shared-profile")
    public ObjectNode sharedProfile(
            @RequestAttribute(AuthenticationInterceptor.PRINCIPAL_ATTRIBUTE) AuthResult principal,
            @PathVariable String requestId) {
        String requestKey = manager.sealingKey(requestId, principal.customerId());
        Profile profile =
                profiles.find(principal.customerId())
                        .orElseThrow(() -> new ProfileNotFoundException(principal.customerId()));
        return encoder.encode(profile, principal.rawToken(), requestKey);
    }
}
