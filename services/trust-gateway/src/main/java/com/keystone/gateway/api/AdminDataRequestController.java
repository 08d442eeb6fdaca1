package com.keystone.gateway.api;

import com.keystone.gateway.infrastructure.web.AuthenticationInterceptor;
import com.keystone.gateway.infrastructure.web.RequiresAdminLevel;
import com.keystone.security.AuthResult;
import com.keystone.security.access.AdminLevel;
import com.keystone.sharing.DataSharingRequestManager;
import com.keystone.sharing.SharingRequestView;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Super-admin side of data sharing: open requests, track them, and collect the request key
 * once the owner approves.
 */
@RestController
@RequestMapping("/api/admin/data-requests")
@RequiresAdminLevel(AdminLevel.SUPER_ADMIN)
public class AdminDataRequestController {

    public record CreateDataRequest(@NotBlank String ownerId, @NotBlank String dataType, String reason) {}

    private final DataSharingRequestManager manager;

    public AdminDataRequestController(DataSharingRequestManager manager) {
        this.manager = manager;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public SharingRequestView create(
            @RequestAttribute(AuthenticationInterceptor.PRINCIPAL_ATTRIBUTE) AuthResult principal,
            @Valid @RequestBody CreateDataRequest body) {
        return manager.create(body.ownerId(), principal.customerId(), body.dataType(), body.reason());
    }

    @GetMapping
    public List<SharingRequestView> mine(
            @RequestAttribute(AuthenticationInterceptor.PRINCIPAL_ATTRIBUTE) AuthResult principal) {
        return manager.listForRequester(principal.customerId());
    }

    @GetMapping("/{requestId}/key")
    public Map<String, String> requestKey(
            @RequestAttribute(AuthenticationInterceptor.PRINCIPAL_ATTRIBUTE) AuthResult principal,
            @PathVariable String requestId) {
        return Map.of(
                "requestId", requestId,
                "requestKey", manager.resolve(requestId, principal.customerId()));
    }
}
