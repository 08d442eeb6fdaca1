package com.keystone.gateway.api;

import com.keystone.gateway.infrastructure.web.RequiresAdminLevel;
import com.keystone.security.access.AdminLevel;
import com.keystone.security.access.RoleLookupClient;
import java.util.List;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/admin/roles")
@RequiresAdminLevel(AdminLevel.ADMIN)
public class AdminRoleController {

    private final RoleLookupClient roleLookup;

    public AdminRoleController(RoleLookupClient roleLookup) {
        this.roleLookup = roleLookup;
    }

    @GetMapping("/{customerId}")
    public Map<String, Object> roles(@PathVariable String customerId) {
        List<String> roles = roleLookup.rolesFor(customerId).stream().sorted().toList();
        return Map.of("customerId", customerId, "roles", roles);
    }
}
