package com.keystone.gateway.api;

import com.keystone.gateway.domain.Profile;
import com.keystone.gateway.domain.ProfileDirectory;
import com.keystone.gateway.infrastructure.web.Authenticated;
import com.keystone.gateway.infrastructure.web.AuthenticationInterceptor;
import com.keystone.security.AuthResult;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** The caller's own identity and profile. */
@RestController
@RequestMapping("/api/v1/me")
@Authenticated
public class PrincipalController {

    /** Profile fields a customer may set for themselves. */
    public record ProfileUpdate(@NotBlank String displayName, @NotBlank @Email String email, String plan) {}

    /** Acknowledges a stored profile without echoing its private fields. */
    public record ProfileSaved(String customerId, String displayName, String plan, boolean emailStored) {

        static ProfileSaved of(Profile profile) {
            return new ProfileSaved(profile.customerId(), profile.displayName(), profile.plan(),
                    profile.email() != null);
        }
    }

    private final ProfileDirectory profiles;

    public PrincipalController(ProfileDirectory profiles) {
        this.profiles = profiles;
    }

    @GetMapping
    public Map<String, Object> me(
            @RequestAttribute(AuthenticationInterceptor.PRINCIPAL_ATTRIBUTE) AuthResult principal) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("customerId", principal.customerId());
        body.put("superAdmin", principal.superAdminClaim());
        body.put("transport", principal.transport().name());
        return body;
    }

    @PutMapping("/profile")
    public ProfileSaved updateProfile(
            @RequestAttribute(AuthenticationInterceptor.PRINCIPAL_ATTRIBUTE) AuthResult principal,
            @Valid @RequestBody ProfileUpdate update) {
        return ProfileSaved.of(profiles.save(
                new Profile(principal.customerId(), update.displayName(), update.email(), update.plan())));
    }
}
