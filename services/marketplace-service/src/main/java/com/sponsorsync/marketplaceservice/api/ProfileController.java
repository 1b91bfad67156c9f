package com.sponsorsync.marketplaceservice.api;

import com.sponsorsync.marketplace.access.ProfileAccess;
import com.sponsorsync.marketplace.access.ProfileProvisioner;
import com.sponsorsync.security.IdentityContext;
import com.sponsorsync.security.Operation;
import com.sponsorsync.security.PermissionDeniedException;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Profiles. {@code POST} is the onboarding step: it provisions the caller's own profile, keyed by
 * the principal id.
 */
@RestController
@RequestMapping("/api/v1/profiles")
public class ProfileController {

    private final ProfileAccess profiles;
    private final ProfileProvisioner provisioner;

    public ProfileController(ProfileAccess profiles, ProfileProvisioner provisioner) {
        this.profiles = profiles;
        this.provisioner = provisioner;
    }

    @PostMapping
    public ResponseEntity<ProfileResponse> provision(
            IdentityContext identity, @Valid @RequestBody ProvisionProfileRequest request) {
        UUID principal = identity.principalId()
                .orElseThrow(() -> new PermissionDeniedException(profiles.kind().value(), Operation.CREATE));
        ProfileResponse body = ProfileResponse.from(provisioner.provision(principal, request.toDraft()));
        return ResponseEntity.created(URI.create("/api/v1/profiles/" + body.id())).body(body);
    }

    @GetMapping
    public List<ProfileResponse> list(IdentityContext identity, @RequestParam Map<String, String> filter) {
        return profiles.list(identity, filter).stream().map(ProfileResponse::from).toList();
    }

    @GetMapping("/{id}")
    public ProfileResponse get(IdentityContext identity, @PathVariable UUID id) {
        return ProfileResponse.from(profiles.get(identity, id));
    }

    @PatchMapping("/{id}")
    public ProfileResponse update(
            IdentityContext identity, @PathVariable UUID id, @RequestBody Map<String, Object> patch) {
        return ProfileResponse.from(profiles.update(identity, id, patch));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(IdentityContext identity, @PathVariable UUID id) {
        profiles.delete(identity, id);
        return ResponseEntity.noContent().build();
    }
}
