package com.mylab.labservice.api;

import com.mylab.labservice.api.dto.AccessLevelRequest;
import com.mylab.labservice.api.dto.GrantAccessRequest;
import com.mylab.labservice.domain.access.AccessGrant;
import com.mylab.labservice.domain.access.ObjectType;
import com.mylab.labservice.service.AccessGrantService;
import com.mylab.security.AccessLevel;
import com.mylab.security.LabSecurityContext;
import jakarta.validation.Valid;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Access grant ledger endpoints.
 */
@RestController
@RequestMapping("/api/v1/access")
public class AccessController {

    private final AccessGrantService grants;

    public AccessController(AccessGrantService grants) {
        this.grants = grants;
    }

    @PostMapping("/grant")
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<AccessGrant> grant(LabSecurityContext caller, @Valid @RequestBody GrantAccessRequest request) {
        AccessGrant grant = grants.grant(caller, request.userId(), request.objectType(), request.objectId(),
                request.accessLevel());
        return ApiResponse.of(grant, "Access granted");
    }

    @GetMapping("/{objectType}/{objectId}")
    public ListResponse<AccessGrant> list(LabSecurityContext caller, @PathVariable ObjectType objectType,
                                          @PathVariable UUID objectId) {
        return ListResponse.of(grants.list(caller, objectType, objectId));
    }

    /**
     * The user's level on the object; {@code data} is null when they hold no grant.
     */
    @GetMapping("/{userId}/{objectType}/{objectId}")
    public ApiResponse<AccessLevel> userAccess(LabSecurityContext caller, @PathVariable UUID userId,
                                               @PathVariable ObjectType objectType, @PathVariable UUID objectId) {
        return ApiResponse.of(grants.getUserAccess(caller, userId, objectType, objectId).orElse(null));
    }

    @PutMapping("/{userId}/{objectType}/{objectId}")
    public ApiResponse<AccessGrant> update(LabSecurityContext caller, @PathVariable UUID userId,
                                           @PathVariable ObjectType objectType, @PathVariable UUID objectId,
                                           @Valid @RequestBody AccessLevelRequest request) {
        return ApiResponse.of(grants.updateLevel(caller, userId, objectType, objectId, request.accessLevel()),
                "Access level updated");
    }

    @DeleteMapping("/{userId}/{objectType}/{objectId}")
    public ApiResponse<Void> revoke(LabSecurityContext caller, @PathVariable UUID userId,
                                    @PathVariable ObjectType objectType, @PathVariable UUID objectId) {
        grants.revoke(caller, userId, objectType, objectId);
        return ApiResponse.of(null, "Access revoked");
    }
}
