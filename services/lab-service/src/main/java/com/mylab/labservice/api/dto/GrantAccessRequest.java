package com.mylab.labservice.api.dto;

import com.mylab.labservice.domain.access.ObjectType;
import com.mylab.security.AccessLevel;
import jakarta.validation.constraints.NotNull;
import java.util.UUID;

public record GrantAccessRequest(
        @NotNull UUID userId,
        @NotNull ObjectType objectType,
        @NotNull UUID objectId,
        @NotNull AccessLevel accessLevel) {
}
