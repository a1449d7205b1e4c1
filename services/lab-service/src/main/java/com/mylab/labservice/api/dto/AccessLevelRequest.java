package com.mylab.labservice.api.dto;

import com.mylab.security.AccessLevel;
import jakarta.validation.constraints.NotNull;

public record AccessLevelRequest(@NotNull AccessLevel accessLevel) {
}
