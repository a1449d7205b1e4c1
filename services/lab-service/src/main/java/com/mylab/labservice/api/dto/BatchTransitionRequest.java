package com.mylab.labservice.api.dto;

import com.mylab.labservice.domain.batch.BatchStatus;
import jakarta.validation.constraints.NotNull;

public record BatchTransitionRequest(@NotNull BatchStatus status) {
}
