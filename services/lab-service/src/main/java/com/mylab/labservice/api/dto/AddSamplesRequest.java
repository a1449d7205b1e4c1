package com.mylab.labservice.api.dto;

import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import java.util.UUID;

public record AddSamplesRequest(@NotEmpty List<UUID> sampleIds) {
}
