package com.mylab.labservice.api.dto;

import com.mylab.labservice.domain.trial.ParameterColumn;
import jakarta.validation.constraints.NotNull;
import java.util.List;

public record ParameterTemplateRequest(@NotNull List<ParameterColumn> columns) {
}
