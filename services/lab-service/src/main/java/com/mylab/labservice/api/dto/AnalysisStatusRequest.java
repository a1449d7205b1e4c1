package com.mylab.labservice.api.dto;

import com.mylab.labservice.domain.analysis.AnalysisResults;
import com.mylab.labservice.domain.analysis.AnalysisStatus;
import jakarta.validation.constraints.NotNull;

/**
 * @param results optional replacement results
 */
public record AnalysisStatusRequest(@NotNull AnalysisStatus status, AnalysisResults results) {
}
