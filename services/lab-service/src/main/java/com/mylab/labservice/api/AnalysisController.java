package com.mylab.labservice.api;

import com.mylab.labservice.api.dto.AnalysisStatusRequest;
import com.mylab.labservice.domain.analysis.Analysis;
import com.mylab.labservice.domain.analysis.NewAnalysis;
import com.mylab.labservice.service.AnalysisService;
import com.mylab.security.LabSecurityContext;
import jakarta.validation.Valid;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/analyses")
public class AnalysisController {

    private final AnalysisService analyses;

    public AnalysisController(AnalysisService analyses) {
        this.analyses = analyses;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<Analysis> submit(LabSecurityContext caller, @RequestBody NewAnalysis request) {
        Analysis analysis = analyses.submit(caller, request);
        return ApiResponse.of(analysis, analysis.supersedesId() != null ? "Analysis superseded" : "Analysis created");
    }

    @GetMapping
    public ListResponse<Analysis> list(LabSecurityContext caller, @RequestParam UUID batchId) {
        return ListResponse.of(analyses.listByBatch(caller, batchId));
    }

    @GetMapping("/authoritative")
    public ApiResponse<Analysis> authoritative(LabSecurityContext caller, @RequestParam UUID sampleId,
                                               @RequestParam String analysisType) {
        return ApiResponse.of(analyses.authoritative(caller, sampleId, analysisType));
    }

    @GetMapping("/{id}")
    public ApiResponse<Analysis> get(LabSecurityContext caller, @PathVariable UUID id) {
        return ApiResponse.of(analyses.get(caller, id));
    }

    @PostMapping("/{id}/status")
    public ApiResponse<Analysis> updateStatus(LabSecurityContext caller, @PathVariable UUID id,
                                              @Valid @RequestBody AnalysisStatusRequest request) {
        return ApiResponse.of(analyses.updateStatus(caller, id, request.status(), request.results()),
                "Analysis updated");
    }
}
