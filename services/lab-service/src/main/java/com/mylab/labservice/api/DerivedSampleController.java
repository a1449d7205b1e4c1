package com.mylab.labservice.api;

import com.mylab.labservice.domain.lineage.DerivedSample;
import com.mylab.labservice.domain.lineage.NewDerivedSample;
import com.mylab.labservice.service.DerivedSampleService;
import com.mylab.security.LabSecurityContext;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1")
public class DerivedSampleController {

    private final DerivedSampleService derivedSamples;

    public DerivedSampleController(DerivedSampleService derivedSamples) {
        this.derivedSamples = derivedSamples;
    }

    @PostMapping("/samples/{sampleId}/derived")
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<DerivedSample> create(LabSecurityContext caller, @PathVariable UUID sampleId,
                                             @RequestBody NewDerivedSample request) {
        return ApiResponse.of(derivedSamples.create(caller, sampleId, request), "Derived sample created");
    }

    @GetMapping("/samples/{sampleId}/derived")
    public ListResponse<DerivedSample> list(LabSecurityContext caller, @PathVariable UUID sampleId) {
        return ListResponse.of(derivedSamples.listByParent(caller, sampleId));
    }

    @GetMapping("/derived-samples/{id}")
    public ApiResponse<DerivedSample> get(LabSecurityContext caller, @PathVariable UUID id) {
        return ApiResponse.of(derivedSamples.get(caller, id));
    }

    /**
     * The supersession chain from this record back to its root, newest first.
     */
    @GetMapping("/derived-samples/{id}/lineage")
    public ListResponse<DerivedSample> lineage(LabSecurityContext caller, @PathVariable UUID id) {
        return ListResponse.of(derivedSamples.lineage(caller, id));
    }

    @DeleteMapping("/derived-samples/{id}")
    public ApiResponse<Void> delete(LabSecurityContext caller, @PathVariable UUID id) {
        derivedSamples.delete(caller, id);
        return ApiResponse.of(null, "Derived sample deleted");
    }
}
