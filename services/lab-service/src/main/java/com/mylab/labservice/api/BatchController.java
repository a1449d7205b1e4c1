package com.mylab.labservice.api;

import com.mylab.labservice.api.dto.AddSamplesRequest;
import com.mylab.labservice.api.dto.BatchTransitionRequest;
import com.mylab.labservice.domain.batch.Batch;
import com.mylab.labservice.domain.batch.BatchStatus;
import com.mylab.labservice.domain.batch.NewBatch;
import com.mylab.labservice.service.BatchService;
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
@RequestMapping("/api/v1/batches")
public class BatchController {

    private final BatchService batches;

    public BatchController(BatchService batches) {
        this.batches = batches;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<Batch> create(LabSecurityContext caller, @RequestBody NewBatch request) {
        return ApiResponse.of(batches.create(caller, request), "Batch created");
    }

    @GetMapping
    public ListResponse<Batch> list(LabSecurityContext caller, @RequestParam(required = false) BatchStatus status) {
        return ListResponse.of(batches.list(caller, status));
    }

    @GetMapping("/{id}")
    public ApiResponse<Batch> get(LabSecurityContext caller, @PathVariable UUID id) {
        return ApiResponse.of(batches.get(caller, id));
    }

    @PostMapping("/{id}/samples")
    public ApiResponse<Batch> addSamples(LabSecurityContext caller, @PathVariable UUID id,
                                         @Valid @RequestBody AddSamplesRequest request) {
        return ApiResponse.of(batches.addSamples(caller, id, request.sampleIds()), "Samples added");
    }

    @PostMapping("/{id}/transition")
    public ApiResponse<Batch> transition(LabSecurityContext caller, @PathVariable UUID id,
                                         @Valid @RequestBody BatchTransitionRequest request) {
        Batch batch = batches.transition(caller, id, request.status());
        return ApiResponse.of(batch, "Batch moved to " + batch.status().value());
    }
}
