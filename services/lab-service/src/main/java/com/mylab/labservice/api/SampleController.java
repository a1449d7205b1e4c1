package com.mylab.labservice.api;

import com.mylab.labservice.domain.sample.NewSample;
import com.mylab.labservice.domain.sample.Sample;
import com.mylab.labservice.domain.sample.SampleUpdate;
import com.mylab.labservice.service.SampleService;
import com.mylab.security.LabSecurityContext;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/samples")
public class SampleController {

    private final SampleService samples;

    public SampleController(SampleService samples) {
        this.samples = samples;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<Sample> create(LabSecurityContext caller, @RequestBody NewSample request) {
        return ApiResponse.of(samples.create(caller, request), "Sample created");
    }

    @GetMapping
    public ListResponse<Sample> list(LabSecurityContext caller, @RequestParam(required = false) UUID projectId) {
        return ListResponse.of(samples.list(caller, projectId));
    }

    @GetMapping("/{id}")
    public ApiResponse<Sample> get(LabSecurityContext caller, @PathVariable UUID id) {
        return ApiResponse.of(samples.get(caller, id));
    }

    @PutMapping("/{id}")
    public ApiResponse<Sample> update(LabSecurityContext caller, @PathVariable UUID id,
                                      @RequestBody SampleUpdate update) {
        return ApiResponse.of(samples.update(caller, id, update), "Sample updated");
    }

    @DeleteMapping("/{id}")
    public ApiResponse<Void> delete(LabSecurityContext caller, @PathVariable UUID id) {
        samples.delete(caller, id);
        return ApiResponse.of(null, "Sample deleted");
    }
}
