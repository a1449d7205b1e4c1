package com.mylab.labservice.api;

import com.mylab.labservice.api.dto.ParameterTemplateRequest;
import com.mylab.labservice.domain.trial.NewTrial;
import com.mylab.labservice.domain.trial.ParameterTemplate;
import com.mylab.labservice.domain.trial.Trial;
import com.mylab.labservice.domain.trial.TrialUpdate;
import com.mylab.labservice.service.TrialService;
import com.mylab.security.LabSecurityContext;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1")
public class TrialController {

    private final TrialService trials;

    public TrialController(TrialService trials) {
        this.trials = trials;
    }

    @PostMapping("/projects/{projectId}/trials")
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<Trial> create(LabSecurityContext caller, @PathVariable UUID projectId,
                                     @RequestBody NewTrial request) {
        return ApiResponse.of(trials.create(caller, projectId, request), "Trial created");
    }

    @PostMapping("/projects/{projectId}/trials/bulk")
    @ResponseStatus(HttpStatus.CREATED)
    public ListResponse<Trial> createBulk(LabSecurityContext caller, @PathVariable UUID projectId,
                                          @RequestBody List<NewTrial> requests) {
        return ListResponse.of(trials.createBulk(caller, projectId, requests));
    }

    @GetMapping("/projects/{projectId}/trials")
    public ListResponse<Trial> list(LabSecurityContext caller, @PathVariable UUID projectId) {
        return ListResponse.of(trials.listByProject(caller, projectId));
    }

    @GetMapping("/trials/{id}")
    public ApiResponse<Trial> get(LabSecurityContext caller, @PathVariable UUID id) {
        return ApiResponse.of(trials.get(caller, id));
    }

    @PutMapping("/trials/{id}")
    public ApiResponse<Trial> update(LabSecurityContext caller, @PathVariable UUID id,
                                     @RequestBody TrialUpdate update) {
        return ApiResponse.of(trials.update(caller, id, update), "Trial updated");
    }

    @DeleteMapping("/trials/{id}")
    public ApiResponse<Void> delete(LabSecurityContext caller, @PathVariable UUID id) {
        trials.delete(caller, id);
        return ApiResponse.of(null, "Trial deleted");
    }

    @GetMapping("/projects/{projectId}/trial-template")
    public ApiResponse<ParameterTemplate> template(LabSecurityContext caller, @PathVariable UUID projectId) {
        return ApiResponse.of(trials.getTemplate(caller, projectId));
    }

    @PutMapping("/projects/{projectId}/trial-template")
    public ApiResponse<ParameterTemplate> putTemplate(LabSecurityContext caller, @PathVariable UUID projectId,
                                                      @Valid @RequestBody ParameterTemplateRequest request) {
        return ApiResponse.of(trials.putTemplate(caller, projectId, request.columns()), "Template saved");
    }
}
