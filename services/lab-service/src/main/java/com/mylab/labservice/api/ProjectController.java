package com.mylab.labservice.api;

import com.mylab.labservice.domain.project.NewProject;
import com.mylab.labservice.domain.project.Project;
import com.mylab.labservice.domain.project.ProjectUpdate;
import com.mylab.labservice.service.ProjectService;
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
@RequestMapping("/api/v1/projects")
public class ProjectController {

    private final ProjectService projects;

    public ProjectController(ProjectService projects) {
        this.projects = projects;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<Project> create(LabSecurityContext caller, @RequestBody NewProject request) {
        return ApiResponse.of(projects.create(caller, request), "Project created");
    }

    /**
     * One page of projects; {@code count} is the total across all pages.
     */
    @GetMapping
    public ListResponse<Project> list(LabSecurityContext caller,
                                      @RequestParam(defaultValue = "50") int limit,
                                      @RequestParam(defaultValue = "0") int offset) {
        return ListResponse.of(projects.list(caller, limit, offset), projects.count(caller));
    }

    @GetMapping("/{id}")
    public ApiResponse<Project> get(LabSecurityContext caller, @PathVariable UUID id) {
        return ApiResponse.of(projects.get(caller, id));
    }

    @PutMapping("/{id}")
    public ApiResponse<Project> update(LabSecurityContext caller, @PathVariable UUID id,
                                       @RequestBody ProjectUpdate update) {
        return ApiResponse.of(projects.update(caller, id, update), "Project updated");
    }

    @DeleteMapping("/{id}")
    public ApiResponse<Void> delete(LabSecurityContext caller, @PathVariable UUID id) {
        projects.delete(caller, id);
        return ApiResponse.of(null, "Project deleted");
    }
}
