package com.mylab.labservice.api;

import com.mylab.labservice.domain.workspace.NewWorkspace;
import com.mylab.labservice.domain.workspace.Workspace;
import com.mylab.labservice.service.WorkspaceService;
import com.mylab.security.LabSecurityContext;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/workspaces")
public class WorkspaceController {

    private final WorkspaceService workspaces;

    public WorkspaceController(WorkspaceService workspaces) {
        this.workspaces = workspaces;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<Workspace> create(LabSecurityContext caller, @RequestBody NewWorkspace request) {
        return ApiResponse.of(workspaces.create(caller, request), "Workspace created");
    }

    @GetMapping("/current")
    public ApiResponse<Workspace> current(LabSecurityContext caller) {
        return ApiResponse.of(workspaces.current(caller));
    }

    @GetMapping("/{id}")
    public ApiResponse<Workspace> get(LabSecurityContext caller, @PathVariable UUID id) {
        return ApiResponse.of(workspaces.get(caller, id));
    }
}
