package com.mylab.labservice.service;

import com.mylab.labservice.domain.common.InvalidDataException;
import com.mylab.labservice.domain.common.Lifecycle;
import com.mylab.labservice.domain.common.NotFoundException;
import com.mylab.labservice.domain.workspace.NewWorkspace;
import com.mylab.labservice.domain.workspace.Workspace;
import com.mylab.labservice.infrastructure.persistence.WorkspaceRepository;
import com.mylab.security.LabSecurityContext;
import com.mylab.security.Role;
import java.time.Clock;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class WorkspaceService {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceService.class);

    private final WorkspaceRepository workspaces;
    private final AuthorizationService authorization;
    private final Clock clock;

    public WorkspaceService(WorkspaceRepository workspaces, AuthorizationService authorization, Clock clock) {
        this.workspaces = workspaces;
        this.authorization = authorization;
        this.clock = clock;
    }

    /**
     * Registers a workspace. Workspaces mirror tenants issued by the identity service, so only
     * platform administrators create them.
     */
    public Workspace create(LabSecurityContext context, NewWorkspace request) {
        authorization.requireRole(context, Role.PLATFORM_ADMIN, "create workspaces");
        if (request.name() == null || request.name().isBlank()) {
            throw new InvalidDataException("Workspace name is required");
        }
        if (request.parentWorkspaceId() != null && workspaces.findActive(request.parentWorkspaceId()).isEmpty()) {
            throw new InvalidDataException("Parent workspace %s does not exist".formatted(request.parentWorkspaceId()));
        }
        Workspace workspace = new Workspace(
                request.id() != null ? request.id() : UUID.randomUUID(),
                request.name().strip(),
                request.parentWorkspaceId(),
                Lifecycle.ACTIVE,
                clock.instant());
        workspaces.insert(workspace);
        log.info("Registered workspace {} ({})", workspace.id(), workspace.name());
        return workspace;
    }

    public Workspace current(LabSecurityContext context) {
        return workspaces.findActive(context.workspaceId())
                .orElseThrow(() -> new NotFoundException("Workspace", context.workspaceId()));
    }

    public Workspace get(LabSecurityContext context, UUID id) {
        if (!context.isPlatformAdmin() && !context.actsIn(id)) {
            throw new NotFoundException("Workspace", id);
        }
        return workspaces.findActive(id).orElseThrow(() -> new NotFoundException("Workspace", id));
    }
}
