package com.mylab.labservice.service;

import com.mylab.labservice.domain.access.ObjectType;
import com.mylab.labservice.domain.common.NotFoundException;
import com.mylab.labservice.domain.project.NewProject;
import com.mylab.labservice.domain.project.NewProject.InvalidProjectDataException;
import com.mylab.labservice.domain.project.Project;
import com.mylab.labservice.domain.project.ProjectStatus;
import com.mylab.labservice.domain.project.ProjectUpdate;
import com.mylab.labservice.domain.project.WorkflowMode;
import com.mylab.labservice.infrastructure.persistence.OrganizationRepository;
import com.mylab.labservice.infrastructure.persistence.ProjectRepository;
import com.mylab.labservice.infrastructure.persistence.TransactionRunner;
import com.mylab.security.AccessLevel;
import com.mylab.security.LabSecurityContext;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Projects of a workspace. Reads reach other workspaces through view grants; updates need
 * {@code edit} and deletes {@code full}.
 */
@Service
public class ProjectService {

    private static final Logger log = LoggerFactory.getLogger(ProjectService.class);

    public static final int DEFAULT_PAGE_SIZE = 50;
    public static final int MAX_PAGE_SIZE = 500;

    private final ProjectRepository projects;
    private final OrganizationRepository organizations;
    private final AuthorizationService authorization;
    private final TransactionRunner tx;
    private final Clock clock;

    public ProjectService(ProjectRepository projects, OrganizationRepository organizations,
                          AuthorizationService authorization, TransactionRunner tx, Clock clock) {
        this.projects = projects;
        this.organizations = organizations;
        this.authorization = authorization;
        this.tx = tx;
        this.clock = clock;
    }

    /**
     * Creates a project after checking, in one query, that every referenced organization is live
     * in the caller's workspace. Insert and re-read run in one transaction.
     *
     * @throws InvalidProjectDataException on invalid input or organization references
     */
    public Project create(LabSecurityContext context, NewProject request) {
        request.validate();
        authorization.requireWorkspace(context, AccessLevel.EDIT);

        Set<UUID> orgIds = new LinkedHashSet<>();
        if (request.clientOrgId() != null) {
            orgIds.add(request.clientOrgId());
        }
        orgIds.add(request.executingOrgId());

        return tx.inTransaction(() -> {
            if (organizations.countActiveIn(orgIds, context.workspaceId()) != orgIds.size()) {
                throw new InvalidProjectDataException(
                        "Client and executing organizations must exist in your workspace");
            }
            Instant now = clock.instant();
            Project project = new Project(
                    UUID.randomUUID(),
                    context.workspaceId(),
                    request.name().strip(),
                    request.description(),
                    request.clientOrgId(),
                    null,
                    request.clientOrgId() == null ? request.externalClientName().strip() : null,
                    request.executingOrgId(),
                    null,
                    request.workflowMode() != null ? request.workflowMode() : WorkflowMode.TRIAL_FIRST,
                    ProjectStatus.ACTIVE,
                    request.externalReference(),
                    context.userId(),
                    now,
                    now);
            projects.insert(project);
            Project created = projects.findActive(project.id(), context.workspaceId())
                    .orElseThrow(() -> new IllegalStateException("Project %s vanished after insert".formatted(project.id())));
            log.info("Created project {} in workspace {}", created.id(), created.workspaceId());
            return created;
        });
    }

    public Project get(LabSecurityContext context, UUID id) {
        return load(context, id, AccessLevel.VIEW);
    }

    public List<Project> list(LabSecurityContext context, int limit, int offset) {
        int pageSize = limit <= 0 ? DEFAULT_PAGE_SIZE : Math.min(limit, MAX_PAGE_SIZE);
        return projects.list(context.workspaceId(), pageSize, Math.max(offset, 0));
    }

    public long count(LabSecurityContext context) {
        return projects.count(context.workspaceId());
    }

    public Project update(LabSecurityContext context, UUID id, ProjectUpdate update) {
        update.validate();
        Project project = load(context, id, AccessLevel.EDIT);
        if (projects.update(id, project.workspaceId(), update, clock.instant()) == 0) {
            throw new NotFoundException("Project", id);
        }
        return projects.findActiveInAnyWorkspace(id).orElseThrow(() -> new NotFoundException("Project", id));
    }

    public void delete(LabSecurityContext context, UUID id) {
        Project project = load(context, id, AccessLevel.FULL);
        if (projects.softDelete(id, project.workspaceId(), clock.instant()) == 0) {
            throw new NotFoundException("Project", id);
        }
        log.info("Deleted project {}", id);
    }

    /**
     * Loads a live project the caller holds at least {@code required} on.
     */
    Project load(LabSecurityContext context, UUID id, AccessLevel required) {
        Project project = projects.findActiveInAnyWorkspace(id)
                .orElseThrow(() -> new NotFoundException("Project", id));
        authorization.authorize(context, ObjectType.PROJECT, id, project.workspaceId(), required);
        return project;
    }
}
