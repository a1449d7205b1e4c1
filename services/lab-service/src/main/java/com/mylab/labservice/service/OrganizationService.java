package com.mylab.labservice.service;

import com.mylab.labservice.domain.common.InvalidDataException;
import com.mylab.labservice.domain.common.Lifecycle;
import com.mylab.labservice.domain.common.NotFoundException;
import com.mylab.labservice.domain.organization.NewOrganization;
import com.mylab.labservice.domain.organization.Organization;
import com.mylab.labservice.domain.organization.OrganizationUpdate;
import com.mylab.labservice.infrastructure.persistence.OrganizationRepository;
import com.mylab.labservice.infrastructure.persistence.WorkspaceRepository;
import com.mylab.security.LabSecurityContext;
import com.mylab.security.Role;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class OrganizationService {

    private static final Logger log = LoggerFactory.getLogger(OrganizationService.class);

    static final int MAX_NAME_LENGTH = 100;

    private final OrganizationRepository organizations;
    private final WorkspaceRepository workspaces;
    private final AuthorizationService authorization;
    private final Clock clock;

    public OrganizationService(OrganizationRepository organizations, WorkspaceRepository workspaces,
                               AuthorizationService authorization, Clock clock) {
        this.organizations = organizations;
        this.workspaces = workspaces;
        this.authorization = authorization;
        this.clock = clock;
    }

    public Organization create(LabSecurityContext context, NewOrganization request) {
        authorization.requireRole(context, Role.ADMIN, "create organizations");
        validateName(request.name());
        if (request.type() == null) {
            throw new InvalidDataException("Organization type is required");
        }
        if (workspaces.findActive(context.workspaceId()).isEmpty()) {
            throw new NotFoundException("Workspace", context.workspaceId());
        }
        Instant now = clock.instant();
        Organization organization = new Organization(
                UUID.randomUUID(),
                context.workspaceId(),
                request.name().strip(),
                request.type(),
                request.contactInfo(),
                Lifecycle.ACTIVE,
                now,
                now);
        organizations.insert(organization);
        log.info("Created {} organization {} in workspace {}", organization.type().value(), organization.id(),
                organization.workspaceId());
        return organization;
    }

    public Organization get(LabSecurityContext context, UUID id) {
        return organizations.findActive(id, context.workspaceId())
                .orElseThrow(() -> new NotFoundException("Organization", id));
    }

    public List<Organization> list(LabSecurityContext context) {
        return organizations.listActive(context.workspaceId());
    }

    public Organization update(LabSecurityContext context, UUID id, OrganizationUpdate update) {
        authorization.requireRole(context, Role.ADMIN, "update organizations");
        if (update.isEmpty()) {
            throw new InvalidDataException("No fields to update");
        }
        if (update.name() != null) {
            validateName(update.name());
        }
        if (organizations.update(id, context.workspaceId(), update, clock.instant()) == 0) {
            throw new NotFoundException("Organization", id);
        }
        return get(context, id);
    }

    public void delete(LabSecurityContext context, UUID id) {
        authorization.requireRole(context, Role.ADMIN, "delete organizations");
        if (organizations.softDelete(id, context.workspaceId(), clock.instant()) == 0) {
            throw new NotFoundException("Organization", id);
        }
        log.info("Deleted organization {}", id);
    }

    private static void validateName(String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidDataException("Organization name is required");
        }
        if (name.length() > MAX_NAME_LENGTH) {
            throw new InvalidDataException("Organization name must be at most %d characters".formatted(MAX_NAME_LENGTH));
        }
    }
}
