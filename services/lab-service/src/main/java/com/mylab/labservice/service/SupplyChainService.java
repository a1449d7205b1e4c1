package com.mylab.labservice.service;

import com.mylab.labservice.domain.common.ForbiddenException;
import com.mylab.labservice.domain.common.InvalidDataException;
import com.mylab.labservice.domain.common.InvalidStateTransitionException;
import com.mylab.labservice.domain.common.NotFoundException;
import com.mylab.labservice.domain.handoff.HandoffStatus;
import com.mylab.labservice.domain.handoff.MaterialDescriptor;
import com.mylab.labservice.domain.handoff.NewSupplyChainRequest;
import com.mylab.labservice.domain.handoff.Priority;
import com.mylab.labservice.domain.handoff.SupplyChainFilter;
import com.mylab.labservice.domain.handoff.SupplyChainRequest;
import com.mylab.labservice.domain.handoff.SupplyChainRequestUpdate;
import com.mylab.labservice.domain.organization.Organization;
import com.mylab.labservice.domain.project.Project;
import com.mylab.labservice.domain.project.ProjectStatus;
import com.mylab.labservice.domain.project.WorkflowMode;
import com.mylab.labservice.domain.sample.Sample;
import com.mylab.labservice.domain.sample.SampleMetadata;
import com.mylab.labservice.infrastructure.persistence.OrganizationRepository;
import com.mylab.labservice.infrastructure.persistence.ProjectRepository;
import com.mylab.labservice.infrastructure.persistence.SampleRepository;
import com.mylab.labservice.infrastructure.persistence.SupplyChainRequestRepository;
import com.mylab.labservice.infrastructure.persistence.TransactionRunner;
import com.mylab.observability.MetricFactory;
import com.mylab.security.AccessLevel;
import com.mylab.security.LabSecurityContext;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Cross-workspace handoffs between two organizations.
 *
 * <p>The initiating workspace creates a request in {@code pending}; only the receiving workspace
 * moves it: {@code accept} or {@code reject}, then {@code start} and {@code complete}. Accepting a
 * {@code material_transfer} or {@code supply_chain} request creates a project and a sample in the
 * receiving workspace, in the same transaction as the status change.
 */
@Service
public class SupplyChainService {

    private static final Logger log = LoggerFactory.getLogger(SupplyChainService.class);

    static final String REFERENCE_PREFIX = "supply-chain:";

    private final SupplyChainRequestRepository requests;
    private final OrganizationRepository organizations;
    private final ProjectRepository projects;
    private final SampleRepository samples;
    private final AuthorizationService authorization;
    private final TransactionRunner tx;
    private final MetricFactory metrics;
    private final Clock clock;

    public SupplyChainService(SupplyChainRequestRepository requests, OrganizationRepository organizations,
                              ProjectRepository projects, SampleRepository samples,
                              AuthorizationService authorization, TransactionRunner tx, MetricFactory metrics,
                              Clock clock) {
        this.requests = requests;
        this.organizations = organizations;
        this.projects = projects;
        this.samples = samples;
        this.authorization = authorization;
        this.tx = tx;
        this.metrics = metrics;
        this.clock = clock;
    }

    public SupplyChainRequest create(LabSecurityContext context, NewSupplyChainRequest request) {
        request.validate();
        authorization.requireWorkspace(context, AccessLevel.EDIT);
        UUID workspaceId = context.workspaceId();

        if (organizations.findActive(request.fromOrgId(), workspaceId).isEmpty()) {
            throw new InvalidDataException("fromOrgId must be an organization of your workspace");
        }
        Organization toOrg = organizations.findActiveInAnyWorkspace(request.toOrgId())
                .orElseThrow(() -> new InvalidDataException(
                        "Organization %s does not exist".formatted(request.toOrgId())));
        if (toOrg.workspaceId().equals(workspaceId)) {
            throw new InvalidDataException("toOrgId must belong to another workspace");
        }
        if (projects.findActive(request.fromProjectId(), workspaceId).isEmpty()) {
            throw new InvalidDataException(
                    "Project %s does not exist in your workspace".formatted(request.fromProjectId()));
        }
        MaterialDescriptor material = request.material();
        if (material != null && material.sourceSampleId() != null
                && samples.findActive(material.sourceSampleId(), workspaceId).isEmpty()) {
            throw new InvalidDataException(
                    "Sample %s does not exist in your workspace".formatted(material.sourceSampleId()));
        }

        Instant now = clock.instant();
        SupplyChainRequest created = new SupplyChainRequest(
                UUID.randomUUID(),
                workspaceId,
                toOrg.workspaceId(),
                request.fromOrgId(),
                request.toOrgId(),
                request.fromProjectId(),
                request.workflowType(),
                material,
                request.requirements(),
                HandoffStatus.PENDING,
                request.priority() != null ? request.priority() : Priority.MEDIUM,
                request.dueDate(),
                null,
                request.notes(),
                null,
                null,
                null,
                null,
                context.userId(),
                now,
                now,
                null);
        requests.insert(created);
        log.info("Created {} request {} from org {} to org {}", created.workflowType().value(), created.id(),
                created.fromOrgId(), created.toOrgId());
        return created;
    }

    public SupplyChainRequest get(LabSecurityContext context, UUID id) {
        return requests.findVisible(id, context.workspaceId())
                .orElseThrow(() -> new NotFoundException("Supply chain request", id));
    }

    public List<SupplyChainRequest> list(LabSecurityContext context, SupplyChainFilter filter) {
        return requests.list(context.workspaceId(), filter != null ? filter : SupplyChainFilter.none());
    }

    /**
     * Initiator-side edit of priority, due date and notes while the request is open.
     */
    public SupplyChainRequest update(LabSecurityContext context, UUID id, SupplyChainRequestUpdate update) {
        if (update.isEmpty()) {
            throw new InvalidDataException("No fields to update");
        }
        authorization.requireWorkspace(context, AccessLevel.EDIT);
        SupplyChainRequest request = get(context, id);
        if (!context.actsIn(request.workspaceId())) {
            throw new ForbiddenException("Only the initiating organization can update this request");
        }
        if (request.status().isTerminal()) {
            throw new InvalidStateTransitionException(
                    "Cannot update a %s request".formatted(request.status().value()));
        }
        requests.update(id, update, clock.instant());
        return get(context, id);
    }

    public SupplyChainRequest accept(LabSecurityContext context, UUID id) {
        return transition(context, id, HandoffStatus.ACCEPTED, "accept", request -> {
            Map<String, Object> columns = new HashMap<>();
            columns.put("assigned_to", context.userId());
            if (request.workflowType().createsReceivingRecords()) {
                createReceivingRecords(context, request, columns);
            }
            return columns;
        });
    }

    public SupplyChainRequest reject(LabSecurityContext context, UUID id, String reason) {
        return transition(context, id, HandoffStatus.REJECTED, "reject", request -> {
            Map<String, Object> columns = new HashMap<>();
            columns.put("rejection_reason", reason);
            return columns;
        });
    }

    public SupplyChainRequest start(LabSecurityContext context, UUID id) {
        return transition(context, id, HandoffStatus.IN_PROGRESS, "start", request -> Map.of());
    }

    /**
     * Completes the request. The optional summary is readable from the initiating workspace.
     */
    public SupplyChainRequest complete(LabSecurityContext context, UUID id, String resultSummary) {
        return transition(context, id, HandoffStatus.COMPLETED, "complete", request -> {
            Map<String, Object> columns = new HashMap<>();
            columns.put("result_summary", resultSummary);
            return columns;
        });
    }

    private SupplyChainRequest transition(LabSecurityContext context, UUID id, HandoffStatus target, String action,
                                          SideEffects sideEffects) {
        HandoffStatus from = tx.inTransaction(() -> {
            SupplyChainRequest request = requests.findForUpdate(id)
                    .filter(r -> context.actsIn(r.workspaceId()) || context.actsIn(r.toWorkspaceId()))
                    .orElseThrow(() -> new NotFoundException("Supply chain request", id));
            if (!context.actsIn(request.toWorkspaceId())) {
                throw new ForbiddenException("Only the receiving organization can %s this request".formatted(action));
            }
            authorization.requireWorkspace(context, AccessLevel.EDIT);
            if (!request.status().canTransitionTo(target)) {
                throw new InvalidStateTransitionException(
                        "supply chain request", request.status().value(), target.value());
            }
            Map<String, Object> columns = sideEffects.apply(request);
            if (requests.transition(id, request.status(), target, columns, clock.instant()) == 0) {
                throw new InvalidStateTransitionException(
                        "Supply chain request %s changed status concurrently".formatted(id));
            }
            return request.status();
        });
        metrics.stateTransition("handoff", target.value());
        log.info("Supply chain request {} moved from {} to {}", id, from.value(), target.value());
        return get(context, id);
    }

    /**
     * Creates the receiving workspace's project and sample for the handed-over material, both
     * pointing back at the request through their external reference.
     */
    private void createReceivingRecords(LabSecurityContext context, SupplyChainRequest request,
                                        Map<String, Object> columns) {
        Instant now = clock.instant();
        String reference = REFERENCE_PREFIX + request.id();
        String fromOrgName = organizations.findActiveInAnyWorkspace(request.fromOrgId())
                .map(Organization::name)
                .orElseThrow(() -> new InvalidStateTransitionException(
                        "Initiating organization %s no longer exists".formatted(request.fromOrgId())));
        MaterialDescriptor material = request.material();
        String materialName = material != null && material.materialName() != null
                ? material.materialName()
                : request.workflowType().value();

        Project project = new Project(
                UUID.randomUUID(),
                request.toWorkspaceId(),
                "Supply chain: " + materialName,
                request.requirements(),
                null,
                null,
                fromOrgName,
                request.toOrgId(),
                null,
                WorkflowMode.ANALYSIS_FIRST,
                ProjectStatus.ACTIVE,
                reference,
                context.userId(),
                now,
                now);
        projects.insert(project);

        Sample sample = new Sample(
                UUID.randomUUID(),
                request.toWorkspaceId(),
                project.id(),
                null,
                materialName,
                material != null ? material.description() : null,
                null,
                material != null ? material.quantity() : null,
                material != null ? material.unit() : null,
                Sample.DEFAULT_STATUS,
                SampleMetadata.empty(),
                material != null && material.sourceSampleId() != null
                        ? reference + ":" + material.sourceSampleId()
                        : reference,
                context.userId(),
                now,
                now);
        samples.insert(sample);

        columns.put("linked_project_id", project.id());
        columns.put("linked_sample_id", sample.id());
        log.info("Request {} created project {} and sample {} in workspace {}", request.id(), project.id(),
                sample.id(), request.toWorkspaceId());
    }

    @FunctionalInterface
    private interface SideEffects {
        Map<String, Object> apply(SupplyChainRequest request);
    }
}
