package com.mylab.labservice.service;

import com.mylab.labservice.domain.access.ObjectType;
import com.mylab.labservice.domain.common.AlreadyExistsException;
import com.mylab.labservice.domain.common.ExecutionMode;
import com.mylab.labservice.domain.common.InvalidDataException;
import com.mylab.labservice.domain.common.Lifecycle;
import com.mylab.labservice.domain.common.NotFoundException;
import com.mylab.labservice.domain.lineage.DerivedSample;
import com.mylab.labservice.domain.lineage.InvalidLineageException;
import com.mylab.labservice.domain.lineage.LineageWalker;
import com.mylab.labservice.domain.lineage.NewDerivedSample;
import com.mylab.labservice.domain.project.Project;
import com.mylab.labservice.domain.sample.Sample;
import com.mylab.labservice.domain.sample.SampleMetadata;
import com.mylab.labservice.infrastructure.persistence.DerivedSampleRepository;
import com.mylab.labservice.infrastructure.persistence.OrganizationRepository;
import com.mylab.labservice.infrastructure.persistence.ProjectRepository;
import com.mylab.labservice.infrastructure.persistence.SampleRepository;
import com.mylab.labservice.infrastructure.persistence.TransactionRunner;
import com.mylab.security.AccessLevel;
import com.mylab.security.LabSecurityContext;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

/**
 * Derived samples and their supersession chains.
 *
 * <p>A chain has exactly one live head. Superseding a record locks it, checks it is still the
 * head, inserts the successor and points the predecessor at it, all in one transaction.
 */
@Service
public class DerivedSampleService {

    private static final Logger log = LoggerFactory.getLogger(DerivedSampleService.class);

    private static final String CODE_CONSTRAINT = "uq_derived_code";

    private final DerivedSampleRepository derivedSamples;
    private final SampleRepository samples;
    private final ProjectRepository projects;
    private final OrganizationRepository organizations;
    private final AuthorizationService authorization;
    private final TransactionRunner tx;
    private final Clock clock;

    public DerivedSampleService(DerivedSampleRepository derivedSamples, SampleRepository samples,
                                ProjectRepository projects, OrganizationRepository organizations,
                                AuthorizationService authorization, TransactionRunner tx, Clock clock) {
        this.derivedSamples = derivedSamples;
        this.samples = samples;
        this.projects = projects;
        this.organizations = organizations;
        this.authorization = authorization;
        this.tx = tx;
        this.clock = clock;
    }

    /**
     * @throws AlreadyExistsException  when the derived code is taken in this workspace
     * @throws InvalidLineageException when {@code supersedesId} is no longer the head of its chain
     */
    public DerivedSample create(LabSecurityContext context, UUID parentSampleId, NewDerivedSample request) {
        request.validate();
        UUID workspaceId = context.workspaceId();
        ExecutionMode mode = ExecutionMode.resolve(request.executionMode(), request.externalReference());
        String derivedCode = request.derivedCode().strip();

        DerivedSample created = tx.inTransaction(() -> {
            if (!samples.lockActive(parentSampleId, workspaceId)) {
                throw new NotFoundException("Sample", parentSampleId);
            }
            Sample parent = samples.findActive(parentSampleId, workspaceId)
                    .orElseThrow(() -> new NotFoundException("Sample", parentSampleId));
            authorization.authorize(context, ObjectType.SAMPLE, parent.id(), parent.workspaceId(), AccessLevel.EDIT);

            if (derivedSamples.codeExists(workspaceId, derivedCode)) {
                throw duplicateCode(derivedCode);
            }

            DerivedSample predecessor = null;
            if (request.supersedesId() != null) {
                predecessor = derivedSamples.findForUpdate(request.supersedesId(), workspaceId)
                        .orElseThrow(() -> new NotFoundException("Derived sample", request.supersedesId()));
                if (!predecessor.parentSampleId().equals(parentSampleId)) {
                    throw new InvalidDataException(
                            "A superseding derived sample must share its predecessor's parent sample");
                }
                if (!predecessor.isHead()) {
                    throw new InvalidLineageException("Derived sample %s is already superseded by %s"
                            .formatted(predecessor.id(), predecessor.supersededById()));
                }
            }

            DerivedSample derived = new DerivedSample(
                    UUID.randomUUID(),
                    workspaceId,
                    parentSampleId,
                    derivedCode,
                    request.name().strip(),
                    request.derivationMethod(),
                    mode,
                    executingOrganization(request, parent, workspaceId),
                    request.externalReference(),
                    request.supersedesId(),
                    null,
                    SampleMetadata.of(0, request.metadata()),
                    Lifecycle.ACTIVE,
                    context.userId(),
                    clock.instant());
            try {
                derivedSamples.insert(derived);
            } catch (DuplicateKeyException e) {
                log.warn("Derived sample insert lost a uniqueness race: {}", e.getMostSpecificCause().getMessage());
                if (violates(e, CODE_CONSTRAINT)) {
                    throw duplicateCode(derivedCode);
                }
                throw new InvalidLineageException(
                        "Derived sample %s was superseded concurrently".formatted(request.supersedesId()));
            }
            if (predecessor != null && derivedSamples.markSuperseded(predecessor.id(), derived.id()) == 0) {
                throw new InvalidLineageException(
                        "Derived sample %s was superseded concurrently".formatted(predecessor.id()));
            }
            return derived;
        });

        if (created.supersedesId() != null) {
            log.info("Derived sample {} supersedes {}", created.id(), created.supersedesId());
        } else {
            log.info("Created derived sample {} from sample {}", created.id(), parentSampleId);
        }
        return created;
    }

    public DerivedSample get(LabSecurityContext context, UUID id) {
        return load(context, id, AccessLevel.VIEW);
    }

    /**
     * Lists live derived samples of a parent the caller can see, including parents shared through a grant.
     */
    public List<DerivedSample> listByParent(LabSecurityContext context, UUID parentSampleId) {
        Sample parent = samples.findActiveInAnyWorkspace(parentSampleId)
                .orElseThrow(() -> new NotFoundException("Sample", parentSampleId));
        authorization.authorize(context, ObjectType.SAMPLE, parentSampleId, parent.workspaceId(), AccessLevel.VIEW);
        return derivedSamples.listByParent(parentSampleId, parent.workspaceId());
    }

    /**
     * Returns the chain from {@code id} back to the root of its lineage, newest first. Deleted
     * predecessors remain in the chain.
     */
    public List<DerivedSample> lineage(LabSecurityContext context, UUID id) {
        DerivedSample start = get(context, id);
        return LineageWalker.walkBack(start, previous -> derivedSamples.findInLineage(previous, start.workspaceId()));
    }

    /**
     * Soft-deletes a derived sample. A deleted head still ends its lineage and can be superseded.
     */
    public void delete(LabSecurityContext context, UUID id) {
        DerivedSample derived = load(context, id, AccessLevel.FULL);
        if (derivedSamples.softDelete(id, derived.workspaceId(), clock.instant()) == 0) {
            throw new NotFoundException("Derived sample", id);
        }
        log.info("Deleted derived sample {}", id);
    }

    private DerivedSample load(LabSecurityContext context, UUID id, AccessLevel required) {
        DerivedSample derived = derivedSamples.findActiveInAnyWorkspace(id)
                .orElseThrow(() -> new NotFoundException("Derived sample", id));
        authorization.authorize(context, ObjectType.DERIVED_SAMPLE, id, derived.workspaceId(), required);
        return derived;
    }

    private static AlreadyExistsException duplicateCode(String derivedCode) {
        return new AlreadyExistsException("Derived code '%s' already exists in this workspace".formatted(derivedCode));
    }

    private static boolean violates(DuplicateKeyException e, String constraint) {
        String detail = e.getMostSpecificCause().getMessage();
        return detail != null && detail.toLowerCase(Locale.ROOT).contains(constraint);
    }

    private UUID executingOrganization(NewDerivedSample request, Sample parent, UUID workspaceId) {
        if (request.executedByOrgId() != null) {
            if (organizations.findActive(request.executedByOrgId(), workspaceId).isEmpty()) {
                throw new InvalidDataException(
                        "Organization %s does not exist in your workspace".formatted(request.executedByOrgId()));
            }
            return request.executedByOrgId();
        }
        return projects.findActive(parent.projectId(), workspaceId).map(Project::executingOrgId).orElse(null);
    }
}
