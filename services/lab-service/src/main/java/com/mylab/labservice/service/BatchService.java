package com.mylab.labservice.service;

import com.mylab.labservice.domain.access.ObjectType;
import com.mylab.labservice.domain.batch.Batch;
import com.mylab.labservice.domain.batch.BatchStatus;
import com.mylab.labservice.domain.batch.IncompleteBatchException;
import com.mylab.labservice.domain.batch.NewBatch;
import com.mylab.labservice.domain.common.AlreadyExistsException;
import com.mylab.labservice.domain.common.ExecutionMode;
import com.mylab.labservice.domain.common.InvalidDataException;
import com.mylab.labservice.domain.common.InvalidStateTransitionException;
import com.mylab.labservice.domain.common.NotFoundException;
import com.mylab.labservice.infrastructure.persistence.AnalysisRepository;
import com.mylab.labservice.infrastructure.persistence.BatchRepository;
import com.mylab.labservice.infrastructure.persistence.OrganizationRepository;
import com.mylab.labservice.infrastructure.persistence.SampleRepository;
import com.mylab.labservice.infrastructure.persistence.TransactionRunner;
import com.mylab.observability.MetricFactory;
import com.mylab.security.AccessLevel;
import com.mylab.security.LabSecurityContext;
import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

/**
 * Batches and their forward-only lifecycle.
 */
@Service
public class BatchService {

    private static final Logger log = LoggerFactory.getLogger(BatchService.class);

    private final BatchRepository batches;
    private final SampleRepository samples;
    private final AnalysisRepository analyses;
    private final OrganizationRepository organizations;
    private final AuthorizationService authorization;
    private final TransactionRunner tx;
    private final MetricFactory metrics;
    private final Clock clock;

    public BatchService(BatchRepository batches, SampleRepository samples, AnalysisRepository analyses,
                        OrganizationRepository organizations, AuthorizationService authorization,
                        TransactionRunner tx, MetricFactory metrics, Clock clock) {
        this.batches = batches;
        this.samples = samples;
        this.analyses = analyses;
        this.organizations = organizations;
        this.authorization = authorization;
        this.tx = tx;
        this.metrics = metrics;
        this.clock = clock;
    }

    public Batch create(LabSecurityContext context, NewBatch request) {
        request.validate();
        authorization.requireWorkspace(context, AccessLevel.EDIT);
        UUID workspaceId = context.workspaceId();
        ExecutionMode mode = ExecutionMode.resolve(request.executionMode(), request.externalReference());
        List<UUID> sampleIds = request.sampleIds() == null ? List.of() : List.copyOf(request.sampleIds());

        if (request.executedByOrgId() != null
                && organizations.findActive(request.executedByOrgId(), workspaceId).isEmpty()) {
            throw new InvalidDataException(
                    "Organization %s does not exist in your workspace".formatted(request.executedByOrgId()));
        }
        requireSamples(sampleIds, workspaceId);

        Instant now = clock.instant();
        Batch batch = new Batch(
                UUID.randomUUID(),
                workspaceId,
                request.batchCode().strip(),
                request.description(),
                BatchStatus.CREATED,
                mode,
                request.executedByOrgId(),
                request.externalReference(),
                sampleIds,
                null,
                null,
                context.userId(),
                now,
                now);
        tx.inTransaction(() -> {
            try {
                batches.insert(batch);
            } catch (DuplicateKeyException e) {
                throw new AlreadyExistsException(
                        "Batch code '%s' already exists in this workspace".formatted(batch.batchCode()));
            }
        });
        log.info("Created batch {} ({}) with {} samples", batch.id(), batch.batchCode(), batch.sampleCount());
        return batch;
    }

    /**
     * Returns a batch of the caller's workspace, or one shared with the caller through a grant.
     */
    public Batch get(LabSecurityContext context, UUID id) {
        Batch batch = batches.findInAnyWorkspace(id).orElseThrow(() -> new NotFoundException("Batch", id));
        authorization.authorize(context, ObjectType.BATCH, id, batch.workspaceId(), AccessLevel.VIEW);
        return batch;
    }

    public List<Batch> list(LabSecurityContext context, BatchStatus status) {
        return batches.list(context.workspaceId(), status);
    }

    /**
     * Appends samples while the batch still accepts them.
     */
    public Batch addSamples(LabSecurityContext context, UUID id, List<UUID> sampleIds) {
        if (sampleIds == null || sampleIds.isEmpty()) {
            throw new InvalidDataException("sampleIds must not be empty");
        }
        if (new HashSet<>(sampleIds).size() != sampleIds.size()) {
            throw new InvalidDataException("sampleIds must not contain duplicates");
        }
        UUID workspaceId = context.workspaceId();
        authorization.authorize(context, ObjectType.BATCH, id, workspaceId, AccessLevel.EDIT);
        tx.inTransaction(() -> {
            Batch batch = batches.findForUpdate(id, workspaceId).orElseThrow(() -> new NotFoundException("Batch", id));
            if (!batch.status().acceptsSamples()) {
                throw new InvalidStateTransitionException(
                        "Batch %s is %s and no longer accepts samples".formatted(id, batch.status().value()));
            }
            List<UUID> members = batches.sampleIds(id);
            Set<UUID> existing = new HashSet<>(members);
            for (UUID sampleId : sampleIds) {
                if (existing.contains(sampleId)) {
                    throw new InvalidDataException("Sample %s is already part of batch %s".formatted(sampleId, id));
                }
            }
            requireSamples(sampleIds, workspaceId);
            batches.addItems(id, members.size(), sampleIds);
        });
        return get(context, id);
    }

    /**
     * Moves the batch forward. Completing requires every analysis of the batch to be terminal.
     *
     * @throws InvalidStateTransitionException on a backward, repeated or post-terminal move
     * @throws IncompleteBatchException        when completing with open analyses
     */
    public Batch transition(LabSecurityContext context, UUID id, BatchStatus target) {
        if (target == null) {
            throw new InvalidDataException("status is required");
        }
        UUID workspaceId = context.workspaceId();
        authorization.authorize(context, ObjectType.BATCH, id, workspaceId, AccessLevel.EDIT);
        BatchStatus from = tx.inTransaction(() -> {
            Batch batch = batches.findForUpdate(id, workspaceId).orElseThrow(() -> new NotFoundException("Batch", id));
            if (!batch.status().canTransitionTo(target)) {
                throw new InvalidStateTransitionException("batch", batch.status().value(), target.value());
            }
            if (target == BatchStatus.COMPLETED) {
                long open = analyses.countOpenByBatch(id);
                if (open > 0) {
                    throw new IncompleteBatchException(id, open);
                }
            }
            if (batches.transition(id, workspaceId, batch.status(), target, clock.instant()) == 0) {
                throw new InvalidStateTransitionException(
                        "Batch %s changed status concurrently".formatted(id));
            }
            return batch.status();
        });
        metrics.stateTransition("batch", target.value());
        log.info("Batch {} moved from {} to {}", id, from.value(), target.value());
        return get(context, id);
    }

    private void requireSamples(List<UUID> sampleIds, UUID workspaceId) {
        if (!sampleIds.isEmpty() && samples.countActiveIn(sampleIds, workspaceId) != sampleIds.size()) {
            throw new InvalidDataException("Every sample must exist in your workspace");
        }
    }
}
