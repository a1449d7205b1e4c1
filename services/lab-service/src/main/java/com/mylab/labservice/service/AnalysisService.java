package com.mylab.labservice.service;

import com.mylab.labservice.domain.access.ObjectType;
import com.mylab.labservice.domain.analysis.Analysis;
import com.mylab.labservice.domain.analysis.AnalysisResults;
import com.mylab.labservice.domain.analysis.AnalysisStatus;
import com.mylab.labservice.domain.analysis.NewAnalysis;
import com.mylab.labservice.domain.batch.Batch;
import com.mylab.labservice.domain.common.AlreadyExistsException;
import com.mylab.labservice.domain.common.ExecutionMode;
import com.mylab.labservice.domain.common.InvalidDataException;
import com.mylab.labservice.domain.common.InvalidStateTransitionException;
import com.mylab.labservice.domain.common.NotFoundException;
import com.mylab.labservice.domain.common.StaleSupersessionException;
import com.mylab.labservice.infrastructure.persistence.AnalysisRepository;
import com.mylab.labservice.infrastructure.persistence.BatchRepository;
import com.mylab.labservice.infrastructure.persistence.SampleRepository;
import com.mylab.labservice.infrastructure.persistence.TransactionRunner;
import com.mylab.observability.MetricFactory;
import com.mylab.observability.MetricFactory.SupersessionOutcome;
import com.mylab.observability.SpanHelper;
import com.mylab.security.AccessLevel;
import com.mylab.security.LabSecurityContext;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Analyses and the authority rule: per (sample, analysis type) at most one analysis is
 * authoritative at any instant.
 *
 * <p>Every authority change runs in one transaction that locks the batch row, then the sample
 * row. Supersession then compare-and-swaps the predecessor's flag; losing the swap means another
 * writer already replaced it and the whole submission rolls back.
 */
@Service
public class AnalysisService {

    private static final Logger log = LoggerFactory.getLogger(AnalysisService.class);

    private final AnalysisRepository analyses;
    private final BatchRepository batches;
    private final SampleRepository samples;
    private final AuthorizationService authorization;
    private final TransactionRunner tx;
    private final MetricFactory metrics;
    private final SpanHelper spans;
    private final Clock clock;

    public AnalysisService(AnalysisRepository analyses, BatchRepository batches, SampleRepository samples,
                           AuthorizationService authorization, TransactionRunner tx, MetricFactory metrics,
                           SpanHelper spans, Clock clock) {
        this.analyses = analyses;
        this.batches = batches;
        this.samples = samples;
        this.authorization = authorization;
        this.tx = tx;
        this.metrics = metrics;
        this.spans = spans;
        this.clock = clock;
    }

    /**
     * Submits an analysis, optionally superseding the current authoritative one.
     *
     * @throws StaleSupersessionException when the predecessor is no longer authoritative
     * @throws AlreadyExistsException     when a fresh analysis claims authority that is already held
     */
    public Analysis submit(LabSecurityContext context, NewAnalysis request) {
        request.validate();
        authorization.requireWorkspace(context, AccessLevel.EDIT);
        ExecutionMode mode = ExecutionMode.resolve(request.executionMode(), request.externalReference());

        Map<String, String> attributes = Map.of(
                "lab.analysis.type", request.analysisType(),
                "lab.analysis.supersedes", String.valueOf(request.supersedes()));
        return spans.traced("analysis.submit", ObjectType.SAMPLE.value(), request.sampleId(), attributes,
                () -> submitCounted(context, request, mode));
    }

    private Analysis submitCounted(LabSecurityContext context, NewAnalysis request, ExecutionMode mode) {
        try {
            Analysis analysis = tx.inTransaction(() -> submitLocked(context, request, mode));
            if (analysis.supersedesId() != null) {
                metrics.supersession(SupersessionOutcome.SUPERSEDED);
                log.info("Analysis {} superseded {} for sample {} type {}", analysis.id(),
                        analysis.supersedesId(), analysis.sampleId(), analysis.analysisType());
            } else {
                log.info("Submitted analysis {} for sample {} type {} (authoritative={})", analysis.id(),
                        analysis.sampleId(), analysis.analysisType(), analysis.authoritative());
            }
            return analysis;
        } catch (StaleSupersessionException e) {
            metrics.supersession(SupersessionOutcome.STALE);
            log.warn("Rejected stale supersession of analysis {}", e.predecessorId());
            throw e;
        }
    }

    private Analysis submitLocked(LabSecurityContext context, NewAnalysis request, ExecutionMode mode) {
        UUID workspaceId = context.workspaceId();
        Batch batch = batches.findForUpdate(request.batchId(), workspaceId)
                .orElseThrow(() -> new NotFoundException("Batch", request.batchId()));
        if (!batch.status().acceptsAnalyses()) {
            throw new InvalidStateTransitionException("Batch %s is %s and no longer accepts analyses"
                    .formatted(batch.id(), batch.status().value()));
        }
        if (!batches.containsSample(batch.id(), request.sampleId())) {
            throw new InvalidDataException(
                    "Sample %s is not part of batch %s".formatted(request.sampleId(), batch.id()));
        }
        if (!samples.lockActive(request.sampleId(), workspaceId)) {
            throw new NotFoundException("Sample", request.sampleId());
        }

        Instant now = clock.instant();
        boolean authoritative = request.authoritative();
        if (request.supersedes()) {
            Analysis predecessor = analyses.find(request.supersedesId(), workspaceId)
                    .orElseThrow(() -> new NotFoundException("Analysis", request.supersedesId()));
            if (!predecessor.sampleId().equals(request.sampleId())
                    || !predecessor.analysisType().equals(request.analysisType())) {
                throw new InvalidDataException(
                        "A superseding analysis must have the same sample and analysis type as its predecessor");
            }
            if (analyses.revokeAuthority(predecessor.id(), now) == 0) {
                throw new StaleSupersessionException(predecessor.id());
            }
            authoritative = true;
        } else if (authoritative
                && analyses.findAuthoritative(request.sampleId(), request.analysisType(), workspaceId).isPresent()) {
            throw new AlreadyExistsException("Sample %s already has an authoritative %s analysis; supersede it instead"
                    .formatted(request.sampleId(), request.analysisType()));
        }

        Analysis analysis = new Analysis(
                UUID.randomUUID(),
                workspaceId,
                batch.id(),
                request.sampleId(),
                request.analysisType().strip(),
                request.status() != null ? request.status() : AnalysisStatus.PENDING,
                request.results(),
                request.filePath(),
                request.checksum(),
                mode,
                request.externalReference(),
                request.performedAt(),
                authoritative,
                request.supersedesId(),
                1,
                context.userId(),
                null,
                now,
                now);
        analyses.insert(analysis);
        return analysis;
    }

    public Analysis get(LabSecurityContext context, UUID id) {
        return load(context, id, AccessLevel.VIEW);
    }

    /**
     * Lists the analyses of a batch the caller can see, including batches shared through a grant.
     */
    public List<Analysis> listByBatch(LabSecurityContext context, UUID batchId) {
        Batch batch = batches.findInAnyWorkspace(batchId).orElseThrow(() -> new NotFoundException("Batch", batchId));
        authorization.authorize(context, ObjectType.BATCH, batchId, batch.workspaceId(), AccessLevel.VIEW);
        return analyses.listByBatch(batchId, batch.workspaceId());
    }

    public Analysis authoritative(LabSecurityContext context, UUID sampleId, String analysisType) {
        return analyses.findAuthoritative(sampleId, analysisType, context.workspaceId())
                .orElseThrow(() -> new NotFoundException("Authoritative analysis",
                        "%s/%s".formatted(sampleId, analysisType)));
    }

    /**
     * Moves an analysis forward and optionally replaces its results. Results are never edited
     * without a status change; a new revision number is recorded on every call.
     *
     * <p>The owning batch row is locked for the update; once the batch is completed or failed its
     * analyses are frozen.
     *
     * @throws InvalidStateTransitionException when the move goes backward or the batch is terminal
     */
    public Analysis updateStatus(LabSecurityContext context, UUID id, AnalysisStatus target, AnalysisResults results) {
        if (target == null) {
            throw new InvalidDataException("status is required");
        }
        Analysis analysis = load(context, id, AccessLevel.EDIT);
        if (!analysis.status().canTransitionTo(target)) {
            throw new InvalidStateTransitionException("analysis", analysis.status().value(), target.value());
        }
        tx.inTransaction(() -> {
            Batch batch = batches.findForUpdate(analysis.batchId(), analysis.workspaceId())
                    .orElseThrow(() -> new NotFoundException("Batch", analysis.batchId()));
            if (batch.status().isTerminal()) {
                throw new InvalidStateTransitionException("Analysis %s belongs to %s batch %s and can no longer change"
                        .formatted(id, batch.status().value(), batch.id()));
            }
            if (analyses.updateStatus(id, analysis.status(), target, results, context.userId(), clock.instant()) == 0) {
                throw new InvalidStateTransitionException("Analysis %s changed status concurrently".formatted(id));
            }
        });
        log.info("Analysis {} moved from {} to {}", id, analysis.status().value(), target.value());
        return get(context, id);
    }

    private Analysis load(LabSecurityContext context, UUID id, AccessLevel required) {
        Analysis analysis = analyses.findInAnyWorkspace(id).orElseThrow(() -> new NotFoundException("Analysis", id));
        authorization.authorize(context, ObjectType.ANALYSIS, id, analysis.workspaceId(), required);
        return analysis;
    }
}
