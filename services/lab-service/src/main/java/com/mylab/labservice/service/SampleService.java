package com.mylab.labservice.service;

import com.mylab.labservice.domain.access.ObjectType;
import com.mylab.labservice.domain.common.InvalidDataException;
import com.mylab.labservice.domain.common.NotFoundException;
import com.mylab.labservice.domain.project.Project;
import com.mylab.labservice.domain.sample.NewSample;
import com.mylab.labservice.domain.sample.Sample;
import com.mylab.labservice.domain.sample.SampleHasDerivedException;
import com.mylab.labservice.domain.sample.SampleMetadata;
import com.mylab.labservice.domain.sample.SampleUpdate;
import com.mylab.labservice.domain.trial.ParameterTemplate;
import com.mylab.labservice.domain.trial.Trial;
import com.mylab.labservice.infrastructure.persistence.DerivedSampleRepository;
import com.mylab.labservice.infrastructure.persistence.ProjectRepository;
import com.mylab.labservice.infrastructure.persistence.SampleRepository;
import com.mylab.labservice.infrastructure.persistence.TransactionRunner;
import com.mylab.labservice.infrastructure.persistence.TrialRepository;
import com.mylab.security.AccessLevel;
import com.mylab.security.LabSecurityContext;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class SampleService {

    private static final Logger log = LoggerFactory.getLogger(SampleService.class);

    static final String METADATA_SUBJECT = "sample metadata";

    private final SampleRepository samples;
    private final ProjectRepository projects;
    private final TrialRepository trials;
    private final DerivedSampleRepository derivedSamples;
    private final AuthorizationService authorization;
    private final TransactionRunner tx;
    private final Clock clock;

    public SampleService(SampleRepository samples, ProjectRepository projects, TrialRepository trials,
                         DerivedSampleRepository derivedSamples, AuthorizationService authorization,
                         TransactionRunner tx, Clock clock) {
        this.samples = samples;
        this.projects = projects;
        this.trials = trials;
        this.derivedSamples = derivedSamples;
        this.authorization = authorization;
        this.tx = tx;
        this.clock = clock;
    }

    /**
     * Creates a sample in a project of the caller's workspace. A missing or foreign project is
     * invalid input rather than a missing resource.
     */
    public Sample create(LabSecurityContext context, NewSample request) {
        request.validate();
        Project project = projects.findActive(request.projectId(), context.workspaceId())
                .orElseThrow(() -> new InvalidDataException(
                        "Project %s does not exist in your workspace".formatted(request.projectId())));
        authorization.authorize(context, ObjectType.PROJECT, project.id(), project.workspaceId(), AccessLevel.EDIT);

        if (request.trialId() != null) {
            Trial trial = trials.findActive(request.trialId(), context.workspaceId())
                    .orElseThrow(() -> new InvalidDataException("Trial %s does not exist".formatted(request.trialId())));
            if (!trial.projectId().equals(project.id())) {
                throw new InvalidDataException("Trial %s belongs to another project".formatted(trial.id()));
            }
        }

        ParameterTemplate template = trials.findTemplate(project.id())
                .orElseGet(() -> ParameterTemplate.empty(project.id()));
        template.validate(request.metadata(), METADATA_SUBJECT);

        Instant now = clock.instant();
        Sample sample = new Sample(
                UUID.randomUUID(),
                context.workspaceId(),
                project.id(),
                request.trialId(),
                request.name().strip(),
                request.description(),
                request.sampleType(),
                request.quantity(),
                request.unit(),
                Sample.DEFAULT_STATUS,
                SampleMetadata.of(template.version(), request.metadata()),
                null,
                context.userId(),
                now,
                now);
        samples.insert(sample);
        log.info("Created sample {} in project {}", sample.id(), project.id());
        return sample;
    }

    /**
     * Returns a sample of the caller's workspace, or one shared with the caller through a grant.
     */
    public Sample get(LabSecurityContext context, UUID id) {
        return load(context, id, AccessLevel.VIEW);
    }

    /**
     * @param projectId optional project filter; a project shared through a grant lists its samples
     */
    public List<Sample> list(LabSecurityContext context, UUID projectId) {
        if (projectId == null) {
            return samples.listActive(context.workspaceId());
        }
        Project project = projects.findActiveInAnyWorkspace(projectId)
                .orElseThrow(() -> new NotFoundException("Project", projectId));
        authorization.authorize(context, ObjectType.PROJECT, projectId, project.workspaceId(), AccessLevel.VIEW);
        return samples.listByProject(projectId, project.workspaceId());
    }

    public Sample update(LabSecurityContext context, UUID id, SampleUpdate update) {
        update.validate();
        Sample sample = load(context, id, AccessLevel.EDIT);
        if (samples.update(id, sample.workspaceId(), update, clock.instant()) == 0) {
            throw new NotFoundException("Sample", id);
        }
        return get(context, id);
    }

    /**
     * Soft-deletes a sample that no live derived sample points at. The sample row is locked so a
     * derived sample cannot be created in between the check and the delete.
     *
     * @throws SampleHasDerivedException when live derived samples exist
     */
    public void delete(LabSecurityContext context, UUID id) {
        Sample sample = load(context, id, AccessLevel.FULL);
        tx.inTransaction(() -> {
            if (!samples.lockActive(id, sample.workspaceId())) {
                throw new NotFoundException("Sample", id);
            }
            long derived = derivedSamples.countActiveByParent(id);
            if (derived > 0) {
                throw new SampleHasDerivedException(derived);
            }
            samples.softDelete(id, sample.workspaceId(), clock.instant());
        });
        log.info("Deleted sample {}", id);
    }

    private Sample load(LabSecurityContext context, UUID id, AccessLevel required) {
        Sample sample = samples.findActiveInAnyWorkspace(id).orElseThrow(() -> new NotFoundException("Sample", id));
        authorization.authorize(context, ObjectType.SAMPLE, id, sample.workspaceId(), required);
        return sample;
    }
}
