package com.mylab.labservice.service;

import com.mylab.labservice.domain.access.ObjectType;
import com.mylab.labservice.domain.common.InvalidDataException;
import com.mylab.labservice.domain.common.NotFoundException;
import com.mylab.labservice.domain.project.Project;
import com.mylab.labservice.domain.trial.NewTrial;
import com.mylab.labservice.domain.trial.ParameterColumn;
import com.mylab.labservice.domain.trial.ParameterTemplate;
import com.mylab.labservice.domain.trial.Trial;
import com.mylab.labservice.domain.trial.TrialStatus;
import com.mylab.labservice.domain.trial.TrialUpdate;
import com.mylab.labservice.infrastructure.persistence.ProjectRepository;
import com.mylab.labservice.infrastructure.persistence.TransactionRunner;
import com.mylab.labservice.infrastructure.persistence.TrialRepository;
import com.mylab.security.AccessLevel;
import com.mylab.security.LabSecurityContext;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Trials and the parameter template of their project.
 */
@Service
public class TrialService {

    private static final Logger log = LoggerFactory.getLogger(TrialService.class);

    static final String PARAMETERS_SUBJECT = "trial parameters";

    private final TrialRepository trials;
    private final ProjectRepository projects;
    private final AuthorizationService authorization;
    private final TransactionRunner tx;
    private final Clock clock;

    public TrialService(TrialRepository trials, ProjectRepository projects, AuthorizationService authorization,
                        TransactionRunner tx, Clock clock) {
        this.trials = trials;
        this.projects = projects;
        this.authorization = authorization;
        this.tx = tx;
        this.clock = clock;
    }

    public Trial create(LabSecurityContext context, UUID projectId, NewTrial request) {
        request.validate();
        Project project = requireProject(context, projectId, AccessLevel.EDIT);
        ParameterTemplate template = currentTemplate(projectId);
        Trial trial = toTrial(context, project, request, template);
        trials.insert(trial);
        log.info("Created trial {} in project {}", trial.id(), projectId);
        return trial;
    }

    /**
     * Creates all trials or none.
     */
    public List<Trial> createBulk(LabSecurityContext context, UUID projectId, List<NewTrial> requests) {
        if (requests == null || requests.isEmpty()) {
            throw new InvalidDataException("At least one trial is required");
        }
        requests.forEach(NewTrial::validate);
        Project project = requireProject(context, projectId, AccessLevel.EDIT);
        return tx.inTransaction(() -> {
            ParameterTemplate template = currentTemplate(projectId);
            List<Trial> created = requests.stream()
                    .map(request -> toTrial(context, project, request, template))
                    .toList();
            created.forEach(trials::insert);
            log.info("Created {} trials in project {}", created.size(), projectId);
            return created;
        });
    }

    public Trial get(LabSecurityContext context, UUID id) {
        return load(context, id, AccessLevel.VIEW);
    }

    public List<Trial> listByProject(LabSecurityContext context, UUID projectId) {
        Project project = requireProject(context, projectId, AccessLevel.VIEW);
        return trials.listByProject(projectId, project.workspaceId());
    }

    public Trial update(LabSecurityContext context, UUID id, TrialUpdate update) {
        if (update.isEmpty()) {
            throw new InvalidDataException("No fields to update");
        }
        if (update.name() != null && update.name().isBlank()) {
            throw new InvalidDataException("Trial name must not be blank");
        }
        Trial trial = load(context, id, AccessLevel.EDIT);
        if (update.parameterValues() != null) {
            currentTemplate(trial.projectId()).validate(update.parameterValues(), PARAMETERS_SUBJECT);
        }
        if (trials.update(id, trial.workspaceId(), update, clock.instant()) == 0) {
            throw new NotFoundException("Trial", id);
        }
        return get(context, id);
    }

    public void delete(LabSecurityContext context, UUID id) {
        Trial trial = load(context, id, AccessLevel.FULL);
        if (trials.softDelete(id, trial.workspaceId(), clock.instant()) == 0) {
            throw new NotFoundException("Trial", id);
        }
        log.info("Deleted trial {}", id);
    }

    /**
     * Returns the project's template, or an empty version-0 template when none was written.
     */
    public ParameterTemplate getTemplate(LabSecurityContext context, UUID projectId) {
        requireProject(context, projectId, AccessLevel.VIEW);
        return currentTemplate(projectId);
    }

    /**
     * Replaces the template wholesale and bumps its version.
     */
    public ParameterTemplate putTemplate(LabSecurityContext context, UUID projectId, List<ParameterColumn> columns) {
        ParameterTemplate.validateColumns(columns);
        Project project = requireProject(context, projectId, AccessLevel.EDIT);
        return tx.inTransaction(() -> {
            Instant now = clock.instant();
            Optional<ParameterTemplate> existing = trials.findTemplateForUpdate(projectId);
            ParameterTemplate next = new ParameterTemplate(
                    projectId, existing.map(t -> t.version() + 1).orElse(1), columns, now);
            if (existing.isPresent()) {
                trials.replaceTemplate(next, context.userId());
            } else {
                trials.insertTemplate(next, project.workspaceId(), context.userId());
            }
            log.info("Wrote parameter template v{} for project {}", next.version(), projectId);
            return next;
        });
    }

    ParameterTemplate currentTemplate(UUID projectId) {
        return trials.findTemplate(projectId).orElseGet(() -> ParameterTemplate.empty(projectId));
    }

    private Trial load(LabSecurityContext context, UUID id, AccessLevel required) {
        Trial trial = trials.findActiveInAnyWorkspace(id).orElseThrow(() -> new NotFoundException("Trial", id));
        authorization.authorize(context, ObjectType.TRIAL, id, trial.workspaceId(), required);
        return trial;
    }

    /**
     * Resolves the project through the grant ledger; trials follow their project's workspace.
     */
    private Project requireProject(LabSecurityContext context, UUID projectId, AccessLevel required) {
        Project project = projects.findActiveInAnyWorkspace(projectId)
                .orElseThrow(() -> new NotFoundException("Project", projectId));
        authorization.authorize(context, ObjectType.PROJECT, projectId, project.workspaceId(), required);
        return project;
    }

    private Trial toTrial(LabSecurityContext context, Project project, NewTrial request, ParameterTemplate template) {
        Map<String, String> values = request.parameterValues() == null ? Map.of() : request.parameterValues();
        template.validate(values, PARAMETERS_SUBJECT);
        Instant now = clock.instant();
        return new Trial(
                UUID.randomUUID(),
                project.workspaceId(),
                project.id(),
                request.name().strip(),
                request.objective(),
                values,
                request.notes(),
                request.status() != null ? request.status() : TrialStatus.PLANNED,
                request.performedAt(),
                context.userId(),
                now,
                now);
    }
}
