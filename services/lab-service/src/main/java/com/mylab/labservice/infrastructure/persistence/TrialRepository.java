package com.mylab.labservice.infrastructure.persistence;

import static com.mylab.labservice.infrastructure.persistence.JdbcRows.instant;
import static com.mylab.labservice.infrastructure.persistence.JdbcRows.ts;
import static com.mylab.labservice.infrastructure.persistence.JdbcRows.uuid;

import com.fasterxml.jackson.core.type.TypeReference;
import com.mylab.labservice.domain.trial.ParameterColumn;
import com.mylab.labservice.domain.trial.ParameterTemplate;
import com.mylab.labservice.domain.trial.Trial;
import com.mylab.labservice.domain.trial.TrialStatus;
import com.mylab.labservice.domain.trial.TrialUpdate;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * Trials and the per-project parameter template they are validated against.
 */
@Repository
public class TrialRepository {

    private static final TypeReference<Map<String, String>> VALUES = new TypeReference<>() {
    };
    private static final TypeReference<List<ParameterColumn>> COLUMNS = new TypeReference<>() {
    };

    private static final String SELECT = """
            SELECT id, workspace_id, project_id, name, objective, parameter_values, notes, status,
                   performed_at, created_by, created_at, updated_at
            FROM trials
            """;

    private final NamedParameterJdbcTemplate jdbc;
    private final JsonColumns json;
    private final RowMapper<Trial> mapper;

    public TrialRepository(NamedParameterJdbcTemplate jdbc, JsonColumns json) {
        this.jdbc = jdbc;
        this.json = json;
        this.mapper = (rs, rowNum) -> {
            Map<String, String> values = json.read(rs.getString("parameter_values"), VALUES);
            return new Trial(
                    uuid(rs, "id"),
                    uuid(rs, "workspace_id"),
                    uuid(rs, "project_id"),
                    rs.getString("name"),
                    rs.getString("objective"),
                    values == null ? Map.of() : values,
                    rs.getString("notes"),
                    TrialStatus.fromValue(rs.getString("status")),
                    instant(rs, "performed_at"),
                    uuid(rs, "created_by"),
                    instant(rs, "created_at"),
                    instant(rs, "updated_at"));
        };
    }

    public void insert(Trial trial) {
        jdbc.update("""
                INSERT INTO trials (id, workspace_id, project_id, name, objective, parameter_values, notes, status,
                                    performed_at, created_by, lifecycle, created_at, updated_at)
                VALUES (:id, :workspaceId, :projectId, :name, :objective, :parameterValues, :notes, :status,
                        :performedAt, :createdBy, 'ACTIVE', :createdAt, :updatedAt)
                """, new MapSqlParameterSource()
                .addValue("id", trial.id())
                .addValue("workspaceId", trial.workspaceId())
                .addValue("projectId", trial.projectId())
                .addValue("name", trial.name())
                .addValue("objective", trial.objective())
                .addValue("parameterValues", json.write(trial.parameterValues()))
                .addValue("notes", trial.notes())
                .addValue("status", trial.status().value())
                .addValue("performedAt", ts(trial.performedAt()))
                .addValue("createdBy", trial.createdBy())
                .addValue("createdAt", ts(trial.createdAt()))
                .addValue("updatedAt", ts(trial.updatedAt())));
    }

    public Optional<Trial> findActive(UUID id, UUID workspaceId) {
        return jdbc.query(SELECT + " WHERE id = :id AND workspace_id = :workspaceId AND lifecycle = 'ACTIVE'",
                new MapSqlParameterSource().addValue("id", id).addValue("workspaceId", workspaceId), mapper)
                .stream().findFirst();
    }

    /**
     * Unscoped lookup; callers must authorize the result against the grant ledger.
     */
    public Optional<Trial> findActiveInAnyWorkspace(UUID id) {
        return jdbc.query(SELECT + " WHERE id = :id AND lifecycle = 'ACTIVE'",
                new MapSqlParameterSource("id", id), mapper).stream().findFirst();
    }

    public List<Trial> listByProject(UUID projectId, UUID workspaceId) {
        return jdbc.query(SELECT + """
                 WHERE project_id = :projectId AND workspace_id = :workspaceId AND lifecycle = 'ACTIVE'
                ORDER BY created_at DESC, id
                """, new MapSqlParameterSource()
                .addValue("projectId", projectId)
                .addValue("workspaceId", workspaceId), mapper);
    }

    public int update(UUID id, UUID workspaceId, TrialUpdate update, Instant now) {
        DynamicUpdate sql = new DynamicUpdate()
                .set("name", update.name())
                .set("objective", update.objective())
                .set("parameter_values", json.write(update.parameterValues()))
                .set("notes", update.notes())
                .set("status", update.status() == null ? null : update.status().value())
                .set("performed_at", ts(update.performedAt()));
        if (sql.isEmpty()) {
            return 0;
        }
        sql.param("id", id).param("workspaceId", workspaceId).param("now", ts(now));
        return jdbc.update(sql.sql("trials", "updated_at = :now",
                "id = :id AND workspace_id = :workspaceId AND lifecycle = 'ACTIVE'"), sql.params());
    }

    public int softDelete(UUID id, UUID workspaceId, Instant now) {
        return jdbc.update("""
                UPDATE trials SET lifecycle = 'DELETED', deleted_at = :now, updated_at = :now
                WHERE id = :id AND workspace_id = :workspaceId AND lifecycle = 'ACTIVE'
                """, new MapSqlParameterSource()
                .addValue("id", id)
                .addValue("workspaceId", workspaceId)
                .addValue("now", ts(now)));
    }

    public Optional<ParameterTemplate> findTemplate(UUID projectId) {
        return queryTemplate(projectId, "");
    }

    /**
     * Reads the template row under a row lock so concurrent overwrites get consecutive versions.
     */
    public Optional<ParameterTemplate> findTemplateForUpdate(UUID projectId) {
        return queryTemplate(projectId, " FOR UPDATE");
    }

    private Optional<ParameterTemplate> queryTemplate(UUID projectId, String lock) {
        return jdbc.query("""
                SELECT project_id, version, columns_json, updated_at
                FROM trial_parameter_templates WHERE project_id = :projectId
                """ + lock, new MapSqlParameterSource("projectId", projectId), (rs, rowNum) -> new ParameterTemplate(
                uuid(rs, "project_id"),
                rs.getInt("version"),
                json.read(rs.getString("columns_json"), COLUMNS),
                instant(rs, "updated_at"))).stream().findFirst();
    }

    public void insertTemplate(ParameterTemplate template, UUID workspaceId, UUID updatedBy) {
        jdbc.update("""
                INSERT INTO trial_parameter_templates (project_id, workspace_id, version, columns_json, updated_by, updated_at)
                VALUES (:projectId, :workspaceId, :version, :columns, :updatedBy, :updatedAt)
                """, templateParams(template, updatedBy).addValue("workspaceId", workspaceId));
    }

    public void replaceTemplate(ParameterTemplate template, UUID updatedBy) {
        jdbc.update("""
                UPDATE trial_parameter_templates
                SET version = :version, columns_json = :columns, updated_by = :updatedBy, updated_at = :updatedAt
                WHERE project_id = :projectId
                """, templateParams(template, updatedBy));
    }

    private MapSqlParameterSource templateParams(ParameterTemplate template, UUID updatedBy) {
        return new MapSqlParameterSource()
                .addValue("projectId", template.projectId())
                .addValue("version", template.version())
                .addValue("columns", json.write(template.columns()))
                .addValue("updatedBy", updatedBy)
                .addValue("updatedAt", ts(template.updatedAt()));
    }
}
