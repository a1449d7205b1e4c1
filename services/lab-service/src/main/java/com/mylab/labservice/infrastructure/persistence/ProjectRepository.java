package com.mylab.labservice.infrastructure.persistence;

import static com.mylab.labservice.infrastructure.persistence.JdbcRows.instant;
import static com.mylab.labservice.infrastructure.persistence.JdbcRows.ts;
import static com.mylab.labservice.infrastructure.persistence.JdbcRows.uuid;

import com.mylab.labservice.domain.project.Project;
import com.mylab.labservice.domain.project.ProjectStatus;
import com.mylab.labservice.domain.project.ProjectUpdate;
import com.mylab.labservice.domain.project.WorkflowMode;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class ProjectRepository {

    private static final String SELECT = """
            SELECT p.id, p.workspace_id, p.name, p.description, p.client_org_id, c.name AS client_org_name,
                   p.external_client_name, p.executing_org_id, e.name AS executing_org_name, p.workflow_mode,
                   p.status, p.external_reference, p.created_by, p.created_at, p.updated_at
            FROM projects p
            LEFT JOIN organizations c ON c.id = p.client_org_id
            LEFT JOIN organizations e ON e.id = p.executing_org_id
            """;

    private static final RowMapper<Project> MAPPER = (rs, rowNum) -> new Project(
            uuid(rs, "id"),
            uuid(rs, "workspace_id"),
            rs.getString("name"),
            rs.getString("description"),
            uuid(rs, "client_org_id"),
            rs.getString("client_org_name"),
            rs.getString("external_client_name"),
            uuid(rs, "executing_org_id"),
            rs.getString("executing_org_name"),
            WorkflowMode.fromValue(rs.getString("workflow_mode")),
            ProjectStatus.fromValue(rs.getString("status")),
            rs.getString("external_reference"),
            uuid(rs, "created_by"),
            instant(rs, "created_at"),
            instant(rs, "updated_at"));

    private final NamedParameterJdbcTemplate jdbc;

    public ProjectRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public void insert(Project project) {
        jdbc.update("""
                INSERT INTO projects (id, workspace_id, name, description, client_org_id, external_client_name,
                                      executing_org_id, workflow_mode, status, external_reference, created_by,
                                      lifecycle, created_at, updated_at)
                VALUES (:id, :workspaceId, :name, :description, :clientOrgId, :externalClientName,
                        :executingOrgId, :workflowMode, :status, :externalReference, :createdBy,
                        'ACTIVE', :createdAt, :updatedAt)
                """, new MapSqlParameterSource()
                .addValue("id", project.id())
                .addValue("workspaceId", project.workspaceId())
                .addValue("name", project.name())
                .addValue("description", project.description())
                .addValue("clientOrgId", project.clientOrgId())
                .addValue("externalClientName", project.externalClientName())
                .addValue("executingOrgId", project.executingOrgId())
                .addValue("workflowMode", project.workflowMode().value())
                .addValue("status", project.status().value())
                .addValue("externalReference", project.externalReference())
                .addValue("createdBy", project.createdBy())
                .addValue("createdAt", ts(project.createdAt()))
                .addValue("updatedAt", ts(project.updatedAt())));
    }

    public Optional<Project> findActive(UUID id, UUID workspaceId) {
        return jdbc.query(SELECT + " WHERE p.id = :id AND p.workspace_id = :workspaceId AND p.lifecycle = 'ACTIVE'",
                new MapSqlParameterSource().addValue("id", id).addValue("workspaceId", workspaceId), MAPPER)
                .stream().findFirst();
    }

    /**
     * Unscoped lookup; callers must authorize the result against the grant ledger.
     */
    public Optional<Project> findActiveInAnyWorkspace(UUID id) {
        return jdbc.query(SELECT + " WHERE p.id = :id AND p.lifecycle = 'ACTIVE'",
                new MapSqlParameterSource("id", id), MAPPER).stream().findFirst();
    }

    public List<Project> list(UUID workspaceId, int limit, int offset) {
        return jdbc.query(SELECT + """
                 WHERE p.workspace_id = :workspaceId AND p.lifecycle = 'ACTIVE'
                ORDER BY p.created_at DESC, p.id
                LIMIT :limit OFFSET :offset
                """, new MapSqlParameterSource()
                .addValue("workspaceId", workspaceId)
                .addValue("limit", limit)
                .addValue("offset", offset), MAPPER);
    }

    public long count(UUID workspaceId) {
        Long count = jdbc.queryForObject(
                "SELECT COUNT(*) FROM projects WHERE workspace_id = :workspaceId AND lifecycle = 'ACTIVE'",
                new MapSqlParameterSource("workspaceId", workspaceId), Long.class);
        return count == null ? 0 : count;
    }

    public int update(UUID id, UUID workspaceId, ProjectUpdate update, Instant now) {
        DynamicUpdate sql = new DynamicUpdate()
                .set("name", update.name())
                .set("description", update.description())
                .set("status", update.status() == null ? null : update.status().value())
                .set("workflow_mode", update.workflowMode() == null ? null : update.workflowMode().value());
        if (sql.isEmpty()) {
            return 0;
        }
        sql.param("id", id).param("workspaceId", workspaceId).param("now", ts(now));
        return jdbc.update(sql.sql("projects", "updated_at = :now",
                "id = :id AND workspace_id = :workspaceId AND lifecycle = 'ACTIVE'"), sql.params());
    }

    public int softDelete(UUID id, UUID workspaceId, Instant now) {
        return jdbc.update("""
                UPDATE projects SET lifecycle = 'DELETED', deleted_at = :now, updated_at = :now
                WHERE id = :id AND workspace_id = :workspaceId AND lifecycle = 'ACTIVE'
                """, new MapSqlParameterSource()
                .addValue("id", id)
                .addValue("workspaceId", workspaceId)
                .addValue("now", ts(now)));
    }
}
