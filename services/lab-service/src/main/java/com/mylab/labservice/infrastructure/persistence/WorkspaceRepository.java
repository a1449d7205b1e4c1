package com.mylab.labservice.infrastructure.persistence;

import static com.mylab.labservice.infrastructure.persistence.JdbcRows.instant;
import static com.mylab.labservice.infrastructure.persistence.JdbcRows.ts;
import static com.mylab.labservice.infrastructure.persistence.JdbcRows.uuid;

import com.mylab.labservice.domain.common.Lifecycle;
import com.mylab.labservice.domain.workspace.Workspace;
import java.util.Optional;
import java.util.UUID;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class WorkspaceRepository {

    private static final RowMapper<Workspace> MAPPER = (rs, rowNum) -> new Workspace(
            uuid(rs, "id"),
            rs.getString("name"),
            uuid(rs, "parent_workspace_id"),
            Lifecycle.valueOf(rs.getString("lifecycle")),
            instant(rs, "created_at"));

    private final NamedParameterJdbcTemplate jdbc;

    public WorkspaceRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public void insert(Workspace workspace) {
        jdbc.update("""
                INSERT INTO workspaces (id, name, parent_workspace_id, lifecycle, created_at)
                VALUES (:id, :name, :parentId, :lifecycle, :createdAt)
                """, new MapSqlParameterSource()
                .addValue("id", workspace.id())
                .addValue("name", workspace.name())
                .addValue("parentId", workspace.parentWorkspaceId())
                .addValue("lifecycle", workspace.lifecycle().name())
                .addValue("createdAt", ts(workspace.createdAt())));
    }

    public Optional<Workspace> findActive(UUID id) {
        return jdbc.query("""
                SELECT id, name, parent_workspace_id, lifecycle, created_at
                FROM workspaces WHERE id = :id AND lifecycle = 'ACTIVE'
                """, new MapSqlParameterSource("id", id), MAPPER).stream().findFirst();
    }
}
