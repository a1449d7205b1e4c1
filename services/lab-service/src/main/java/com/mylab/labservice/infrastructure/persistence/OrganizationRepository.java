package com.mylab.labservice.infrastructure.persistence;

import static com.mylab.labservice.infrastructure.persistence.JdbcRows.instant;
import static com.mylab.labservice.infrastructure.persistence.JdbcRows.ts;
import static com.mylab.labservice.infrastructure.persistence.JdbcRows.uuid;

import com.mylab.labservice.domain.common.Lifecycle;
import com.mylab.labservice.domain.organization.ContactInfo;
import com.mylab.labservice.domain.organization.Organization;
import com.mylab.labservice.domain.organization.OrganizationType;
import com.mylab.labservice.domain.organization.OrganizationUpdate;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class OrganizationRepository {

    private static final String SELECT = """
            SELECT id, workspace_id, name, org_type, contact_info, lifecycle, created_at, updated_at
            FROM organizations
            """;

    private final NamedParameterJdbcTemplate jdbc;
    private final JsonColumns json;
    private final RowMapper<Organization> mapper;

    public OrganizationRepository(NamedParameterJdbcTemplate jdbc, JsonColumns json) {
        this.jdbc = jdbc;
        this.json = json;
        this.mapper = (rs, rowNum) -> new Organization(
                uuid(rs, "id"),
                uuid(rs, "workspace_id"),
                rs.getString("name"),
                OrganizationType.fromValue(rs.getString("org_type")),
                json.read(rs.getString("contact_info"), ContactInfo.class),
                Lifecycle.valueOf(rs.getString("lifecycle")),
                instant(rs, "created_at"),
                instant(rs, "updated_at"));
    }

    public void insert(Organization organization) {
        jdbc.update("""
                INSERT INTO organizations (id, workspace_id, name, org_type, contact_info, lifecycle, created_at, updated_at)
                VALUES (:id, :workspaceId, :name, :type, :contactInfo, :lifecycle, :createdAt, :updatedAt)
                """, new MapSqlParameterSource()
                .addValue("id", organization.id())
                .addValue("workspaceId", organization.workspaceId())
                .addValue("name", organization.name())
                .addValue("type", organization.type().value())
                .addValue("contactInfo", json.write(organization.contactInfo()))
                .addValue("lifecycle", organization.lifecycle().name())
                .addValue("createdAt", ts(organization.createdAt()))
                .addValue("updatedAt", ts(organization.updatedAt())));
    }

    public Optional<Organization> findActive(UUID id, UUID workspaceId) {
        return jdbc.query(SELECT + " WHERE id = :id AND workspace_id = :workspaceId AND lifecycle = 'ACTIVE'",
                new MapSqlParameterSource().addValue("id", id).addValue("workspaceId", workspaceId), mapper)
                .stream().findFirst();
    }

    /**
     * Looks an organization up regardless of workspace. Only for cross-workspace handoffs, where
     * the receiving party lives in another tenant.
     */
    public Optional<Organization> findActiveInAnyWorkspace(UUID id) {
        return jdbc.query(SELECT + " WHERE id = :id AND lifecycle = 'ACTIVE'",
                new MapSqlParameterSource("id", id), mapper).stream().findFirst();
    }

    public List<Organization> listActive(UUID workspaceId) {
        return jdbc.query(SELECT + " WHERE workspace_id = :workspaceId AND lifecycle = 'ACTIVE' ORDER BY created_at DESC",
                new MapSqlParameterSource("workspaceId", workspaceId), mapper);
    }

    /**
     * Counts how many of {@code ids} are live organizations of the workspace, in one query.
     */
    public int countActiveIn(Collection<UUID> ids, UUID workspaceId) {
        Integer count = jdbc.queryForObject("""
                SELECT COUNT(*) FROM organizations
                WHERE id IN (:ids) AND workspace_id = :workspaceId AND lifecycle = 'ACTIVE'
                """, new MapSqlParameterSource().addValue("ids", ids).addValue("workspaceId", workspaceId),
                Integer.class);
        return count == null ? 0 : count;
    }

    public int update(UUID id, UUID workspaceId, OrganizationUpdate update, Instant now) {
        DynamicUpdate sql = new DynamicUpdate()
                .set("name", update.name())
                .set("org_type", update.type() == null ? null : update.type().value())
                .set("contact_info", json.write(update.contactInfo()));
        if (sql.isEmpty()) {
            return 0;
        }
        sql.param("id", id).param("workspaceId", workspaceId).param("now", ts(now));
        return jdbc.update(sql.sql("organizations", "updated_at = :now",
                "id = :id AND workspace_id = :workspaceId AND lifecycle = 'ACTIVE'"), sql.params());
    }

    public int softDelete(UUID id, UUID workspaceId, Instant now) {
        return jdbc.update("""
                UPDATE organizations SET lifecycle = 'DELETED', deleted_at = :now, updated_at = :now
                WHERE id = :id AND workspace_id = :workspaceId AND lifecycle = 'ACTIVE'
                """, new MapSqlParameterSource()
                .addValue("id", id)
                .addValue("workspaceId", workspaceId)
                .addValue("now", ts(now)));
    }
}
