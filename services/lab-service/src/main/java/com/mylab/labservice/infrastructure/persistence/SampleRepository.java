package com.mylab.labservice.infrastructure.persistence;

import static com.mylab.labservice.infrastructure.persistence.JdbcRows.instant;
import static com.mylab.labservice.infrastructure.persistence.JdbcRows.ts;
import static com.mylab.labservice.infrastructure.persistence.JdbcRows.uuid;

import com.mylab.labservice.domain.sample.Sample;
import com.mylab.labservice.domain.sample.SampleMetadata;
import com.mylab.labservice.domain.sample.SampleUpdate;
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
public class SampleRepository {

    private static final String SELECT = """
            SELECT id, workspace_id, project_id, trial_id, name, description, sample_type, quantity, unit, status,
                   metadata, external_reference, created_by, created_at, updated_at
            FROM samples
            """;

    private final NamedParameterJdbcTemplate jdbc;
    private final JsonColumns json;
    private final RowMapper<Sample> mapper;

    public SampleRepository(NamedParameterJdbcTemplate jdbc, JsonColumns json) {
        this.jdbc = jdbc;
        this.json = json;
        this.mapper = (rs, rowNum) -> {
            SampleMetadata metadata = json.read(rs.getString("metadata"), SampleMetadata.class);
            return new Sample(
                    uuid(rs, "id"),
                    uuid(rs, "workspace_id"),
                    uuid(rs, "project_id"),
                    uuid(rs, "trial_id"),
                    rs.getString("name"),
                    rs.getString("description"),
                    rs.getString("sample_type"),
                    rs.getBigDecimal("quantity"),
                    rs.getString("unit"),
                    rs.getString("status"),
                    metadata == null ? SampleMetadata.empty() : metadata,
                    rs.getString("external_reference"),
                    uuid(rs, "created_by"),
                    instant(rs, "created_at"),
                    instant(rs, "updated_at"));
        };
    }

    public void insert(Sample sample) {
        jdbc.update("""
                INSERT INTO samples (id, workspace_id, project_id, trial_id, name, description, sample_type, quantity,
                                     unit, status, metadata, external_reference, created_by, lifecycle, created_at,
                                     updated_at)
                VALUES (:id, :workspaceId, :projectId, :trialId, :name, :description, :sampleType, :quantity,
                        :unit, :status, :metadata, :externalReference, :createdBy, 'ACTIVE', :createdAt, :updatedAt)
                """, new MapSqlParameterSource()
                .addValue("id", sample.id())
                .addValue("workspaceId", sample.workspaceId())
                .addValue("projectId", sample.projectId())
                .addValue("trialId", sample.trialId())
                .addValue("name", sample.name())
                .addValue("description", sample.description())
                .addValue("sampleType", sample.sampleType())
                .addValue("quantity", sample.quantity())
                .addValue("unit", sample.unit())
                .addValue("status", sample.status())
                .addValue("metadata", json.write(sample.metadata()))
                .addValue("externalReference", sample.externalReference())
                .addValue("createdBy", sample.createdBy())
                .addValue("createdAt", ts(sample.createdAt()))
                .addValue("updatedAt", ts(sample.updatedAt())));
    }

    public Optional<Sample> findActive(UUID id, UUID workspaceId) {
        return jdbc.query(SELECT + " WHERE id = :id AND workspace_id = :workspaceId AND lifecycle = 'ACTIVE'",
                new MapSqlParameterSource().addValue("id", id).addValue("workspaceId", workspaceId), mapper)
                .stream().findFirst();
    }

    /**
     * Unscoped lookup; callers must authorize the result against the grant ledger.
     */
    public Optional<Sample> findActiveInAnyWorkspace(UUID id) {
        return jdbc.query(SELECT + " WHERE id = :id AND lifecycle = 'ACTIVE'",
                new MapSqlParameterSource("id", id), mapper).stream().findFirst();
    }

    /**
     * Locks the live sample row. Every change to analysis authority for the sample goes through
     * this lock, which serializes competing writers.
     *
     * @return false when the sample is absent, deleted or in another workspace
     */
    public boolean lockActive(UUID id, UUID workspaceId) {
        List<UUID> ids = jdbc.queryForList("""
                SELECT id FROM samples
                WHERE id = :id AND workspace_id = :workspaceId AND lifecycle = 'ACTIVE'
                FOR UPDATE
                """, new MapSqlParameterSource().addValue("id", id).addValue("workspaceId", workspaceId), UUID.class);
        return !ids.isEmpty();
    }

    public List<Sample> listByProject(UUID projectId, UUID workspaceId) {
        return jdbc.query(SELECT + """
                 WHERE project_id = :projectId AND workspace_id = :workspaceId AND lifecycle = 'ACTIVE'
                ORDER BY created_at DESC, id
                """, new MapSqlParameterSource()
                .addValue("projectId", projectId)
                .addValue("workspaceId", workspaceId), mapper);
    }

    public List<Sample> listActive(UUID workspaceId) {
        return jdbc.query(SELECT + " WHERE workspace_id = :workspaceId AND lifecycle = 'ACTIVE' ORDER BY created_at DESC, id",
                new MapSqlParameterSource("workspaceId", workspaceId), mapper);
    }

    public int countActiveIn(Collection<UUID> ids, UUID workspaceId) {
        Integer count = jdbc.queryForObject("""
                SELECT COUNT(*) FROM samples
                WHERE id IN (:ids) AND workspace_id = :workspaceId AND lifecycle = 'ACTIVE'
                """, new MapSqlParameterSource().addValue("ids", ids).addValue("workspaceId", workspaceId),
                Integer.class);
        return count == null ? 0 : count;
    }

    public int update(UUID id, UUID workspaceId, SampleUpdate update, Instant now) {
        DynamicUpdate sql = new DynamicUpdate()
                .set("name", update.name())
                .set("description", update.description())
                .set("sample_type", update.sampleType())
                .set("quantity", update.quantity())
                .set("unit", update.unit())
                .set("status", update.status());
        if (sql.isEmpty()) {
            return 0;
        }
        sql.param("id", id).param("workspaceId", workspaceId).param("now", ts(now));
        return jdbc.update(sql.sql("samples", "updated_at = :now",
                "id = :id AND workspace_id = :workspaceId AND lifecycle = 'ACTIVE'"), sql.params());
    }

    public int softDelete(UUID id, UUID workspaceId, Instant now) {
        return jdbc.update("""
                UPDATE samples SET lifecycle = 'DELETED', deleted_at = :now, updated_at = :now
                WHERE id = :id AND workspace_id = :workspaceId AND lifecycle = 'ACTIVE'
                """, new MapSqlParameterSource()
                .addValue("id", id)
                .addValue("workspaceId", workspaceId)
                .addValue("now", ts(now)));
    }
}
