package com.mylab.labservice.infrastructure.persistence;

import static com.mylab.labservice.infrastructure.persistence.JdbcRows.instant;
import static com.mylab.labservice.infrastructure.persistence.JdbcRows.ts;
import static com.mylab.labservice.infrastructure.persistence.JdbcRows.uuid;

import com.mylab.labservice.domain.common.ExecutionMode;
import com.mylab.labservice.domain.common.Lifecycle;
import com.mylab.labservice.domain.lineage.DerivedSample;
import com.mylab.labservice.domain.sample.SampleMetadata;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class DerivedSampleRepository {

    private static final String SELECT = """
            SELECT id, workspace_id, parent_sample_id, derived_code, name, derivation_method, execution_mode,
                   executed_by_org_id, external_reference, supersedes_id, superseded_by_id, metadata, lifecycle,
                   created_by, created_at
            FROM derived_samples
            """;

    private final NamedParameterJdbcTemplate jdbc;
    private final JsonColumns json;
    private final RowMapper<DerivedSample> mapper;

    public DerivedSampleRepository(NamedParameterJdbcTemplate jdbc, JsonColumns json) {
        this.jdbc = jdbc;
        this.json = json;
        this.mapper = (rs, rowNum) -> {
            SampleMetadata metadata = json.read(rs.getString("metadata"), SampleMetadata.class);
            return new DerivedSample(
                    uuid(rs, "id"),
                    uuid(rs, "workspace_id"),
                    uuid(rs, "parent_sample_id"),
                    rs.getString("derived_code"),
                    rs.getString("name"),
                    rs.getString("derivation_method"),
                    ExecutionMode.fromValue(rs.getString("execution_mode")),
                    uuid(rs, "executed_by_org_id"),
                    rs.getString("external_reference"),
                    uuid(rs, "supersedes_id"),
                    uuid(rs, "superseded_by_id"),
                    metadata == null ? SampleMetadata.empty() : metadata,
                    Lifecycle.valueOf(rs.getString("lifecycle")),
                    uuid(rs, "created_by"),
                    instant(rs, "created_at"));
        };
    }

    public void insert(DerivedSample derived) {
        jdbc.update("""
                INSERT INTO derived_samples (id, workspace_id, parent_sample_id, derived_code, name, derivation_method,
                                             execution_mode, executed_by_org_id, external_reference, supersedes_id,
                                             metadata, created_by, lifecycle, created_at)
                VALUES (:id, :workspaceId, :parentSampleId, :derivedCode, :name, :derivationMethod,
                        :executionMode, :executedByOrgId, :externalReference, :supersedesId,
                        :metadata, :createdBy, 'ACTIVE', :createdAt)
                """, new MapSqlParameterSource()
                .addValue("id", derived.id())
                .addValue("workspaceId", derived.workspaceId())
                .addValue("parentSampleId", derived.parentSampleId())
                .addValue("derivedCode", derived.derivedCode())
                .addValue("name", derived.name())
                .addValue("derivationMethod", derived.derivationMethod())
                .addValue("executionMode", derived.executionMode().value())
                .addValue("executedByOrgId", derived.executedByOrgId())
                .addValue("externalReference", derived.externalReference())
                .addValue("supersedesId", derived.supersedesId())
                .addValue("metadata", json.write(derived.metadata()))
                .addValue("createdBy", derived.createdBy())
                .addValue("createdAt", ts(derived.createdAt())));
    }

    public Optional<DerivedSample> findActive(UUID id, UUID workspaceId) {
        return jdbc.query(SELECT + " WHERE id = :id AND workspace_id = :workspaceId AND lifecycle = 'ACTIVE'",
                new MapSqlParameterSource().addValue("id", id).addValue("workspaceId", workspaceId), mapper)
                .stream().findFirst();
    }

    /**
     * Unscoped lookup; callers must authorize the result against the grant ledger.
     */
    public Optional<DerivedSample> findActiveInAnyWorkspace(UUID id) {
        return jdbc.query(SELECT + " WHERE id = :id AND lifecycle = 'ACTIVE'",
                new MapSqlParameterSource("id", id), mapper).stream().findFirst();
    }

    /**
     * Includes deleted records, which stay part of the lineage they were superseded in.
     */
    public Optional<DerivedSample> findInLineage(UUID id, UUID workspaceId) {
        return jdbc.query(SELECT + " WHERE id = :id AND workspace_id = :workspaceId",
                new MapSqlParameterSource().addValue("id", id).addValue("workspaceId", workspaceId), mapper)
                .stream().findFirst();
    }

    /**
     * Locks a supersession target. Deleted records qualify: a deleted head still ends its lineage,
     * and the chain must stay extendable.
     */
    public Optional<DerivedSample> findForUpdate(UUID id, UUID workspaceId) {
        return jdbc.query(SELECT + " WHERE id = :id AND workspace_id = :workspaceId FOR UPDATE",
                new MapSqlParameterSource().addValue("id", id).addValue("workspaceId", workspaceId), mapper)
                .stream().findFirst();
    }

    public List<DerivedSample> listByParent(UUID parentSampleId, UUID workspaceId) {
        return jdbc.query(SELECT + """
                 WHERE parent_sample_id = :parentId AND workspace_id = :workspaceId AND lifecycle = 'ACTIVE'
                ORDER BY created_at DESC, id
                """, new MapSqlParameterSource()
                .addValue("parentId", parentSampleId)
                .addValue("workspaceId", workspaceId), mapper);
    }

    public long countActiveByParent(UUID parentSampleId) {
        Long count = jdbc.queryForObject(
                "SELECT COUNT(*) FROM derived_samples WHERE parent_sample_id = :parentId AND lifecycle = 'ACTIVE'",
                new MapSqlParameterSource("parentId", parentSampleId), Long.class);
        return count == null ? 0 : count;
    }

    public boolean codeExists(UUID workspaceId, String derivedCode) {
        Long count = jdbc.queryForObject(
                "SELECT COUNT(*) FROM derived_samples WHERE workspace_id = :workspaceId AND derived_code = :code",
                new MapSqlParameterSource().addValue("workspaceId", workspaceId).addValue("code", derivedCode),
                Long.class);
        return count != null && count > 0;
    }

    /**
     * Points the predecessor at its successor, but only while it is still the head.
     *
     * @return 1 on success, 0 when another record already superseded it
     */
    public int markSuperseded(UUID predecessorId, UUID successorId) {
        return jdbc.update("""
                UPDATE derived_samples SET superseded_by_id = :successorId
                WHERE id = :predecessorId AND superseded_by_id IS NULL
                """, new MapSqlParameterSource()
                .addValue("predecessorId", predecessorId)
                .addValue("successorId", successorId));
    }

    public int softDelete(UUID id, UUID workspaceId, Instant now) {
        return jdbc.update("""
                UPDATE derived_samples SET lifecycle = 'DELETED', deleted_at = :now
                WHERE id = :id AND workspace_id = :workspaceId AND lifecycle = 'ACTIVE'
                """, new MapSqlParameterSource()
                .addValue("id", id)
                .addValue("workspaceId", workspaceId)
                .addValue("now", ts(now)));
    }
}
