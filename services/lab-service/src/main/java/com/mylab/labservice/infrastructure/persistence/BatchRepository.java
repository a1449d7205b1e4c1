package com.mylab.labservice.infrastructure.persistence;

import static com.mylab.labservice.infrastructure.persistence.JdbcRows.instant;
import static com.mylab.labservice.infrastructure.persistence.JdbcRows.ts;
import static com.mylab.labservice.infrastructure.persistence.JdbcRows.uuid;

import com.mylab.labservice.domain.batch.Batch;
import com.mylab.labservice.domain.batch.BatchStatus;
import com.mylab.labservice.domain.common.ExecutionMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;

/**
 * Batches and their ordered sample membership.
 */
@Repository
public class BatchRepository {

    private static final String SELECT = """
            SELECT id, workspace_id, batch_code, description, status, execution_mode, executed_by_org_id,
                   external_reference, sent_at, completed_at, created_by, created_at, updated_at
            FROM batches
            """;

    private static final RowMapper<Batch> MAPPER = (rs, rowNum) -> new Batch(
            uuid(rs, "id"),
            uuid(rs, "workspace_id"),
            rs.getString("batch_code"),
            rs.getString("description"),
            BatchStatus.fromValue(rs.getString("status")),
            ExecutionMode.fromValue(rs.getString("execution_mode")),
            uuid(rs, "executed_by_org_id"),
            rs.getString("external_reference"),
            List.of(),
            instant(rs, "sent_at"),
            instant(rs, "completed_at"),
            uuid(rs, "created_by"),
            instant(rs, "created_at"),
            instant(rs, "updated_at"));

    private final NamedParameterJdbcTemplate jdbc;

    public BatchRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public void insert(Batch batch) {
        jdbc.update("""
                INSERT INTO batches (id, workspace_id, batch_code, description, status, execution_mode,
                                     executed_by_org_id, external_reference, created_by, created_at, updated_at)
                VALUES (:id, :workspaceId, :batchCode, :description, :status, :executionMode,
                        :executedByOrgId, :externalReference, :createdBy, :createdAt, :updatedAt)
                """, new MapSqlParameterSource()
                .addValue("id", batch.id())
                .addValue("workspaceId", batch.workspaceId())
                .addValue("batchCode", batch.batchCode())
                .addValue("description", batch.description())
                .addValue("status", batch.status().value())
                .addValue("executionMode", batch.executionMode().value())
                .addValue("executedByOrgId", batch.executedByOrgId())
                .addValue("externalReference", batch.externalReference())
                .addValue("createdBy", batch.createdBy())
                .addValue("createdAt", ts(batch.createdAt()))
                .addValue("updatedAt", ts(batch.updatedAt())));
        addItems(batch.id(), 0, batch.sampleIds());
    }

    /**
     * Appends samples to the batch, numbering them after {@code startOrder}.
     */
    public void addItems(UUID batchId, int startOrder, List<UUID> sampleIds) {
        if (sampleIds.isEmpty()) {
            return;
        }
        List<SqlParameterSource> rows = new ArrayList<>(sampleIds.size());
        int order = startOrder;
        for (UUID sampleId : sampleIds) {
            rows.add(new MapSqlParameterSource()
                    .addValue("batchId", batchId)
                    .addValue("sampleId", sampleId)
                    .addValue("itemOrder", ++order));
        }
        jdbc.batchUpdate("""
                INSERT INTO batch_items (batch_id, sample_id, item_order) VALUES (:batchId, :sampleId, :itemOrder)
                """, rows.toArray(SqlParameterSource[]::new));
    }

    public Optional<Batch> find(UUID id, UUID workspaceId) {
        return jdbc.query(SELECT + " WHERE id = :id AND workspace_id = :workspaceId",
                        new MapSqlParameterSource().addValue("id", id).addValue("workspaceId", workspaceId), MAPPER)
                .stream().findFirst()
                .map(batch -> batch.withSampleIds(sampleIds(batch.id())));
    }

    /**
     * Unscoped lookup; callers must authorize the result against the grant ledger.
     */
    public Optional<Batch> findInAnyWorkspace(UUID id) {
        return jdbc.query(SELECT + " WHERE id = :id",
                new MapSqlParameterSource("id", id), MAPPER).stream().findFirst()
                .map(batch -> batch.withSampleIds(sampleIds(batch.id())));
    }

    /**
     * Locks the batch row. Analysis authority changes take this lock before the sample lock.
     */
    public Optional<Batch> findForUpdate(UUID id, UUID workspaceId) {
        return jdbc.query(SELECT + " WHERE id = :id AND workspace_id = :workspaceId FOR UPDATE",
                new MapSqlParameterSource().addValue("id", id).addValue("workspaceId", workspaceId), MAPPER)
                .stream().findFirst();
    }

    public List<Batch> list(UUID workspaceId, BatchStatus status) {
        MapSqlParameterSource params = new MapSqlParameterSource("workspaceId", workspaceId);
        String where = " WHERE workspace_id = :workspaceId";
        if (status != null) {
            where += " AND status = :status";
            params.addValue("status", status.value());
        }
        return jdbc.query(SELECT + where + " ORDER BY created_at DESC, id", params, MAPPER).stream()
                .map(batch -> batch.withSampleIds(sampleIds(batch.id())))
                .toList();
    }

    public List<UUID> sampleIds(UUID batchId) {
        return jdbc.queryForList("SELECT sample_id FROM batch_items WHERE batch_id = :batchId ORDER BY item_order",
                new MapSqlParameterSource("batchId", batchId), UUID.class);
    }

    public boolean containsSample(UUID batchId, UUID sampleId) {
        Long count = jdbc.queryForObject(
                "SELECT COUNT(*) FROM batch_items WHERE batch_id = :batchId AND sample_id = :sampleId",
                new MapSqlParameterSource().addValue("batchId", batchId).addValue("sampleId", sampleId), Long.class);
        return count != null && count > 0;
    }

    /**
     * Compare-and-swap on the status column.
     *
     * @return 1 when the batch was still in {@code from}, otherwise 0
     */
    public int transition(UUID id, UUID workspaceId, BatchStatus from, BatchStatus to, Instant now) {
        StringBuilder sql = new StringBuilder("UPDATE batches SET status = :to, updated_at = :now");
        if (to == BatchStatus.SENT) {
            sql.append(", sent_at = :now");
        }
        if (to == BatchStatus.COMPLETED) {
            sql.append(", completed_at = :now");
        }
        sql.append(" WHERE id = :id AND workspace_id = :workspaceId AND status = :from");
        return jdbc.update(sql.toString(), new MapSqlParameterSource()
                .addValue("id", id)
                .addValue("workspaceId", workspaceId)
                .addValue("from", from.value())
                .addValue("to", to.value())
                .addValue("now", ts(now)));
    }
}
