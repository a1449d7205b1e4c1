package com.mylab.labservice.infrastructure.persistence;

import static com.mylab.labservice.infrastructure.persistence.JdbcRows.date;
import static com.mylab.labservice.infrastructure.persistence.JdbcRows.instant;
import static com.mylab.labservice.infrastructure.persistence.JdbcRows.localDate;
import static com.mylab.labservice.infrastructure.persistence.JdbcRows.ts;
import static com.mylab.labservice.infrastructure.persistence.JdbcRows.uuid;

import com.mylab.labservice.domain.handoff.Direction;
import com.mylab.labservice.domain.handoff.HandoffStatus;
import com.mylab.labservice.domain.handoff.MaterialDescriptor;
import com.mylab.labservice.domain.handoff.Priority;
import com.mylab.labservice.domain.handoff.SupplyChainFilter;
import com.mylab.labservice.domain.handoff.SupplyChainRequest;
import com.mylab.labservice.domain.handoff.SupplyChainRequestUpdate;
import com.mylab.labservice.domain.handoff.WorkflowType;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class SupplyChainRequestRepository {

    private static final String SELECT = """
            SELECT id, workspace_id, to_workspace_id, from_org_id, to_org_id, from_project_id, workflow_type,
                   material_data, requirements, status, priority, due_date, assigned_to, notes, rejection_reason,
                   result_summary, linked_project_id, linked_sample_id, created_by, created_at, updated_at,
                   resolved_at
            FROM supply_chain_requests
            """;

    private static final Comparator<SupplyChainRequest> LIST_ORDER = Comparator
            .comparingInt((SupplyChainRequest r) -> r.priority().sortRank())
            .thenComparing(SupplyChainRequest::createdAt, Comparator.reverseOrder())
            .thenComparing(SupplyChainRequest::id);

    private final NamedParameterJdbcTemplate jdbc;
    private final JsonColumns json;
    private final RowMapper<SupplyChainRequest> mapper;

    public SupplyChainRequestRepository(NamedParameterJdbcTemplate jdbc, JsonColumns json) {
        this.jdbc = jdbc;
        this.json = json;
        this.mapper = (rs, rowNum) -> new SupplyChainRequest(
                uuid(rs, "id"),
                uuid(rs, "workspace_id"),
                uuid(rs, "to_workspace_id"),
                uuid(rs, "from_org_id"),
                uuid(rs, "to_org_id"),
                uuid(rs, "from_project_id"),
                WorkflowType.fromValue(rs.getString("workflow_type")),
                json.read(rs.getString("material_data"), MaterialDescriptor.class),
                rs.getString("requirements"),
                HandoffStatus.fromValue(rs.getString("status")),
                Priority.fromValue(rs.getString("priority")),
                localDate(rs, "due_date"),
                uuid(rs, "assigned_to"),
                rs.getString("notes"),
                rs.getString("rejection_reason"),
                rs.getString("result_summary"),
                uuid(rs, "linked_project_id"),
                uuid(rs, "linked_sample_id"),
                uuid(rs, "created_by"),
                instant(rs, "created_at"),
                instant(rs, "updated_at"),
                instant(rs, "resolved_at"));
    }

    public void insert(SupplyChainRequest request) {
        jdbc.update("""
                INSERT INTO supply_chain_requests (id, workspace_id, to_workspace_id, from_org_id, to_org_id,
                                                   from_project_id, workflow_type, material_data, requirements, status,
                                                   priority, due_date, notes, created_by, created_at, updated_at)
                VALUES (:id, :workspaceId, :toWorkspaceId, :fromOrgId, :toOrgId,
                        :fromProjectId, :workflowType, :material, :requirements, :status,
                        :priority, :dueDate, :notes, :createdBy, :createdAt, :updatedAt)
                """, new MapSqlParameterSource()
                .addValue("id", request.id())
                .addValue("workspaceId", request.workspaceId())
                .addValue("toWorkspaceId", request.toWorkspaceId())
                .addValue("fromOrgId", request.fromOrgId())
                .addValue("toOrgId", request.toOrgId())
                .addValue("fromProjectId", request.fromProjectId())
                .addValue("workflowType", request.workflowType().value())
                .addValue("material", json.write(request.material()))
                .addValue("requirements", request.requirements())
                .addValue("status", request.status().value())
                .addValue("priority", request.priority().value())
                .addValue("dueDate", date(request.dueDate()))
                .addValue("notes", request.notes())
                .addValue("createdBy", request.createdBy())
                .addValue("createdAt", ts(request.createdAt()))
                .addValue("updatedAt", ts(request.updatedAt())));
    }

    /**
     * Finds a request visible to the workspace, as initiator or as receiver.
     */
    public Optional<SupplyChainRequest> findVisible(UUID id, UUID workspaceId) {
        return jdbc.query(SELECT + " WHERE id = :id AND (workspace_id = :workspaceId OR to_workspace_id = :workspaceId)",
                new MapSqlParameterSource().addValue("id", id).addValue("workspaceId", workspaceId), mapper)
                .stream().findFirst();
    }

    public Optional<SupplyChainRequest> findForUpdate(UUID id) {
        return jdbc.query(SELECT + " WHERE id = :id FOR UPDATE", new MapSqlParameterSource("id", id), mapper)
                .stream().findFirst();
    }

    public List<SupplyChainRequest> list(UUID workspaceId, SupplyChainFilter filter) {
        MapSqlParameterSource params = new MapSqlParameterSource("workspaceId", workspaceId);
        StringBuilder where = new StringBuilder(" WHERE ");
        if (filter.direction() == Direction.OUTGOING) {
            where.append("workspace_id = :workspaceId");
        } else if (filter.direction() == Direction.INCOMING) {
            where.append("to_workspace_id = :workspaceId");
        } else {
            where.append("(workspace_id = :workspaceId OR to_workspace_id = :workspaceId)");
        }
        if (filter.status() != null) {
            where.append(" AND status = :status");
            params.addValue("status", filter.status().value());
        }
        if (filter.workflowType() != null) {
            where.append(" AND workflow_type = :workflowType");
            params.addValue("workflowType", filter.workflowType().value());
        }
        return jdbc.query(SELECT + where, params, mapper).stream().sorted(LIST_ORDER).toList();
    }

    public int update(UUID id, SupplyChainRequestUpdate update, Instant now) {
        DynamicUpdate sql = new DynamicUpdate()
                .set("priority", update.priority() == null ? null : update.priority().value())
                .set("due_date", date(update.dueDate()))
                .set("notes", update.notes());
        if (sql.isEmpty()) {
            return 0;
        }
        sql.param("id", id).param("now", ts(now));
        return jdbc.update(sql.sql("supply_chain_requests", "updated_at = :now", "id = :id"), sql.params());
    }

    /**
     * Compare-and-swap on status, writing the side columns of the transition in the same statement.
     *
     * @param columns extra column values keyed by column name; names come from code, never from input
     * @return 1 when the request was still in {@code from}, otherwise 0
     */
    public int transition(UUID id, HandoffStatus from, HandoffStatus to, Map<String, Object> columns, Instant now) {
        DynamicUpdate sql = new DynamicUpdate().set("status", to.value());
        columns.forEach(sql::set);
        if (to.isTerminal()) {
            sql.set("resolved_at", ts(now));
        }
        sql.param("id", id).param("from", from.value()).param("now", ts(now));
        return jdbc.update(sql.sql("supply_chain_requests", "updated_at = :now", "id = :id AND status = :from"),
                sql.params());
    }
}
