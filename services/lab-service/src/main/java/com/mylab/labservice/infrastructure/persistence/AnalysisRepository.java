package com.mylab.labservice.infrastructure.persistence;

import static com.mylab.labservice.infrastructure.persistence.JdbcRows.instant;
import static com.mylab.labservice.infrastructure.persistence.JdbcRows.ts;
import static com.mylab.labservice.infrastructure.persistence.JdbcRows.uuid;

import com.mylab.labservice.domain.analysis.Analysis;
import com.mylab.labservice.domain.analysis.AnalysisResults;
import com.mylab.labservice.domain.analysis.AnalysisStatus;
import com.mylab.labservice.domain.common.ExecutionMode;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class AnalysisRepository {

    private static final String SELECT = """
            SELECT id, workspace_id, batch_id, sample_id, analysis_type, status, results, file_path, checksum,
                   execution_mode, external_reference, performed_at, is_authoritative, supersedes_id,
                   revision_number, uploaded_by, edited_by, created_at, updated_at
            FROM analyses
            """;

    private final NamedParameterJdbcTemplate jdbc;
    private final JsonColumns json;
    private final RowMapper<Analysis> mapper;

    public AnalysisRepository(NamedParameterJdbcTemplate jdbc, JsonColumns json) {
        this.jdbc = jdbc;
        this.json = json;
        this.mapper = (rs, rowNum) -> new Analysis(
                uuid(rs, "id"),
                uuid(rs, "workspace_id"),
                uuid(rs, "batch_id"),
                uuid(rs, "sample_id"),
                rs.getString("analysis_type"),
                AnalysisStatus.fromValue(rs.getString("status")),
                json.read(rs.getString("results"), AnalysisResults.class),
                rs.getString("file_path"),
                rs.getString("checksum"),
                ExecutionMode.fromValue(rs.getString("execution_mode")),
                rs.getString("external_reference"),
                instant(rs, "performed_at"),
                rs.getBoolean("is_authoritative"),
                uuid(rs, "supersedes_id"),
                rs.getInt("revision_number"),
                uuid(rs, "uploaded_by"),
                uuid(rs, "edited_by"),
                instant(rs, "created_at"),
                instant(rs, "updated_at"));
    }

    public void insert(Analysis analysis) {
        jdbc.update("""
                INSERT INTO analyses (id, workspace_id, batch_id, sample_id, analysis_type, status, results, file_path,
                                      checksum, execution_mode, external_reference, performed_at, is_authoritative,
                                      supersedes_id, revision_number, uploaded_by, edited_by, created_at, updated_at)
                VALUES (:id, :workspaceId, :batchId, :sampleId, :analysisType, :status, :results, :filePath,
                        :checksum, :executionMode, :externalReference, :performedAt, :authoritative,
                        :supersedesId, :revisionNumber, :uploadedBy, :editedBy, :createdAt, :updatedAt)
                """, new MapSqlParameterSource()
                .addValue("id", analysis.id())
                .addValue("workspaceId", analysis.workspaceId())
                .addValue("batchId", analysis.batchId())
                .addValue("sampleId", analysis.sampleId())
                .addValue("analysisType", analysis.analysisType())
                .addValue("status", analysis.status().value())
                .addValue("results", json.write(analysis.results()))
                .addValue("filePath", analysis.filePath())
                .addValue("checksum", analysis.checksum())
                .addValue("executionMode", analysis.executionMode().value())
                .addValue("externalReference", analysis.externalReference())
                .addValue("performedAt", ts(analysis.performedAt()))
                .addValue("authoritative", analysis.authoritative())
                .addValue("supersedesId", analysis.supersedesId())
                .addValue("revisionNumber", analysis.revisionNumber())
                .addValue("uploadedBy", analysis.uploadedBy())
                .addValue("editedBy", analysis.editedBy())
                .addValue("createdAt", ts(analysis.createdAt()))
                .addValue("updatedAt", ts(analysis.updatedAt())));
    }

    public Optional<Analysis> find(UUID id, UUID workspaceId) {
        return jdbc.query(SELECT + " WHERE id = :id AND workspace_id = :workspaceId",
                new MapSqlParameterSource().addValue("id", id).addValue("workspaceId", workspaceId), mapper)
                .stream().findFirst();
    }

    /**
     * Unscoped lookup; callers must authorize the result against the grant ledger.
     */
    public Optional<Analysis> findInAnyWorkspace(UUID id) {
        return jdbc.query(SELECT + " WHERE id = :id",
                new MapSqlParameterSource("id", id), mapper).stream().findFirst();
    }

    public List<Analysis> listByBatch(UUID batchId, UUID workspaceId) {
        return jdbc.query(SELECT + " WHERE batch_id = :batchId AND workspace_id = :workspaceId ORDER BY created_at, id",
                new MapSqlParameterSource().addValue("batchId", batchId).addValue("workspaceId", workspaceId), mapper);
    }

    public Optional<Analysis> findAuthoritative(UUID sampleId, String analysisType, UUID workspaceId) {
        return jdbc.query(SELECT + """
                 WHERE sample_id = :sampleId AND analysis_type = :analysisType AND workspace_id = :workspaceId
                  AND is_authoritative = TRUE
                """, new MapSqlParameterSource()
                .addValue("sampleId", sampleId)
                .addValue("analysisType", analysisType)
                .addValue("workspaceId", workspaceId), mapper).stream().findFirst();
    }

    public long countAuthoritative(UUID sampleId, String analysisType) {
        Long count = jdbc.queryForObject("""
                SELECT COUNT(*) FROM analyses
                WHERE sample_id = :sampleId AND analysis_type = :analysisType AND is_authoritative = TRUE
                """, new MapSqlParameterSource()
                .addValue("sampleId", sampleId)
                .addValue("analysisType", analysisType), Long.class);
        return count == null ? 0 : count;
    }

    /**
     * Clears the authoritative flag only if it is still set.
     *
     * @return 1 when this caller won the swap, 0 when the analysis was no longer authoritative
     */
    public int revokeAuthority(UUID id, Instant now) {
        return jdbc.update("""
                UPDATE analyses SET is_authoritative = FALSE, updated_at = :now
                WHERE id = :id AND is_authoritative = TRUE
                """, new MapSqlParameterSource().addValue("id", id).addValue("now", ts(now)));
    }

    /**
     * Analyses of the batch that are still pending or in progress.
     */
    public long countOpenByBatch(UUID batchId) {
        Long count = jdbc.queryForObject("""
                SELECT COUNT(*) FROM analyses
                WHERE batch_id = :batchId AND status IN ('pending', 'in_progress')
                """, new MapSqlParameterSource("batchId", batchId), Long.class);
        return count == null ? 0 : count;
    }

    /**
     * Moves the status forward with a compare-and-swap on the current one, optionally replacing the
     * results. Every successful call bumps the revision number.
     */
    public int updateStatus(UUID id, AnalysisStatus from, AnalysisStatus to, AnalysisResults results,
                            UUID editedBy, Instant now) {
        DynamicUpdate sql = new DynamicUpdate()
                .set("status", to.value())
                .set("results", json.write(results))
                .set("edited_by", editedBy)
                .param("id", id)
                .param("from", from.value())
                .param("now", ts(now));
        return jdbc.update(sql.sql("analyses", "revision_number = revision_number + 1, updated_at = :now",
                "id = :id AND status = :from"), sql.params());
    }
}
