package com.mylab.labservice.infrastructure.persistence;

import static com.mylab.labservice.infrastructure.persistence.JdbcRows.instant;
import static com.mylab.labservice.infrastructure.persistence.JdbcRows.ts;
import static com.mylab.labservice.infrastructure.persistence.JdbcRows.uuid;

import com.mylab.labservice.domain.access.AccessGrant;
import com.mylab.labservice.domain.access.ObjectType;
import com.mylab.security.AccessLevel;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * Grant ledger. Rows are keyed by object coordinate and carry no workspace.
 */
@Repository
public class AccessGrantRepository {

    private static final String SELECT = """
            SELECT id, user_id, object_type, object_id, access_level, granted_by, created_at, updated_at
            FROM access_grants
            """;

    private static final String BY_COORDINATE =
            " WHERE user_id = :userId AND object_type = :objectType AND object_id = :objectId";

    private static final RowMapper<AccessGrant> MAPPER = (rs, rowNum) -> new AccessGrant(
            uuid(rs, "id"),
            uuid(rs, "user_id"),
            ObjectType.fromValue(rs.getString("object_type")),
            uuid(rs, "object_id"),
            AccessLevel.fromValue(rs.getString("access_level")),
            uuid(rs, "granted_by"),
            instant(rs, "created_at"),
            instant(rs, "updated_at"));

    private final NamedParameterJdbcTemplate jdbc;

    public AccessGrantRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    /**
     * Plain insert. A second grant for the same coordinate violates the unique key and surfaces as
     * {@link org.springframework.dao.DuplicateKeyException}.
     */
    public void insert(AccessGrant grant) {
        jdbc.update("""
                INSERT INTO access_grants (id, user_id, object_type, object_id, access_level, granted_by,
                                           created_at, updated_at)
                VALUES (:id, :userId, :objectType, :objectId, :accessLevel, :grantedBy, :createdAt, :updatedAt)
                """, new MapSqlParameterSource()
                .addValue("id", grant.id())
                .addValue("userId", grant.userId())
                .addValue("objectType", grant.objectType().value())
                .addValue("objectId", grant.objectId())
                .addValue("accessLevel", grant.accessLevel().value())
                .addValue("grantedBy", grant.grantedBy())
                .addValue("createdAt", ts(grant.createdAt()))
                .addValue("updatedAt", ts(grant.updatedAt())));
    }

    public Optional<AccessGrant> find(UUID userId, ObjectType objectType, UUID objectId) {
        return jdbc.query(SELECT + BY_COORDINATE, coordinate(userId, objectType, objectId), MAPPER)
                .stream().findFirst();
    }

    public Optional<AccessLevel> findLevel(UUID userId, ObjectType objectType, UUID objectId) {
        return find(userId, objectType, objectId).map(AccessGrant::accessLevel);
    }

    public List<AccessGrant> listByObject(ObjectType objectType, UUID objectId) {
        return jdbc.query(SELECT + """
                 WHERE object_type = :objectType AND object_id = :objectId
                ORDER BY created_at DESC, id
                """, new MapSqlParameterSource()
                .addValue("objectType", objectType.value())
                .addValue("objectId", objectId), MAPPER);
    }

    public int updateLevel(UUID userId, ObjectType objectType, UUID objectId, AccessLevel level, Instant now) {
        return jdbc.update("UPDATE access_grants SET access_level = :accessLevel, updated_at = :now" + BY_COORDINATE,
                coordinate(userId, objectType, objectId)
                        .addValue("accessLevel", level.value())
                        .addValue("now", ts(now)));
    }

    public int delete(UUID userId, ObjectType objectType, UUID objectId) {
        return jdbc.update("DELETE FROM access_grants" + BY_COORDINATE, coordinate(userId, objectType, objectId));
    }

    private static MapSqlParameterSource coordinate(UUID userId, ObjectType objectType, UUID objectId) {
        return new MapSqlParameterSource()
                .addValue("userId", userId)
                .addValue("objectType", objectType.value())
                .addValue("objectId", objectId);
    }
}
