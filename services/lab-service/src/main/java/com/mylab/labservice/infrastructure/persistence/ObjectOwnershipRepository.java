package com.mylab.labservice.infrastructure.persistence;

import com.mylab.labservice.domain.access.ObjectType;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * Resolves which workspace owns an arbitrary object coordinate.
 */
@Repository
public class ObjectOwnershipRepository {

    private static final Set<ObjectType> SOFT_DELETABLE = EnumSet.of(
            ObjectType.PROJECT, ObjectType.TRIAL, ObjectType.SAMPLE, ObjectType.DERIVED_SAMPLE,
            ObjectType.ORGANIZATION);

    private final NamedParameterJdbcTemplate jdbc;

    public ObjectOwnershipRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    /**
     * @return the owning workspace, or empty when the object does not exist or is deleted
     */
    public Optional<UUID> findWorkspaceId(ObjectType objectType, UUID objectId) {
        String sql = "SELECT workspace_id FROM " + objectType.table() + " WHERE id = :id";
        if (SOFT_DELETABLE.contains(objectType)) {
            sql += " AND lifecycle = 'ACTIVE'";
        }
        List<UUID> owners = jdbc.queryForList(sql, new MapSqlParameterSource("id", objectId), UUID.class);
        return owners.stream().findFirst();
    }
}
