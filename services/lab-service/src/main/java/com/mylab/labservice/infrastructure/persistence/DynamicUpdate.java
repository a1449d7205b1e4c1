package com.mylab.labservice.infrastructure.persistence;

import java.util.ArrayList;
import java.util.List;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;

/**
 * Builds an UPDATE from only the columns that were actually supplied. A null value means
 * "leave unchanged", never "set to null".
 */
final class DynamicUpdate {

    private final List<String> assignments = new ArrayList<>();
    private final MapSqlParameterSource params = new MapSqlParameterSource();

    DynamicUpdate set(String column, Object value) {
        if (value != null) {
            assignments.add(column + " = :" + column);
            params.addValue(column, value);
        }
        return this;
    }

    DynamicUpdate param(String name, Object value) {
        params.addValue(name, value);
        return this;
    }

    boolean isEmpty() {
        return assignments.isEmpty();
    }

    /**
     * @param table     target table
     * @param always    assignments applied whenever anything changes (e.g., {@code updated_at = :now})
     * @param where     WHERE clause without the keyword
     */
    String sql(String table, String always, String where) {
        List<String> all = new ArrayList<>(assignments);
        if (always != null) {
            all.add(always);
        }
        return "UPDATE " + table + " SET " + String.join(", ", all) + " WHERE " + where;
    }

    MapSqlParameterSource params() {
        return params;
    }
}
