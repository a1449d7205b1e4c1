package com.mylab.labservice.domain.trial;

import com.mylab.labservice.domain.common.InvalidDataException;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Ordered column schema shared by all trials of a project. Writing a template replaces the
 * previous one and bumps {@link #version()}; version 0 means no template was ever written.
 */
public record ParameterTemplate(
        UUID projectId,
        int version,
        List<ParameterColumn> columns,
        Instant updatedAt) {

    public ParameterTemplate {
        columns = columns == null ? List.of() : List.copyOf(columns);
    }

    public static ParameterTemplate empty(UUID projectId) {
        return new ParameterTemplate(projectId, 0, List.of(), null);
    }

    public boolean isDefined() {
        return version > 0;
    }

    /**
     * Checks a column list before it is stored.
     */
    public static void validateColumns(List<ParameterColumn> columns) {
        if (columns == null) {
            throw new InvalidDataException("columns are required");
        }
        Set<String> seen = new HashSet<>();
        for (ParameterColumn column : columns) {
            if (column == null || column.name() == null || column.name().isBlank()) {
                throw new InvalidDataException("Every template column needs a name");
            }
            if (column.type() == null) {
                throw new InvalidDataException("Template column '%s' needs a type".formatted(column.name()));
            }
            if (!seen.add(column.name())) {
                throw new InvalidDataException("Duplicate template column '%s'".formatted(column.name()));
            }
        }
    }

    /**
     * Checks a value map against this template: required keys present, values well-typed, no
     * unknown keys. An undefined template accepts anything.
     *
     * @param values  the values to check
     * @param subject what the values belong to, used in messages (e.g., "trial parameters")
     */
    public void validate(Map<String, String> values, String subject) {
        if (!isDefined()) {
            return;
        }
        Map<String, String> actual = values == null ? Map.of() : values;
        Set<String> known = new HashSet<>();
        for (ParameterColumn column : columns) {
            known.add(column.name());
            String value = actual.get(column.name());
            if (value == null || value.isBlank()) {
                if (column.required()) {
                    throw new InvalidDataException("%s: missing required value '%s'".formatted(subject, column.name()));
                }
                continue;
            }
            if (!column.type().accepts(value)) {
                throw new InvalidDataException("%s: '%s' must be a %s value".formatted(
                        subject, column.name(), column.type().value()));
            }
        }
        for (String key : actual.keySet()) {
            if (!known.contains(key)) {
                throw new InvalidDataException("%s: '%s' is not a column of template version %d".formatted(
                        subject, key, version));
            }
        }
    }
}
