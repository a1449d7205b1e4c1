package com.mylab.labservice.domain.analysis;

import java.util.Map;

/**
 * Versioned analytical result payload.
 *
 * @param schemaVersion layout version of this structure
 * @param values        measured values keyed by measurement name
 * @param summary       optional free-text interpretation
 */
public record AnalysisResults(int schemaVersion, Map<String, String> values, String summary) {

    public static final int CURRENT_SCHEMA_VERSION = 1;

    public AnalysisResults {
        if (schemaVersion <= 0) {
            schemaVersion = CURRENT_SCHEMA_VERSION;
        }
        values = values == null ? Map.of() : Map.copyOf(values);
    }
}
