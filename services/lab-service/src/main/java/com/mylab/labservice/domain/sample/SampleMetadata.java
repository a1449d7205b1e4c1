package com.mylab.labservice.domain.sample;

import java.util.Map;

/**
 * Versioned sample metadata.
 *
 * @param schemaVersion   layout version of this structure
 * @param templateVersion project parameter template version the values were checked against,
 *                        0 when the project had no template
 * @param values          metadata values keyed by template column name
 */
public record SampleMetadata(int schemaVersion, int templateVersion, Map<String, String> values) {

    public static final int CURRENT_SCHEMA_VERSION = 1;

    public SampleMetadata {
        if (schemaVersion <= 0) {
            schemaVersion = CURRENT_SCHEMA_VERSION;
        }
        values = values == null ? Map.of() : Map.copyOf(values);
    }

    public static SampleMetadata of(int templateVersion, Map<String, String> values) {
        return new SampleMetadata(CURRENT_SCHEMA_VERSION, templateVersion, values);
    }

    public static SampleMetadata empty() {
        return of(0, Map.of());
    }
}
