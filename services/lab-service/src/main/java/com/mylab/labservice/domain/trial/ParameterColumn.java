package com.mylab.labservice.domain.trial;

/**
 * One column of a parameter template.
 *
 * @param name     key used in trial parameter values and sample metadata
 * @param type     value type
 * @param required whether every value map must contain the key
 * @param unit     optional display unit
 */
public record ParameterColumn(String name, ColumnType type, boolean required, String unit) {
}
