package com.mylab.labservice.domain.trial;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.mylab.labservice.domain.common.WireEnum;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * Value type of a parameter template column.
 */
public enum ColumnType implements WireEnum {

    TEXT("text"),
    NUMBER("number"),
    BOOLEAN("boolean"),
    DATE("date");

    private final String value;

    ColumnType(String value) {
        this.value = value;
    }

    @JsonValue
    @Override
    public String value() {
        return value;
    }

    @JsonCreator
    public static ColumnType fromValue(String value) {
        return WireEnum.parse(ColumnType.class, value, "columnType");
    }

    /**
     * Whether {@code raw} is a well-formed value of this type.
     */
    public boolean accepts(String raw) {
        if (raw == null) {
            return false;
        }
        try {
            switch (this) {
                case NUMBER -> new BigDecimal(raw.strip());
                case BOOLEAN -> {
                    if (!raw.equalsIgnoreCase("true") && !raw.equalsIgnoreCase("false")) {
                        return false;
                    }
                }
                case DATE -> LocalDate.parse(raw.strip());
                case TEXT -> {
                    // any string
                }
            }
            return true;
        } catch (NumberFormatException | DateTimeParseException e) {
            return false;
        }
    }
}
