package com.mylab.labservice.domain.trial;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("ColumnType")
class ColumnTypeTest {

    @ParameterizedTest(name = "{0} accepts ''{1}'': {2}")
    @CsvSource({
            "NUMBER, 42, true",
            "NUMBER, -0.5e3, true",
            "NUMBER, forty, false",
            "BOOLEAN, false, true",
            "BOOLEAN, yes, false",
            "DATE, 2025-02-28, true",
            "DATE, 2025-02-30, false",
            "TEXT, anything at all, true"
    })
    void acceptsWellFormedValues(ColumnType type, String raw, boolean expected) {
        assertThat(type.accepts(raw)).isEqualTo(expected);
    }
}
