package com.mylab.labservice.domain.organization;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.mylab.labservice.domain.common.WireEnum;

/**
 * Closed set of party kinds an organization can be.
 */
public enum OrganizationType implements WireEnum {

    CLIENT("client"),
    LABORATORY("laboratory"),
    ANALYZER("analyzer"),
    PHARMA("pharma"),
    INTERNAL("internal");

    private final String value;

    OrganizationType(String value) {
        this.value = value;
    }

    @JsonValue
    @Override
    public String value() {
        return value;
    }

    @JsonCreator
    public static OrganizationType fromValue(String value) {
        return WireEnum.parse(OrganizationType.class, value, "type");
    }
}
