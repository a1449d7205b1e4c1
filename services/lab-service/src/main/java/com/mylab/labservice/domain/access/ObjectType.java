package com.mylab.labservice.domain.access;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.mylab.labservice.domain.common.WireEnum;

/**
 * Kinds of object an access grant can point at. Each maps to the table holding its owning
 * workspace.
 */
public enum ObjectType implements WireEnum {

    PROJECT("project"),
    TRIAL("trial"),
    SAMPLE("sample"),
    DERIVED_SAMPLE("derived_sample"),
    BATCH("batch"),
    ANALYSIS("analysis"),
    ORGANIZATION("organization"),
    SUPPLY_CHAIN_REQUEST("supply_chain_request");

    private final String value;

    ObjectType(String value) {
        this.value = value;
    }

    @JsonValue
    @Override
    public String value() {
        return value;
    }

    @JsonCreator
    public static ObjectType fromValue(String value) {
        return WireEnum.parse(ObjectType.class, value, "objectType");
    }

    public String table() {
        return switch (this) {
            case PROJECT -> "projects";
            case TRIAL -> "trials";
            case SAMPLE -> "samples";
            case DERIVED_SAMPLE -> "derived_samples";
            case BATCH -> "batches";
            case ANALYSIS -> "analyses";
            case ORGANIZATION -> "organizations";
            case SUPPLY_CHAIN_REQUEST -> "supply_chain_requests";
        };
    }
}
