package com.mylab.labservice.domain.organization;

/**
 * Versioned contact details of an organization.
 */
public record ContactInfo(int schemaVersion, String email, String phone, String address) {

    public static final int CURRENT_SCHEMA_VERSION = 1;

    public ContactInfo {
        if (schemaVersion <= 0) {
            schemaVersion = CURRENT_SCHEMA_VERSION;
        }
    }

    public static ContactInfo of(String email, String phone, String address) {
        return new ContactInfo(CURRENT_SCHEMA_VERSION, email, phone, address);
    }
}
