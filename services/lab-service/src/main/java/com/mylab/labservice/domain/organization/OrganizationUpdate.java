package com.mylab.labservice.domain.organization;

/**
 * Partial update; null fields are left unchanged.
 */
public record OrganizationUpdate(String name, OrganizationType type, ContactInfo contactInfo) {

    public boolean isEmpty() {
        return name == null && type == null && contactInfo == null;
    }
}
