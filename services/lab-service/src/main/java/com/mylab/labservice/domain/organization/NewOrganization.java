package com.mylab.labservice.domain.organization;

public record NewOrganization(String name, OrganizationType type, ContactInfo contactInfo) {
}
