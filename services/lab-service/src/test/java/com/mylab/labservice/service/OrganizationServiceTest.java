package com.mylab.labservice.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.mylab.labservice.domain.common.ForbiddenException;
import com.mylab.labservice.domain.common.InvalidDataException;
import com.mylab.labservice.domain.common.NotFoundException;
import com.mylab.labservice.domain.organization.ContactInfo;
import com.mylab.labservice.domain.organization.NewOrganization;
import com.mylab.labservice.domain.organization.Organization;
import com.mylab.labservice.domain.organization.OrganizationType;
import com.mylab.labservice.domain.organization.OrganizationUpdate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("OrganizationService")
class OrganizationServiceTest extends LabIntegrationTest {

    @Test
    @DisplayName("creates, updates and soft-deletes an organization")
    void lifecycle() {
        Tenant tenant = newTenant();
        Organization client = organizationService.create(tenant.admin(), new NewOrganization("Acme", OrganizationType.CLIENT,
                new ContactInfo(1, "ops@acme.test", null, null)));

        Organization renamed = organizationService.update(tenant.admin(), client.id(),
                new OrganizationUpdate("Acme Labs", null, null));

        assertThat(renamed.name()).isEqualTo("Acme Labs");
        assertThat(renamed.type()).isEqualTo(OrganizationType.CLIENT);
        assertThat(renamed.contactInfo().email()).isEqualTo("ops@acme.test");
        assertThat(organizationService.list(tenant.scientist()))
                .extracting(Organization::id)
                .contains(client.id(), tenant.lab().id());

        organizationService.delete(tenant.admin(), client.id());

        assertThatThrownBy(() -> organizationService.get(tenant.admin(), client.id()))
                .isInstanceOf(NotFoundException.class);
        assertThat(organizationService.list(tenant.admin())).extracting(Organization::id).doesNotContain(client.id());
    }

    @Test
    @DisplayName("only admins manage organizations")
    void requiresAdmin() {
        Tenant tenant = newTenant();

        assertThatThrownBy(() -> organizationService.create(tenant.scientist(),
                new NewOrganization("Mine", OrganizationType.INTERNAL, null)))
                .isInstanceOf(ForbiddenException.class);
        assertThatThrownBy(() -> organizationService.delete(tenant.scientist(), tenant.lab().id()))
                .isInstanceOf(ForbiddenException.class);
    }

    @Test
    @DisplayName("validates name length and type")
    void validates() {
        Tenant tenant = newTenant();

        assertThatThrownBy(() -> organizationService.create(tenant.admin(),
                new NewOrganization("x".repeat(101), OrganizationType.CLIENT, null)))
                .isInstanceOf(InvalidDataException.class);
        assertThatThrownBy(() -> organizationService.create(tenant.admin(), new NewOrganization("No type", null, null)))
                .isInstanceOf(InvalidDataException.class);
    }

    @Test
    @DisplayName("organizations of another workspace are invisible")
    void isolation() {
        Tenant mine = newTenant();
        Tenant theirs = newTenant();

        assertThatThrownBy(() -> organizationService.get(mine.admin(), theirs.lab().id()))
                .isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> organizationService.update(mine.admin(), theirs.lab().id(),
                new OrganizationUpdate("Hijacked", null, null)))
                .isInstanceOf(NotFoundException.class);
    }
}
