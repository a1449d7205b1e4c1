package com.mylab.labservice.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.mylab.labservice.domain.access.ObjectType;
import com.mylab.labservice.domain.common.ForbiddenException;
import com.mylab.labservice.domain.common.InvalidDataException;
import com.mylab.labservice.domain.common.NotFoundException;
import com.mylab.labservice.domain.lineage.NewDerivedSample;
import com.mylab.labservice.domain.project.NewProject;
import com.mylab.labservice.domain.project.Project;
import com.mylab.labservice.domain.sample.NewSample;
import com.mylab.labservice.domain.sample.Sample;
import com.mylab.labservice.domain.sample.SampleHasDerivedException;
import com.mylab.labservice.domain.sample.SampleUpdate;
import com.mylab.labservice.domain.trial.ColumnType;
import com.mylab.labservice.domain.trial.NewTrial;
import com.mylab.labservice.domain.trial.ParameterColumn;
import com.mylab.labservice.domain.trial.Trial;
import com.mylab.security.AccessLevel;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("SampleService")
class SampleServiceTest extends LabIntegrationTest {

    @Test
    @DisplayName("creates a sample tagged with the template version its metadata was checked against")
    void recordsTemplateVersion() {
        Tenant tenant = newTenant();
        UUID projectId = tenant.project().id();
        trialService.putTemplate(tenant.scientist(), projectId,
                List.of(new ParameterColumn("ph", ColumnType.NUMBER, true, null)));

        Sample sample = sampleService.create(tenant.scientist(), new NewSample(projectId, null, "S-1", null,
                "powder", new BigDecimal("2.5"), "g", Map.of("ph", "6.8")));

        assertThat(sample.metadata().templateVersion()).isEqualTo(1);
        assertThat(sample.metadata().values()).containsEntry("ph", "6.8");
        assertThat(sampleService.get(tenant.viewer(), sample.id()).quantity()).isEqualByComparingTo("2.5");
        assertThatThrownBy(() -> sampleService.create(tenant.scientist(),
                new NewSample(projectId, null, "S-2", null, null, null, null, Map.of("ph", "acidic"))))
                .isInstanceOf(InvalidDataException.class);
    }

    @Test
    @DisplayName("an unknown or foreign project is invalid input")
    void projectMustBeLocal() {
        Tenant mine = newTenant();
        Tenant theirs = newTenant();

        assertThatThrownBy(() -> sampleService.create(mine.scientist(),
                new NewSample(UUID.randomUUID(), null, "S", null, null, null, null, null)))
                .isInstanceOf(InvalidDataException.class);
        assertThatThrownBy(() -> sampleService.create(mine.scientist(),
                new NewSample(theirs.project().id(), null, "S", null, null, null, null, null)))
                .isInstanceOf(InvalidDataException.class);
    }

    @Test
    @DisplayName("the trial must belong to the sample's project")
    void trialMustMatchProject() {
        Tenant tenant = newTenant();
        Project other = projectService.create(tenant.scientist(),
                new NewProject("Other", null, null, "Acme", tenant.lab().id(), null, null));
        Trial foreignTrial = trialService.create(tenant.scientist(), other.id(),
                new NewTrial("T", null, null, null, null, null));

        assertThatThrownBy(() -> sampleService.create(tenant.scientist(),
                new NewSample(tenant.project().id(), foreignTrial.id(), "S", null, null, null, null, null)))
                .isInstanceOf(InvalidDataException.class)
                .hasMessageContaining("another project");
    }

    @Test
    @DisplayName("lists by project and updates fields")
    void listAndUpdate() {
        Tenant tenant = newTenant();
        Sample sample = newSample(tenant, "S-1");
        newSample(tenant, "S-2");

        Sample updated = sampleService.update(tenant.scientist(), sample.id(),
                new SampleUpdate(null, "re-labelled", null, null, null, "consumed"));

        assertThat(updated.description()).isEqualTo("re-labelled");
        assertThat(updated.status()).isEqualTo("consumed");
        assertThat(sampleService.list(tenant.viewer(), tenant.project().id())).hasSize(2);
        assertThat(sampleService.list(tenant.viewer(), null)).hasSize(2);
    }

    @Nested
    @DisplayName("shared through a grant")
    class SharedThroughGrant {

        @Test
        @DisplayName("a view grant makes a sample readable from another workspace")
        void viewGrantReads() {
            Tenant owner = newTenant();
            Tenant partner = newTenant();
            Sample sample = newSample(owner, "Shared");
            accessGrantService.grant(owner.admin(), partner.scientist().userId(), ObjectType.SAMPLE, sample.id(),
                    AccessLevel.VIEW);

            assertThat(sampleService.get(partner.scientist(), sample.id()).name()).isEqualTo("Shared");
            assertThatThrownBy(() -> sampleService.update(partner.scientist(), sample.id(),
                    new SampleUpdate(null, "mine now", null, null, null, null)))
                    .isInstanceOf(ForbiddenException.class);
            assertThatThrownBy(() -> sampleService.get(partner.viewer(), sample.id()))
                    .isInstanceOf(NotFoundException.class);
        }

        @Test
        @DisplayName("an edit grant updates the sample in its own workspace")
        void editGrantUpdates() {
            Tenant owner = newTenant();
            Tenant partner = newTenant();
            Sample sample = newSample(owner, "Shared");
            accessGrantService.grant(owner.admin(), partner.scientist().userId(), ObjectType.SAMPLE, sample.id(),
                    AccessLevel.EDIT);

            sampleService.update(partner.scientist(), sample.id(),
                    new SampleUpdate(null, "annotated by partner", null, null, null, null));

            Sample seen = sampleService.get(owner.viewer(), sample.id());
            assertThat(seen.description()).isEqualTo("annotated by partner");
            assertThat(seen.workspaceId()).isEqualTo(owner.workspaceId());
        }

        @Test
        @DisplayName("a project grant lists the project's samples")
        void projectGrantLists() {
            Tenant owner = newTenant();
            Tenant partner = newTenant();
            newSample(owner, "S-1");
            newSample(owner, "S-2");
            accessGrantService.grant(owner.admin(), partner.viewer().userId(), ObjectType.PROJECT,
                    owner.project().id(), AccessLevel.VIEW);

            assertThat(sampleService.list(partner.viewer(), owner.project().id())).hasSize(2);
            assertThat(sampleService.list(partner.viewer(), null)).isEmpty();
        }
    }

    @Test
    @DisplayName("a sample with live derived samples cannot be deleted")
    void deleteBlockedByDerived() {
        Tenant tenant = newTenant();
        Sample sample = newSample(tenant, "Parent");
        var derived = derivedSampleService.create(tenant.scientist(), sample.id(),
                new NewDerivedSample("D-1", "Extract", null, null, null, null, null, null));

        assertThatThrownBy(() -> sampleService.delete(tenant.admin(), sample.id()))
                .isInstanceOf(SampleHasDerivedException.class);

        derivedSampleService.delete(tenant.admin(), derived.id());
        sampleService.delete(tenant.admin(), sample.id());

        assertThatThrownBy(() -> sampleService.get(tenant.admin(), sample.id())).isInstanceOf(NotFoundException.class);
    }
}
