package com.mylab.labservice.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.mylab.labservice.domain.common.AlreadyExistsException;
import com.mylab.labservice.domain.common.ExecutionMode;
import com.mylab.labservice.domain.common.InvalidDataException;
import com.mylab.labservice.domain.common.NotFoundException;
import com.mylab.labservice.domain.lineage.DerivedSample;
import com.mylab.labservice.domain.lineage.InvalidLineageException;
import com.mylab.labservice.domain.lineage.NewDerivedSample;
import com.mylab.labservice.domain.sample.Sample;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("DerivedSampleService")
class DerivedSampleServiceTest extends LabIntegrationTest {

    private static NewDerivedSample derived(String code, UUID supersedesId) {
        return new NewDerivedSample(code, "Extract " + code, "centrifuge", null, null, null, supersedesId,
                Map.of("rpm", "3000"));
    }

    @Test
    @DisplayName("defaults the executing organization to the project's")
    void defaultsExecutingOrganization() {
        Tenant tenant = newTenant();
        Sample parent = newSample(tenant, "Parent");

        DerivedSample created = derivedSampleService.create(tenant.scientist(), parent.id(), derived("D-1", null));

        assertThat(created.executedByOrgId()).isEqualTo(tenant.lab().id());
        assertThat(created.executionMode()).isEqualTo(ExecutionMode.PLATFORM);
        assertThat(created.metadata().values()).containsEntry("rpm", "3000");
        assertThat(derivedSampleService.listByParent(tenant.viewer(), parent.id()))
                .extracting(DerivedSample::id)
                .containsExactly(created.id());
    }

    @Test
    @DisplayName("derived codes are unique within a workspace")
    void uniqueCode() {
        Tenant tenant = newTenant();
        Sample parent = newSample(tenant, "Parent");
        derivedSampleService.create(tenant.scientist(), parent.id(), derived("D-1", null));

        assertThatThrownBy(() -> derivedSampleService.create(tenant.scientist(), parent.id(), derived("D-1", null)))
                .isInstanceOf(AlreadyExistsException.class);
    }

    @Test
    @DisplayName("a code differing only by surrounding whitespace is a duplicate with a clean message")
    void paddedDuplicateCode() {
        Tenant tenant = newTenant();
        Sample parent = newSample(tenant, "Parent");
        derivedSampleService.create(tenant.scientist(), parent.id(), derived("X1", null));

        assertThatThrownBy(() -> derivedSampleService.create(tenant.scientist(), parent.id(), derived(" X1 ", null)))
                .isExactlyInstanceOf(AlreadyExistsException.class)
                .hasMessage("Derived code 'X1' already exists in this workspace")
                .satisfies(e -> assertThat(e.getMessage())
                        .doesNotContainIgnoringCase("uq_derived_code")
                        .doesNotContainIgnoringCase("sql"));
    }

    @Test
    @DisplayName("external execution needs an external reference")
    void externalNeedsReference() {
        Tenant tenant = newTenant();
        Sample parent = newSample(tenant, "Parent");

        assertThatThrownBy(() -> derivedSampleService.create(tenant.scientist(), parent.id(),
                new NewDerivedSample("D-X", "Ext", null, ExecutionMode.EXTERNAL, null, null, null, null)))
                .isInstanceOf(InvalidDataException.class);
    }

    @Nested
    @DisplayName("supersession")
    class Supersession {

        @Test
        @DisplayName("builds a single chain walked newest first")
        void buildsChain() {
            Tenant tenant = newTenant();
            Sample parent = newSample(tenant, "Parent");
            DerivedSample v1 = derivedSampleService.create(tenant.scientist(), parent.id(), derived("V1", null));
            DerivedSample v2 = derivedSampleService.create(tenant.scientist(), parent.id(), derived("V2", v1.id()));
            DerivedSample v3 = derivedSampleService.create(tenant.scientist(), parent.id(), derived("V3", v2.id()));

            assertThat(derivedSampleService.lineage(tenant.viewer(), v3.id()))
                    .extracting(DerivedSample::id)
                    .containsExactly(v3.id(), v2.id(), v1.id());
            assertThat(derivedSampleService.get(tenant.viewer(), v1.id()).supersededById()).isEqualTo(v2.id());
            assertThat(derivedSampleService.get(tenant.viewer(), v3.id()).isHead()).isTrue();
        }

        @Test
        @DisplayName("a superseded record cannot be superseded again")
        void noSecondHead() {
            Tenant tenant = newTenant();
            Sample parent = newSample(tenant, "Parent");
            DerivedSample v1 = derivedSampleService.create(tenant.scientist(), parent.id(), derived("V1", null));
            derivedSampleService.create(tenant.scientist(), parent.id(), derived("V2", v1.id()));

            assertThatThrownBy(() -> derivedSampleService.create(tenant.scientist(), parent.id(),
                    derived("V2-bis", v1.id())))
                    .isInstanceOf(InvalidLineageException.class);
        }

        @Test
        @DisplayName("the successor must share the predecessor's parent sample")
        void sameParent() {
            Tenant tenant = newTenant();
            Sample first = newSample(tenant, "First");
            Sample second = newSample(tenant, "Second");
            DerivedSample v1 = derivedSampleService.create(tenant.scientist(), first.id(), derived("V1", null));

            assertThatThrownBy(() -> derivedSampleService.create(tenant.scientist(), second.id(),
                    derived("V2", v1.id())))
                    .isInstanceOf(InvalidDataException.class);
        }

        @Test
        @DisplayName("deleted predecessors stay in the lineage")
        void deletedNodesRemainInLineage() {
            Tenant tenant = newTenant();
            Sample parent = newSample(tenant, "Parent");
            DerivedSample v1 = derivedSampleService.create(tenant.scientist(), parent.id(), derived("V1", null));
            DerivedSample v2 = derivedSampleService.create(tenant.scientist(), parent.id(), derived("V2", v1.id()));

            derivedSampleService.delete(tenant.admin(), v1.id());

            assertThat(derivedSampleService.lineage(tenant.viewer(), v2.id()))
                    .extracting(DerivedSample::id)
                    .containsExactly(v2.id(), v1.id());
            assertThatThrownBy(() -> derivedSampleService.get(tenant.viewer(), v1.id()))
                    .isInstanceOf(NotFoundException.class);
        }

        @Test
        @DisplayName("a deleted head can still be superseded")
        void deletedHeadStaysExtendable() {
            Tenant tenant = newTenant();
            Sample parent = newSample(tenant, "Parent");
            DerivedSample v1 = derivedSampleService.create(tenant.scientist(), parent.id(), derived("V1", null));
            DerivedSample v2 = derivedSampleService.create(tenant.scientist(), parent.id(), derived("V2", v1.id()));
            derivedSampleService.delete(tenant.admin(), v2.id());

            DerivedSample v3 = derivedSampleService.create(tenant.scientist(), parent.id(), derived("V3", v2.id()));

            assertThat(v3.supersedesId()).isEqualTo(v2.id());
            assertThat(derivedSampleService.lineage(tenant.viewer(), v3.id()))
                    .extracting(DerivedSample::id)
                    .containsExactly(v3.id(), v2.id(), v1.id());
            assertThatThrownBy(() -> derivedSampleService.create(tenant.scientist(), parent.id(),
                    derived("V2-bis", v1.id())))
                    .isInstanceOf(InvalidLineageException.class);
        }
    }

    @Test
    @DisplayName("derived samples of another workspace are invisible")
    void isolation() {
        Tenant mine = newTenant();
        Tenant theirs = newTenant();
        Sample parent = newSample(theirs, "Theirs");
        DerivedSample created = derivedSampleService.create(theirs.scientist(), parent.id(), derived("D-1", null));

        assertThatThrownBy(() -> derivedSampleService.get(mine.admin(), created.id()))
                .isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> derivedSampleService.create(mine.scientist(), parent.id(), derived("D-2", null)))
                .isInstanceOf(NotFoundException.class);
    }
}
