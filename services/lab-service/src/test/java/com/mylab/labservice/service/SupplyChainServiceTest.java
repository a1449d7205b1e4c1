package com.mylab.labservice.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.mylab.labservice.domain.common.ForbiddenException;
import com.mylab.labservice.domain.common.InvalidDataException;
import com.mylab.labservice.domain.common.InvalidStateTransitionException;
import com.mylab.labservice.domain.common.NotFoundException;
import com.mylab.labservice.domain.handoff.Direction;
import com.mylab.labservice.domain.handoff.HandoffStatus;
import com.mylab.labservice.domain.handoff.MaterialDescriptor;
import com.mylab.labservice.domain.handoff.NewSupplyChainRequest;
import com.mylab.labservice.domain.handoff.Priority;
import com.mylab.labservice.domain.handoff.SupplyChainFilter;
import com.mylab.labservice.domain.handoff.SupplyChainRequest;
import com.mylab.labservice.domain.handoff.SupplyChainRequestUpdate;
import com.mylab.labservice.domain.handoff.WorkflowType;
import com.mylab.labservice.domain.organization.NewOrganization;
import com.mylab.labservice.domain.organization.OrganizationType;
import com.mylab.labservice.domain.project.Project;
import com.mylab.labservice.domain.project.WorkflowMode;
import com.mylab.labservice.domain.sample.Sample;
import java.math.BigDecimal;
import java.time.LocalDate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("SupplyChainService")
class SupplyChainServiceTest extends LabIntegrationTest {

    private SupplyChainRequest send(Tenant from, Tenant to, WorkflowType type, Priority priority) {
        Sample source = newSample(from, "Batch 7 API");
        MaterialDescriptor material = new MaterialDescriptor(1, "API lot 7", source.id(), new BigDecimal("5"), "kg",
                "crystallized");
        return supplyChainService.create(from.scientist(), new NewSupplyChainRequest(from.lab().id(), to.lab().id(),
                from.project().id(), type, material, "GMP release testing", priority, LocalDate.of(2030, 1, 31), null));
    }

    @Test
    @DisplayName("creates a pending request visible from both workspaces")
    void create() {
        Tenant from = newTenant();
        Tenant to = newTenant();

        SupplyChainRequest request = send(from, to, WorkflowType.ANALYSIS_ONLY, null);

        assertThat(request.status()).isEqualTo(HandoffStatus.PENDING);
        assertThat(request.priority()).isEqualTo(Priority.MEDIUM);
        assertThat(request.toWorkspaceId()).isEqualTo(to.workspaceId());
        assertThat(supplyChainService.get(to.viewer(), request.id()).material().materialName()).isEqualTo("API lot 7");
        assertThat(supplyChainService.get(from.viewer(), request.id()).id()).isEqualTo(request.id());
    }

    @Test
    @DisplayName("the receiving organization must be in another workspace")
    void receiverMustBeForeign() {
        Tenant tenant = newTenant();
        var sameWorkspaceOrg = organizationService.create(tenant.admin(),
                new NewOrganization("Sister lab", OrganizationType.LABORATORY, null));

        assertThatThrownBy(() -> supplyChainService.create(tenant.scientist(), new NewSupplyChainRequest(
                tenant.lab().id(), sameWorkspaceOrg.id(), tenant.project().id(), WorkflowType.ANALYSIS_ONLY,
                null, null, null, null, null)))
                .isInstanceOf(InvalidDataException.class);
    }

    @Test
    @DisplayName("material transfers need a material name")
    void materialRequired() {
        Tenant from = newTenant();
        Tenant to = newTenant();

        assertThatThrownBy(() -> supplyChainService.create(from.scientist(), new NewSupplyChainRequest(
                from.lab().id(), to.lab().id(), from.project().id(), WorkflowType.MATERIAL_TRANSFER,
                null, null, null, null, null)))
                .isInstanceOf(InvalidDataException.class);
    }

    @Test
    @DisplayName("unrelated workspaces cannot see the request")
    void unrelatedCannotSee() {
        Tenant from = newTenant();
        Tenant to = newTenant();
        Tenant bystander = newTenant();
        SupplyChainRequest request = send(from, to, WorkflowType.ANALYSIS_ONLY, null);

        assertThatThrownBy(() -> supplyChainService.get(bystander.admin(), request.id()))
                .isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> supplyChainService.accept(bystander.admin(), request.id()))
                .isInstanceOf(NotFoundException.class);
    }

    @Nested
    @DisplayName("state machine")
    class StateMachine {

        @Test
        @DisplayName("the receiver accepts, starts and completes")
        void happyPath() {
            Tenant from = newTenant();
            Tenant to = newTenant();
            SupplyChainRequest request = send(from, to, WorkflowType.ANALYSIS_ONLY, Priority.HIGH);

            SupplyChainRequest accepted = supplyChainService.accept(to.scientist(), request.id());
            supplyChainService.start(to.scientist(), request.id());
            SupplyChainRequest completed = supplyChainService.complete(to.scientist(), request.id(), "All specs met");

            assertThat(accepted.assignedTo()).isEqualTo(to.scientist().userId());
            assertThat(accepted.linkedProjectId()).isNull();
            assertThat(completed.status()).isEqualTo(HandoffStatus.COMPLETED);
            assertThat(completed.resolvedAt()).isNotNull();
            assertThat(supplyChainService.get(from.viewer(), request.id()).resultSummary()).isEqualTo("All specs met");
        }

        @Test
        @DisplayName("the initiator cannot move its own request")
        void initiatorCannotTransition() {
            Tenant from = newTenant();
            Tenant to = newTenant();
            SupplyChainRequest request = send(from, to, WorkflowType.ANALYSIS_ONLY, null);

            assertThatThrownBy(() -> supplyChainService.accept(from.admin(), request.id()))
                    .isInstanceOf(ForbiddenException.class);
        }

        @Test
        @DisplayName("only pending requests can be rejected and nothing leaves a terminal state")
        void rejection() {
            Tenant from = newTenant();
            Tenant to = newTenant();
            SupplyChainRequest accepted = send(from, to, WorkflowType.ANALYSIS_ONLY, null);
            supplyChainService.accept(to.scientist(), accepted.id());
            SupplyChainRequest pending = send(from, to, WorkflowType.ANALYSIS_ONLY, null);

            assertThatThrownBy(() -> supplyChainService.reject(to.scientist(), accepted.id(), "too late"))
                    .isInstanceOf(InvalidStateTransitionException.class);

            SupplyChainRequest rejected = supplyChainService.reject(to.scientist(), pending.id(), "no capacity");

            assertThat(rejected.rejectionReason()).isEqualTo("no capacity");
            assertThatThrownBy(() -> supplyChainService.accept(to.scientist(), pending.id()))
                    .isInstanceOf(InvalidStateTransitionException.class);
        }

        @Test
        @DisplayName("completing skips no step")
        void noSkipping() {
            Tenant from = newTenant();
            Tenant to = newTenant();
            SupplyChainRequest request = send(from, to, WorkflowType.ANALYSIS_ONLY, null);

            assertThatThrownBy(() -> supplyChainService.complete(to.scientist(), request.id(), null))
                    .isInstanceOf(InvalidStateTransitionException.class);
        }

        @Test
        @DisplayName("accepting a material transfer creates the receiving project and sample")
        void acceptCreatesReceivingRecords() {
            Tenant from = newTenant();
            Tenant to = newTenant();
            SupplyChainRequest request = send(from, to, WorkflowType.MATERIAL_TRANSFER, null);

            SupplyChainRequest accepted = supplyChainService.accept(to.scientist(), request.id());

            Project project = projectService.get(to.viewer(), accepted.linkedProjectId());
            Sample sample = sampleService.get(to.viewer(), accepted.linkedSampleId());
            assertThat(project.name()).isEqualTo("Supply chain: API lot 7");
            assertThat(project.externalClientName()).isEqualTo(from.lab().name());
            assertThat(project.executingOrgId()).isEqualTo(to.lab().id());
            assertThat(project.workflowMode()).isEqualTo(WorkflowMode.ANALYSIS_FIRST);
            assertThat(project.externalReference()).isEqualTo("supply-chain:" + request.id());
            assertThat(sample.projectId()).isEqualTo(project.id());
            assertThat(sample.quantity()).isEqualByComparingTo("5");
        }
    }

    @Test
    @DisplayName("lists by direction, highest priority first")
    void listing() {
        Tenant from = newTenant();
        Tenant to = newTenant();
        SupplyChainRequest low = send(from, to, WorkflowType.ANALYSIS_ONLY, Priority.LOW);
        SupplyChainRequest urgent = send(from, to, WorkflowType.ANALYSIS_ONLY, Priority.URGENT);

        assertThat(supplyChainService.list(from.viewer(), new SupplyChainFilter(Direction.OUTGOING, null, null)))
                .extracting(SupplyChainRequest::id)
                .containsExactly(urgent.id(), low.id());
        assertThat(supplyChainService.list(to.viewer(), new SupplyChainFilter(Direction.INCOMING, null, null)))
                .hasSize(2);
        assertThat(supplyChainService.list(from.viewer(), new SupplyChainFilter(Direction.INCOMING, null, null)))
                .isEmpty();
        assertThat(supplyChainService.list(to.viewer(),
                new SupplyChainFilter(null, HandoffStatus.ACCEPTED, null))).isEmpty();
    }

    @Test
    @DisplayName("the initiator edits an open request and the receiver cannot")
    void update() {
        Tenant from = newTenant();
        Tenant to = newTenant();
        SupplyChainRequest request = send(from, to, WorkflowType.ANALYSIS_ONLY, null);

        SupplyChainRequest updated = supplyChainService.update(from.scientist(), request.id(),
                new SupplyChainRequestUpdate(Priority.URGENT, null, "expedite"));

        assertThat(updated.priority()).isEqualTo(Priority.URGENT);
        assertThat(updated.notes()).isEqualTo("expedite");
        assertThatThrownBy(() -> supplyChainService.update(to.scientist(), request.id(),
                new SupplyChainRequestUpdate(Priority.LOW, null, null)))
                .isInstanceOf(ForbiddenException.class);
    }
}
