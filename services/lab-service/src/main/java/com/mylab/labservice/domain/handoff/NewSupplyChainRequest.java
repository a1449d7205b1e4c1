package com.mylab.labservice.domain.handoff;

import com.mylab.labservice.domain.common.InvalidDataException;
import java.time.LocalDate;
import java.util.UUID;

public record NewSupplyChainRequest(
        UUID fromOrgId,
        UUID toOrgId,
        UUID fromProjectId,
        WorkflowType workflowType,
        MaterialDescriptor material,
        String requirements,
        Priority priority,
        LocalDate dueDate,
        String notes) {

    public void validate() {
        if (fromOrgId == null || toOrgId == null) {
            throw new InvalidDataException("fromOrgId and toOrgId are required");
        }
        if (fromOrgId.equals(toOrgId)) {
            throw new InvalidDataException("A request cannot be sent to the sending organization");
        }
        if (fromProjectId == null) {
            throw new InvalidDataException("fromProjectId is required");
        }
        if (workflowType == null) {
            throw new InvalidDataException("workflowType is required");
        }
        if (workflowType.requiresMaterial()
                && (material == null || material.materialName() == null || material.materialName().isBlank())) {
            throw new InvalidDataException("material.materialName is required for %s requests"
                    .formatted(workflowType.value()));
        }
        if (material != null && material.quantity() != null && material.quantity().signum() <= 0) {
            throw new InvalidDataException("material.quantity must be greater than zero");
        }
    }
}
