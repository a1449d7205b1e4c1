package com.mylab.labservice.api;

import com.mylab.labservice.api.dto.CompleteRequest;
import com.mylab.labservice.api.dto.RejectRequest;
import com.mylab.labservice.domain.handoff.Direction;
import com.mylab.labservice.domain.handoff.HandoffStatus;
import com.mylab.labservice.domain.handoff.NewSupplyChainRequest;
import com.mylab.labservice.domain.handoff.SupplyChainFilter;
import com.mylab.labservice.domain.handoff.SupplyChainRequest;
import com.mylab.labservice.domain.handoff.SupplyChainRequestUpdate;
import com.mylab.labservice.domain.handoff.WorkflowType;
import com.mylab.labservice.service.SupplyChainService;
import com.mylab.security.LabSecurityContext;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Collaboration requests between organizations of different workspaces.
 */
@RestController
@RequestMapping("/api/v1/supply-chain/collaboration-requests")
public class SupplyChainController {

    private final SupplyChainService supplyChain;

    public SupplyChainController(SupplyChainService supplyChain) {
        this.supplyChain = supplyChain;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<SupplyChainRequest> create(LabSecurityContext caller,
                                                  @RequestBody NewSupplyChainRequest request) {
        return ApiResponse.of(supplyChain.create(caller, request), "Collaboration request created");
    }

    @GetMapping
    public ListResponse<SupplyChainRequest> list(LabSecurityContext caller,
                                                 @RequestParam(required = false) Direction direction,
                                                 @RequestParam(required = false) HandoffStatus status,
                                                 @RequestParam(required = false) WorkflowType workflowType) {
        return ListResponse.of(supplyChain.list(caller, new SupplyChainFilter(direction, status, workflowType)));
    }

    @GetMapping("/{id}")
    public ApiResponse<SupplyChainRequest> get(LabSecurityContext caller, @PathVariable UUID id) {
        return ApiResponse.of(supplyChain.get(caller, id));
    }

    @PatchMapping("/{id}")
    public ApiResponse<SupplyChainRequest> update(LabSecurityContext caller, @PathVariable UUID id,
                                                  @RequestBody SupplyChainRequestUpdate update) {
        return ApiResponse.of(supplyChain.update(caller, id, update), "Collaboration request updated");
    }

    @PostMapping("/{id}/accept")
    public ApiResponse<SupplyChainRequest> accept(LabSecurityContext caller, @PathVariable UUID id) {
        return ApiResponse.of(supplyChain.accept(caller, id), "Collaboration request accepted");
    }

    @PostMapping("/{id}/reject")
    public ApiResponse<SupplyChainRequest> reject(LabSecurityContext caller, @PathVariable UUID id,
                                                  @RequestBody(required = false) RejectRequest request) {
        String reason = request != null ? request.reason() : null;
        return ApiResponse.of(supplyChain.reject(caller, id, reason), "Collaboration request rejected");
    }

    @PostMapping("/{id}/start")
    public ApiResponse<SupplyChainRequest> start(LabSecurityContext caller, @PathVariable UUID id) {
        return ApiResponse.of(supplyChain.start(caller, id), "Collaboration request started");
    }

    @PostMapping("/{id}/complete")
    public ApiResponse<SupplyChainRequest> complete(LabSecurityContext caller, @PathVariable UUID id,
                                                    @RequestBody(required = false) CompleteRequest request) {
        String summary = request != null ? request.resultSummary() : null;
        return ApiResponse.of(supplyChain.complete(caller, id, summary), "Collaboration request completed");
    }
}
