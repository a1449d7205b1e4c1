package com.mylab.labservice.api;

import com.mylab.labservice.domain.organization.NewOrganization;
import com.mylab.labservice.domain.organization.Organization;
import com.mylab.labservice.domain.organization.OrganizationUpdate;
import com.mylab.labservice.service.OrganizationService;
import com.mylab.security.LabSecurityContext;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/organizations")
public class OrganizationController {

    private final OrganizationService organizations;

    public OrganizationController(OrganizationService organizations) {
        this.organizations = organizations;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<Organization> create(LabSecurityContext caller, @RequestBody NewOrganization request) {
        return ApiResponse.of(organizations.create(caller, request), "Organization created");
    }

    @GetMapping
    public ListResponse<Organization> list(LabSecurityContext caller) {
        return ListResponse.of(organizations.list(caller));
    }

    @GetMapping("/{id}")
    public ApiResponse<Organization> get(LabSecurityContext caller, @PathVariable UUID id) {
        return ApiResponse.of(organizations.get(caller, id));
    }

    @PutMapping("/{id}")
    public ApiResponse<Organization> update(LabSecurityContext caller, @PathVariable UUID id,
                                            @RequestBody OrganizationUpdate update) {
        return ApiResponse.of(organizations.update(caller, id, update), "Organization updated");
    }

    @DeleteMapping("/{id}")
    public ApiResponse<Void> delete(LabSecurityContext caller, @PathVariable UUID id) {
        organizations.delete(caller, id);
        return ApiResponse.of(null, "Organization deleted");
    }
}
