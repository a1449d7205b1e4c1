package com.mylab.labservice.domain.project;

import com.mylab.labservice.domain.common.InvalidDataException;
import java.util.UUID;

public record NewProject(
        String name,
        String description,
        UUID clientOrgId,
        String externalClientName,
        UUID executingOrgId,
        WorkflowMode workflowMode,
        String externalReference) {

    public static final int MAX_NAME_LENGTH = 255;
    public static final int MAX_DESCRIPTION_LENGTH = 2000;

    /**
     * Field-level checks that need no database access.
     *
     * @throws InvalidProjectDataException on the first violation
     */
    public void validate() {
        if (name == null || name.isBlank()) {
            throw new InvalidProjectDataException("Project name is required");
        }
        if (name.length() > MAX_NAME_LENGTH) {
            throw new InvalidProjectDataException("Project name must be at most %d characters".formatted(MAX_NAME_LENGTH));
        }
        if (description != null && description.length() > MAX_DESCRIPTION_LENGTH) {
            throw new InvalidProjectDataException(
                    "Project description must be at most %d characters".formatted(MAX_DESCRIPTION_LENGTH));
        }
        boolean hasClientOrg = clientOrgId != null;
        boolean hasExternalClient = externalClientName != null && !externalClientName.isBlank();
        if (hasClientOrg == hasExternalClient) {
            throw new InvalidProjectDataException("Exactly one of clientOrgId or externalClientName must be provided");
        }
        if (executingOrgId == null) {
            throw new InvalidProjectDataException("executingOrgId is required");
        }
    }

    /**
     * Raised for invalid project input, including organization references outside the workspace.
     */
    public static class InvalidProjectDataException extends InvalidDataException {
        public InvalidProjectDataException(String message) {
            super("INVALID_PROJECT_DATA", message);
        }
    }
}
