package com.mylab.labservice.domain.project;

/**
 * Partial update; null fields are left unchanged.
 */
public record ProjectUpdate(
        String name,
        String description,
        ProjectStatus status,
        WorkflowMode workflowMode) {

    public boolean isEmpty() {
        return name == null && description == null && status == null && workflowMode == null;
    }

    public void validate() {
        if (isEmpty()) {
            throw new NewProject.InvalidProjectDataException("No fields to update");
        }
        if (name != null && (name.isBlank() || name.length() > NewProject.MAX_NAME_LENGTH)) {
            throw new NewProject.InvalidProjectDataException(
                    "Project name must be 1 to %d characters".formatted(NewProject.MAX_NAME_LENGTH));
        }
        if (description != null && description.length() > NewProject.MAX_DESCRIPTION_LENGTH) {
            throw new NewProject.InvalidProjectDataException(
                    "Project description must be at most %d characters".formatted(NewProject.MAX_DESCRIPTION_LENGTH));
        }
    }
}
