package com.mylab.labservice.domain.workspace;

import java.util.UUID;

/**
 * @param id                optional caller-chosen id, usually the id the identity service issued
 * @param name              display name
 * @param parentWorkspaceId optional parent workspace
 */
public record NewWorkspace(UUID id, String name, UUID parentWorkspaceId) {
}
