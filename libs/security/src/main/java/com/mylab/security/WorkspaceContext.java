package com.mylab.security;

import java.util.UUID;

/**
 * The workspace a request is scoped to. Every hierarchy read and write filters on
 * {@link #workspaceId()}.
 *
 * @param workspaceId   tenancy boundary identifier
 * @param workspaceName optional human-readable name
 */
public record WorkspaceContext(UUID workspaceId, String workspaceName) {
}
