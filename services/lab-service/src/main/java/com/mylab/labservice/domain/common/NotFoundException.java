package com.mylab.labservice.domain.common;

/**
 * The entity does not exist, is deleted, or belongs to another workspace. Callers cannot tell
 * these cases apart.
 */
public class NotFoundException extends LabException {

    private final String resource;
    private final Object id;

    public NotFoundException(String resource, Object id) {
        super("NOT_FOUND", "%s %s not found".formatted(resource, id));
        this.resource = resource;
        this.id = id;
    }

    public String resource() {
        return resource;
    }

    public Object id() {
        return id;
    }
}
