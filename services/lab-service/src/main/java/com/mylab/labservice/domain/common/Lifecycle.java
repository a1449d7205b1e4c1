package com.mylab.labservice.domain.common;

/**
 * Liveness of a soft-deletable record. {@link #DELETED} rows are invisible to every query.
 */
public enum Lifecycle {
    ACTIVE,
    DELETED
}
