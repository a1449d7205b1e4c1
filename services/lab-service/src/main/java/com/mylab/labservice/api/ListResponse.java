package com.mylab.labservice.api;

import java.util.List;

/**
 * Envelope of list responses.
 */
public record ListResponse<T>(boolean success, List<T> data, long count) {

    public static <T> ListResponse<T> of(List<T> data) {
        return new ListResponse<>(true, data, data.size());
    }

    public static <T> ListResponse<T> of(List<T> data, long total) {
        return new ListResponse<>(true, data, total);
    }
}
