package com.mylab.labservice.api;

/**
 * Envelope of mutation and single-read responses.
 */
public record ApiResponse<T>(boolean success, T data, String message) {

    public static <T> ApiResponse<T> of(T data, String message) {
        return new ApiResponse<>(true, data, message);
    }

    public static <T> ApiResponse<T> of(T data) {
        return new ApiResponse<>(true, data, null);
    }
}
