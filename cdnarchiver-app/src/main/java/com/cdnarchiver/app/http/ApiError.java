package com.cdnarchiver.app.http;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Error envelope: {@code {"error": {"kind", "message", "retryable", "reasons"?}}}.
 */
public record ApiError(Body error) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Body(String kind, String message, boolean retryable, List<String> reasons) {
    }

    public static ApiError of(String kind, String message, boolean retryable) {
        return new ApiError(new Body(kind, message, retryable, null));
    }

    public static ApiError of(String kind, String message, boolean retryable, List<String> reasons) {
        return new ApiError(new Body(kind, message, retryable, reasons));
    }
}
