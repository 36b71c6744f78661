package com.voicerelay.servicebackend.web.dto;

/**
 * Error body: {@code {"error": {"type": "...", "code": "...", "message": "..."}}}.
 */
public record ApiErrorResponse(ErrorDetail error) {

    public static ApiErrorResponse of(String type, String code, String message) {
        return new ApiErrorResponse(new ErrorDetail(type, code, message));
    }

    public record ErrorDetail(String type, String code, String message) {
    }
}
