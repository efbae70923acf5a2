package com.familyagenda.error;

import org.springframework.http.HttpStatus;

/**
 * Error taxonomy shared by every operation, with the status and the safe
 * message each category surfaces to callers.
 */
public enum ApiError {

    UNAUTHENTICATED(HttpStatus.UNAUTHORIZED, "Unauthorized: missing user identity."),
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST, "Invalid request."),
    CONFLICT(HttpStatus.CONFLICT, "Resource already exists."),
    NOT_FOUND(HttpStatus.NOT_FOUND, "Resource not found."),
    INTERNAL_FAILURE(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error.");

    private final HttpStatus status;
    private final String defaultMessage;

    ApiError(HttpStatus status, String defaultMessage) {
        this.status = status;
        this.defaultMessage = defaultMessage;
    }

    public HttpStatus status() {
        return status;
    }

    public String defaultMessage() {
        return defaultMessage;
    }
}
