package com.familyagenda.error;

import java.util.List;

/**
 * Classified failure of an operation. The message is safe to show to callers;
 * store details stay in the cause and the logs.
 */
public class ApiException extends RuntimeException {

    private final ApiError error;
    private final List<String> invalidFields;

    public ApiException(ApiError error, String message) {
        this(error, message, List.of(), null);
    }

    public ApiException(ApiError error, String message, Throwable cause) {
        this(error, message, List.of(), cause);
    }

    private ApiException(ApiError error, String message, List<String> invalidFields, Throwable cause) {
        super(message != null ? message : error.defaultMessage(), cause);
        this.error = error;
        this.invalidFields = List.copyOf(invalidFields);
    }

    /**
     * Reports every rejected field at once.
     *
     * @param problems one entry per field, e.g. "fullName is required"
     */
    public static ApiException validation(List<String> problems) {
        String message = "Validation failed: " + String.join("; ", problems) + ".";
        return new ApiException(ApiError.VALIDATION_ERROR, message, problems, null);
    }

    public static ApiException notFound(String message) {
        return new ApiException(ApiError.NOT_FOUND, message);
    }

    public static ApiException conflict(String message, Throwable cause) {
        return new ApiException(ApiError.CONFLICT, message, cause);
    }

    public static ApiException internal(Throwable cause) {
        return new ApiException(ApiError.INTERNAL_FAILURE, ApiError.INTERNAL_FAILURE.defaultMessage(), cause);
    }

    public ApiError getError() {
        return error;
    }

    public List<String> getInvalidFields() {
        return invalidFields;
    }
}
