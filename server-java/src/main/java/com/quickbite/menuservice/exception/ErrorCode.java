package com.quickbite.menuservice.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public enum ErrorCode {

    // --- Food item (100) ---
    FOOD_ITEM_NOT_FOUND(HttpStatus.NOT_FOUND, "101", "The requested food item does not exist."),
    VALIDATION_FAILED(HttpStatus.BAD_REQUEST, "102", "One or more fields are invalid."),

    // --- Storage (500) ---
    STORAGE_FAILURE(HttpStatus.INTERNAL_SERVER_ERROR, "501", "The menu could not be read or saved. Please try again later."),

    // --- Common (900) ---
    INVALID_INPUT_VALUE(HttpStatus.BAD_REQUEST, "901", "Invalid input value."),
    MALFORMED_REQUEST(HttpStatus.BAD_REQUEST, "902", "The request body could not be read."),
    METHOD_NOT_ALLOWED(HttpStatus.METHOD_NOT_ALLOWED, "903", "This method is not allowed."),
    UNSUPPORTED_MEDIA_TYPE(HttpStatus.UNSUPPORTED_MEDIA_TYPE, "904", "Unsupported Content-Type. Use application/json."),
    RESOURCE_NOT_FOUND(HttpStatus.NOT_FOUND, "905", "No resource exists at this path."),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "999", "An internal server error occurred. Please contact the administrator if it persists."),
    ;

    private final HttpStatus status;
    private final String code;
    private final String message;

    ErrorCode(HttpStatus status, String code, String message) {
        this.status = status;
        this.code = code;
        this.message = message;
    }
}
