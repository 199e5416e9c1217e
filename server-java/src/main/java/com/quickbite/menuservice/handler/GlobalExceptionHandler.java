package com.quickbite.menuservice.handler;

import com.quickbite.menuservice.exception.ErrorCode;
import com.quickbite.menuservice.exception.ErrorResponse;
import com.quickbite.menuservice.exception.FoodItemStorageException;
import com.quickbite.menuservice.exception.FoodItemValidationException;
import com.quickbite.menuservice.exception.MenuServiceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.UUID;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(FoodItemValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(FoodItemValidationException ex) {
        ErrorCode errorCode = ex.getErrorCode();
        return ResponseEntity
                .status(errorCode.getStatus())
                .body(ErrorResponse.withErrors(errorCode, ex.getResult().getErrors()));
    }

    @ExceptionHandler(FoodItemStorageException.class)
    public ResponseEntity<ErrorResponse> handleStorageException(FoodItemStorageException ex) {
        String errorId = UUID.randomUUID().toString();
        log.error("[ErrorID: {}] Storage failure: {}", errorId, ex.getMessage(), ex);
        return ResponseEntity
                .status(ErrorCode.STORAGE_FAILURE.getStatus())
                .body(ErrorResponse.withErrorId(ErrorCode.STORAGE_FAILURE, errorId));
    }

    @ExceptionHandler(MenuServiceException.class)
    public ResponseEntity<ErrorResponse> handleMenuServiceException(MenuServiceException ex) {
        ErrorCode errorCode = ex.getErrorCode();
        log.warn("{}: {}", errorCode.name(), ex.getMessage());
        return ResponseEntity
                .status(errorCode.getStatus())
                .body(ErrorResponse.of(errorCode));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleHttpMessageNotReadableException(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return ResponseEntity
                .status(ErrorCode.MALFORMED_REQUEST.getStatus())
                .body(ErrorResponse.of(ErrorCode.MALFORMED_REQUEST));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentTypeMismatchException(MethodArgumentTypeMismatchException ex) {
        log.warn("Invalid value for '{}': {}", ex.getName(), ex.getValue());
        return ResponseEntity
                .status(ErrorCode.INVALID_INPUT_VALUE.getStatus())
                .body(new ErrorResponse(ErrorCode.INVALID_INPUT_VALUE.getCode(),
                        "Invalid value for '" + ex.getName() + "'."));
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleHttpMediaTypeNotSupportedException(HttpMediaTypeNotSupportedException ex) {
        log.warn("Unsupported Content-Type: {}", ex.getMessage());
        return ResponseEntity
                .status(ErrorCode.UNSUPPORTED_MEDIA_TYPE.getStatus())
                .body(ErrorResponse.of(ErrorCode.UNSUPPORTED_MEDIA_TYPE));
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleHttpRequestMethodNotSupportedException(HttpRequestMethodNotSupportedException ex) {
        log.warn("Method not allowed: {} {}", ex.getMethod(), ex.getSupportedMethods());
        return ResponseEntity
                .status(ErrorCode.METHOD_NOT_ALLOWED.getStatus())
                .body(new ErrorResponse(
                        ErrorCode.METHOD_NOT_ALLOWED.getCode(),
                        "'" + ex.getMethod() + "' is not supported here."
                ));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponse> handleNoResourceFoundException(NoResourceFoundException ex) {
        return ResponseEntity
                .status(ErrorCode.RESOURCE_NOT_FOUND.getStatus())
                .body(ErrorResponse.of(ErrorCode.RESOURCE_NOT_FOUND));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleException(Exception ex) {
        String errorId = UUID.randomUUID().toString();
        log.error("[ErrorID: {}] Unexpected server error", errorId, ex);
        return ResponseEntity
                .status(ErrorCode.INTERNAL_SERVER_ERROR.getStatus())
                .body(ErrorResponse.withErrorId(ErrorCode.INTERNAL_SERVER_ERROR, errorId));
    }
}
