package com.quickbite.menuservice.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;

import java.util.List;
import java.util.Map;

@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    private final String code;
    private final String message;
    private Map<String, List<String>> errors;
    @JsonProperty("error_id")
    private String errorId;

    public ErrorResponse(String code, String message) {
        this.code = code;
        this.message = message;
    }

    public static ErrorResponse of(ErrorCode errorCode) {
        return new ErrorResponse(errorCode.getCode(), errorCode.getMessage());
    }

    public static ErrorResponse withErrors(ErrorCode errorCode, Map<String, List<String>> errors) {
        ErrorResponse response = of(errorCode);
        response.errors = errors;
        return response;
    }

    public static ErrorResponse withErrorId(ErrorCode errorCode, String errorId) {
        ErrorResponse response = of(errorCode);
        response.errorId = errorId;
        return response;
    }
}
