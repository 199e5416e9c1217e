package com.quickbite.menuservice.exception;

import lombok.Getter;

@Getter
public class MenuServiceException extends RuntimeException {

    private final ErrorCode errorCode;

    public MenuServiceException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public MenuServiceException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public MenuServiceException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
