package com.quickbite.menuservice.exception;

public class FoodItemStorageException extends MenuServiceException {

    public FoodItemStorageException(String message, Throwable cause) {
        super(ErrorCode.STORAGE_FAILURE, message, cause);
    }
}
