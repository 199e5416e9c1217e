package com.quickbite.menuservice.exception;

import com.quickbite.menuservice.validation.ValidationResult;
import lombok.Getter;

/**
 * A create or update request broke one or more field rules. Nothing was written.
 */
@Getter
public class FoodItemValidationException extends MenuServiceException {

    private final ValidationResult result;

    public FoodItemValidationException(ValidationResult result) {
        super(ErrorCode.VALIDATION_FAILED, "Food item validation failed: " + result.getErrors().keySet());
        this.result = result;
    }
}
