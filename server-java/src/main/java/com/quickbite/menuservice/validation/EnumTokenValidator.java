package com.quickbite.menuservice.validation;

import com.quickbite.menuservice.model.CodedEnum;
import com.quickbite.menuservice.util.EnumTokenParser;
import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

public class EnumTokenValidator implements ConstraintValidator<EnumToken, String> {

    private Class<? extends CodedEnum> type;
    private String message;

    @Override
    public void initialize(EnumToken annotation) {
        this.type = annotation.value();
        this.message = annotation.message() + ": " + EnumTokenParser.describe(type) + ".";
    }

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        if (value == null) {
            return true;
        }
        if (EnumTokenParser.resolve(type, value).isPresent()) {
            return true;
        }
        context.disableDefaultConstraintViolation();
        context.buildConstraintViolationWithTemplate(message).addConstraintViolation();
        return false;
    }
}
