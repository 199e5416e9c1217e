package com.quickbite.menuservice.validation;

import com.quickbite.menuservice.model.CodedEnum;
import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * The annotated string must name a value of {@link #value()}.
 * Null is accepted; combine with {@code @NotNull} when the field is required.
 * The allowed tokens are appended to {@link #message()}.
 */
@Documented
@Constraint(validatedBy = EnumTokenValidator.class)
@Target({ElementType.FIELD, ElementType.PARAMETER})
@Retention(RetentionPolicy.RUNTIME)
public @interface EnumToken {

    Class<? extends CodedEnum> value();

    String message() default "Value must be one of";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
