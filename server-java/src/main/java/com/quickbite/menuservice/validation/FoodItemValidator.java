package com.quickbite.menuservice.validation;

import com.quickbite.menuservice.dto.CreateFoodItemRequest;
import com.quickbite.menuservice.dto.UpdateFoodItemRequest;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs the request constraints and groups every violation by field.
 * All fields are checked; nothing stops at the first failure.
 */
@Component
public class FoodItemValidator {

    /** Request property -> reported field name, in reporting order. */
    private static final Map<String, String> FIELD_NAMES = new LinkedHashMap<>();

    static {
        FIELD_NAMES.put("name", "name");
        FIELD_NAMES.put("description", "description");
        FIELD_NAMES.put("price", "price");
        FIELD_NAMES.put("category", "category");
        FIELD_NAMES.put("dietaryTag", "dietary_tag");
    }

    private final Validator validator;

    public FoodItemValidator(Validator validator) {
        this.validator = validator;
    }

    public ValidationResult validateCreate(CreateFoodItemRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Create request is required");
        }
        return collect(validator.validate(request));
    }

    /**
     * Only supplied (non-null) fields carry constraints on the update request,
     * so omitted fields are never reported.
     */
    public ValidationResult validateUpdate(UpdateFoodItemRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Update request is required");
        }
        return collect(validator.validate(request));
    }

    private <T> ValidationResult collect(Set<ConstraintViolation<T>> violations) {
        if (violations.isEmpty()) {
            return ValidationResult.valid();
        }

        Map<String, List<String>> byProperty = new LinkedHashMap<>();
        for (ConstraintViolation<T> violation : violations) {
            String property = violation.getPropertyPath().toString();
            byProperty.computeIfAbsent(property, key -> new ArrayList<>()).add(violation.getMessage());
        }

        Map<String, List<String>> errors = new LinkedHashMap<>();
        for (Map.Entry<String, String> field : FIELD_NAMES.entrySet()) {
            List<String> messages = byProperty.remove(field.getKey());
            if (messages != null) {
                messages.sort(null);
                errors.put(field.getValue(), messages);
            }
        }
        // properties without a mapping keep their Java name
        byProperty.forEach((property, messages) -> {
            messages.sort(null);
            errors.put(property, messages);
        });
        return ValidationResult.of(errors);
    }
}
