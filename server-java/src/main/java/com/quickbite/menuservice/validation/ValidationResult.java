package com.quickbite.menuservice.validation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of validating a request: either valid, or a mapping from field
 * name to the ordered messages for that field.
 */
public final class ValidationResult {

    private static final ValidationResult VALID = new ValidationResult(Map.of());

    private final Map<String, List<String>> errors;

    private ValidationResult(Map<String, List<String>> errors) {
        this.errors = errors;
    }

    public static ValidationResult valid() {
        return VALID;
    }

    public static ValidationResult of(Map<String, List<String>> errors) {
        if (errors == null || errors.isEmpty()) {
            return VALID;
        }
        Map<String, List<String>> copy = new LinkedHashMap<>();
        errors.forEach((field, messages) -> copy.put(field, List.copyOf(messages)));
        return new ValidationResult(Collections.unmodifiableMap(copy));
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public Map<String, List<String>> getErrors() {
        return errors;
    }

    public List<String> errorsFor(String field) {
        return errors.getOrDefault(field, List.of());
    }

    public boolean hasErrorFor(String field) {
        return errors.containsKey(field);
    }

    @Override
    public String toString() {
        return isValid() ? "ValidationResult{valid}" : "ValidationResult" + errors;
    }
}
