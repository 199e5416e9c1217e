package com.quickbite.menuservice.util;

import com.quickbite.menuservice.model.CodedEnum;

import java.util.Arrays;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Resolves inbound enum values. Accepts the wire token, the constant name
 * (both case-insensitive) or the integer code.
 */
public final class EnumTokenParser {

    private static final Pattern INTEGER_CODE = Pattern.compile("[+-]?\\d+");

    private EnumTokenParser() {
    }

    public static <E extends CodedEnum> Optional<E> resolve(Class<E> type, String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return Optional.empty();
        }
        E[] constants = type.getEnumConstants();
        if (constants == null) {
            throw new IllegalArgumentException(type.getName() + " is not an enum type");
        }

        String value = raw.trim();
        if (INTEGER_CODE.matcher(value).matches()) {
            return resolveCode(constants, value);
        }
        for (E constant : constants) {
            if (constant.getToken().equalsIgnoreCase(value) || constant.name().equalsIgnoreCase(value)) {
                return Optional.of(constant);
            }
        }
        return Optional.empty();
    }

    public static String describe(Class<? extends CodedEnum> type) {
        return Arrays.stream(type.getEnumConstants())
                .map(CodedEnum::getToken)
                .collect(Collectors.joining(", "));
    }

    private static <E extends CodedEnum> Optional<E> resolveCode(E[] constants, String value) {
        long code;
        try {
            code = Long.parseLong(value);
        } catch (NumberFormatException e) {
            // longer than a long: out of range by definition
            return Optional.empty();
        }
        for (E constant : constants) {
            if (constant.ordinal() == code) {
                return Optional.of(constant);
            }
        }
        return Optional.empty();
    }
}
