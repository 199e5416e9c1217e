package com.quickbite.menuservice.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.quickbite.menuservice.util.EnumTokenParser;

import java.util.Optional;

public enum DietaryTag implements CodedEnum {
    VEGETARIAN("Vegetarian"),
    VEGAN("Vegan"),
    GLUTEN_FREE("GlutenFree"),
    DAIRY_FREE("DairyFree"),
    SPICY("Spicy");

    private final String token;

    DietaryTag(String token) {
        this.token = token;
    }

    @Override
    @JsonValue
    public String getToken() {
        return token;
    }

    public static Optional<DietaryTag> fromToken(String raw) {
        return EnumTokenParser.resolve(DietaryTag.class, raw);
    }
}
